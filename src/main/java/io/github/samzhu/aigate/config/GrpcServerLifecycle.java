package io.github.samzhu.aigate.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import io.github.samzhu.aigate.auth.ApiKeyAuthInterceptor;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;

/**
 * gRPC 伺服器生命週期
 *
 * <p>隨 Spring 容器啟動與關閉：
 * <ul>
 *   <li>啟動：註冊所有 {@link BindableService} Bean，並在伺服器層級套用一次 {@link ApiKeyAuthInterceptor}</li>
 *   <li>關閉：停止接受新呼叫，等待進行中的呼叫最多 {@code gateway.grpc.shutdown-grace-period}，再強制結束</li>
 * </ul>
 */
@Component
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private final GatewayProperties.GrpcSettings settings;
    private final List<BindableService> services;
    private final ApiKeyAuthInterceptor authInterceptor;

    private volatile Server server;

    public GrpcServerLifecycle(GatewayProperties properties,
                               List<BindableService> services,
                               ApiKeyAuthInterceptor authInterceptor) {
        this.settings = properties.grpc();
        this.services = services;
        this.authInterceptor = authInterceptor;
    }

    @Override
    public void start() {
        NettyServerBuilder builder = NettyServerBuilder.forPort(settings.port());
        services.forEach(builder::addService);
        if (settings.reflectionEnabled()) {
            builder.addService(ProtoReflectionService.newInstance());
        }
        builder.intercept(authInterceptor);

        try {
            server = builder.build().start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start gRPC server on port " + settings.port(), e);
        }
        log.info("gRPC server started: port={}, services={}, reflection={}",
            server.getPort(),
            services.stream().map(service -> service.bindService().getServiceDescriptor().getName()).toList(),
            settings.reflectionEnabled());
    }

    @Override
    public void stop() {
        Server current = server;
        if (current == null) {
            return;
        }
        log.info("Shutting down gRPC server, grace period {}", settings.shutdownGracePeriod());
        current.shutdown();
        try {
            if (!current.awaitTermination(settings.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("gRPC server did not terminate within the grace period, forcing shutdown");
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
        server = null;
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    /**
     * 實際監聽的埠（設定為 0 時由系統分配）
     *
     * @return 監聽埠，伺服器未啟動時為 -1
     */
    public int getPort() {
        Server current = server;
        return current != null ? current.getPort() : -1;
    }
}
