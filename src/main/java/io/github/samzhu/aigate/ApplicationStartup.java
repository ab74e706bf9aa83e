package io.github.samzhu.aigate;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import io.github.samzhu.aigate.auth.ApiKeyRegistry;
import io.github.samzhu.aigate.config.GrpcServerLifecycle;
import io.github.samzhu.aigate.provider.ProviderRegistry;

import jakarta.annotation.PostConstruct;

/**
 * 應用程式啟動處理器
 *
 * <p>在應用程式完全啟動後執行初始化任務，包括：
 * <ul>
 *   <li>驗證配置正確性（Profile 衝突檢查）</li>
 *   <li>輸出啟動資訊（gRPC 埠、供應商路由、JVM、建置資訊）</li>
 * </ul>
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
        .withZone(ZoneId.systemDefault());

    private final Environment env;
    private final Optional<BuildProperties> buildProperties;
    private final GrpcServerLifecycle grpcServer;
    private final ProviderRegistry providerRegistry;
    private final ApiKeyRegistry apiKeyRegistry;

    public ApplicationStartup(
            Environment env,
            Optional<BuildProperties> buildProperties,
            GrpcServerLifecycle grpcServer,
            ProviderRegistry providerRegistry,
            ApiKeyRegistry apiKeyRegistry) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.grpcServer = grpcServer;
        this.providerRegistry = providerRegistry;
        this.apiKeyRegistry = apiKeyRegistry;
    }

    /**
     * 檢查 Profile 配置，避免衝突的 Profile 同時啟用
     */
    @PostConstruct
    public void initApplication() {
        Collection<String> activeProfiles = Arrays.asList(env.getActiveProfiles());

        if (activeProfiles.contains("dev") && activeProfiles.contains("prod")) {
            log.error("配置錯誤！應用程式不應同時啟用 'dev' 和 'prod' 環境");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        logApplicationStartup();
    }

    private void logApplicationStartup() {
        String applicationName = env.getProperty("spring.application.name");
        String managementPort = env.getProperty("server.port", "8080");
        String hostAddress = "localhost";
        try {
            hostAddress = InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("無法取得主機名稱，使用 `localhost` 作為預設值");
        }

        String[] activeProfiles = env.getActiveProfiles();
        Object profiles = activeProfiles.length > 0
            ? activeProfiles
            : env.getDefaultProfiles();

        // JVM 資訊
        Runtime runtime = Runtime.getRuntime();
        String javaVersion = System.getProperty("java.version");
        String javaVendor = System.getProperty("java.vendor");
        long maxMemoryMB = runtime.maxMemory() / (1024 * 1024);
        int availableProcessors = runtime.availableProcessors();

        // 建置資訊
        String version = buildProperties.map(BuildProperties::getVersion).orElse("N/A");
        String buildTime = buildProperties
            .map(BuildProperties::getTime)
            .map(DATE_FORMATTER::format)
            .orElse("N/A");

        log.info("""

            ----------------------------------------------------------
            \t應用程式 '{}' 啟動完成！
            ----------------------------------------------------------
            \tgRPC 服務：
            \t  本機：   localhost:{}
            \t  外部：   {}:{}
            \t健康檢查：http://localhost:{}/actuator/health
            ----------------------------------------------------------
            \t執行環境： {}
            ----------------------------------------------------------
            \tAI 供應商：
            \t  已設定：  {}
            \t  路由：    {}
            \t呼叫端 API Key 數量：{}
            ----------------------------------------------------------
            \t建置資訊：
            \t  版本：   {}
            \t  建置時間：{}
            ----------------------------------------------------------
            \tJVM 資訊：
            \t  Java：   {} ({})
            \t  最大記憶體：{} MB
            \t  處理器數量：{}
            ----------------------------------------------------------""",
            applicationName,
            grpcServer.getPort(),
            hostAddress,
            grpcServer.getPort(),
            managementPort,
            profiles,
            providerRegistry.providerIds(),
            providerRegistry.routing(),
            apiKeyRegistry.getKeyCount(),
            version,
            buildTime,
            javaVersion,
            javaVendor,
            maxMemoryMB,
            availableProcessors
        );
    }
}
