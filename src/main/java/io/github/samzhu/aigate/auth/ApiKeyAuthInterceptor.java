package io.github.samzhu.aigate.auth;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.aigate.config.GatewayProperties;
import io.github.samzhu.aigate.exception.FailureKind;
import io.github.samzhu.aigate.exception.GrpcExceptionTranslator;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

/**
 * API Key 驗證攔截器
 *
 * <p>在伺服器層級註冊一次，對每個呼叫在進入 handler 之前執行：
 * <ol>
 *   <li>公開方法（{@code gateway.auth.public-methods}）直接放行</li>
 *   <li>從 metadata {@code api-key} 取出 Key 並交給 {@link ApiKeyRegistry} 比對</li>
 *   <li>驗證失敗：以 {@code UNAUTHENTICATED} 關閉呼叫，handler 不會被呼叫</li>
 *   <li>驗證成功：將 {@link AuthContext.Authenticated} 放入 {@link GrpcRequestContext#AUTH_CONTEXT}</li>
 * </ol>
 *
 * <p>{@code gateway.auth.enabled=false} 時整個檢查停用（僅供本機開發）。
 */
@Component
public class ApiKeyAuthInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthInterceptor.class);

    static final String INVALID_API_KEY_MESSAGE = "Invalid API key";

    private final ApiKeyRegistry apiKeyRegistry;
    private final Metadata.Key<String> apiKeyHeader;
    private final Set<String> publicMethods;
    private final boolean enabled;

    public ApiKeyAuthInterceptor(ApiKeyRegistry apiKeyRegistry, GatewayProperties properties) {
        GatewayProperties.AuthSettings auth = properties.auth();
        this.apiKeyRegistry = apiKeyRegistry;
        this.apiKeyHeader = Metadata.Key.of(auth.headerName(), Metadata.ASCII_STRING_MARSHALLER);
        this.publicMethods = Set.copyOf(auth.publicMethods());
        this.enabled = auth.enabled();
        if (!enabled) {
            log.warn("API key authentication is DISABLED (gateway.auth.enabled=false), all calls are accepted");
        }
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        String method = call.getMethodDescriptor().getFullMethodName();
        if (!enabled || publicMethods.contains(method)) {
            return next.startCall(call, headers);
        }

        AuthContext authContext = apiKeyRegistry.authenticate(headers.get(apiKeyHeader));
        if (authContext instanceof AuthContext.Rejected rejected) {
            log.warn("Rejected unauthenticated call: method={}, reason={}", method, rejected.reason());
            call.close(Status.UNAUTHENTICATED.withDescription(INVALID_API_KEY_MESSAGE),
                GrpcExceptionTranslator.trailersFor(FailureKind.UNAUTHENTICATED));
            return new ServerCall.Listener<ReqT>() {
            };
        }

        log.debug("Authenticated call: method={}, caller={}", method,
            ((AuthContext.Authenticated) authContext).callerId());
        Context context = Context.current().withValue(GrpcRequestContext.AUTH_CONTEXT, authContext);
        return Contexts.interceptCall(context, call, headers, next);
    }
}
