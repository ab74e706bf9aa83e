package io.github.samzhu.aigate.auth;

import java.util.Optional;

import io.grpc.Context;

/**
 * gRPC 呼叫範圍內的 Context Key
 *
 * <p>{@link ApiKeyAuthInterceptor} 寫入，handler 透過 {@link Context#current()} 讀取。
 */
public final class GrpcRequestContext {

    public static final Context.Key<AuthContext> AUTH_CONTEXT = Context.key("aigate.auth-context");

    private GrpcRequestContext() {
    }

    /**
     * 取得目前呼叫的呼叫端識別碼
     *
     * @return 已驗證呼叫的 alias；未驗證（公開方法或驗證停用）時為空
     */
    public static Optional<String> currentCallerId() {
        return AUTH_CONTEXT.get() instanceof AuthContext.Authenticated authenticated
            ? Optional.of(authenticated.callerId())
            : Optional.empty();
    }
}
