package io.github.samzhu.aigate.auth;

/**
 * 單次呼叫的驗證結果
 *
 * <p>由 {@link ApiKeyAuthInterceptor} 在每次呼叫開始時建立一次，之後不再變動。
 * 只有 {@link Authenticated} 會被放入 gRPC {@code Context}；{@link Rejected} 的呼叫在進入 handler 前就被關閉。
 */
public sealed interface AuthContext permits AuthContext.Authenticated, AuthContext.Rejected {

    /**
     * @param callerId 呼叫端識別碼（對應 API Key 的 alias）
     */
    record Authenticated(String callerId) implements AuthContext {
    }

    /**
     * @param reason 拒絕原因（只寫入日誌）
     */
    record Rejected(String reason) implements AuthContext {
    }

    static AuthContext authenticated(String callerId) {
        return new Authenticated(callerId);
    }

    static AuthContext rejected(String reason) {
        return new Rejected(reason);
    }

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }
}
