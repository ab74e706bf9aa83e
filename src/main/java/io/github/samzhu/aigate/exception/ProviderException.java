package io.github.samzhu.aigate.exception;

/**
 * 供應商呼叫失敗
 *
 * <p>只會是三種供應商錯誤之一，由 {@code AbstractProviderClient} 依傳輸層結果分類：
 * <ul>
 *   <li>I/O 逾時 → {@link FailureKind#PROVIDER_TIMEOUT}</li>
 *   <li>其他 I/O 失敗或非 2xx 狀態 → {@link FailureKind#PROVIDER_UNAVAILABLE}</li>
 *   <li>回應為空或無法解析 → {@link FailureKind#PROVIDER_INVALID_RESPONSE}</li>
 * </ul>
 */
public class ProviderException extends GatewayException {

    private final String providerId;

    public ProviderException(FailureKind kind, String providerId, String message, Throwable cause) {
        super(requireProviderKind(kind), message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    public static ProviderException unavailable(String providerId, String message, Throwable cause) {
        return new ProviderException(FailureKind.PROVIDER_UNAVAILABLE, providerId, message, cause);
    }

    public static ProviderException timeout(String providerId, String message, Throwable cause) {
        return new ProviderException(FailureKind.PROVIDER_TIMEOUT, providerId, message, cause);
    }

    public static ProviderException invalidResponse(String providerId, String message) {
        return new ProviderException(FailureKind.PROVIDER_INVALID_RESPONSE, providerId, message, null);
    }

    public static ProviderException invalidResponse(String providerId, String message, Throwable cause) {
        return new ProviderException(FailureKind.PROVIDER_INVALID_RESPONSE, providerId, message, cause);
    }

    private static FailureKind requireProviderKind(FailureKind kind) {
        if (kind == null || !kind.isProviderFailure()) {
            throw new IllegalArgumentException("Not a provider failure kind: " + kind);
        }
        return kind;
    }
}
