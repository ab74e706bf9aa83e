package io.github.samzhu.aigate.exception;

import java.util.Objects;

/**
 * 閘道基礎執行期異常
 *
 * <p>攜帶穩定的 {@link FailureKind} 與可讀訊息，訊息會原樣回傳給呼叫端，
 * 因此不應包含堆疊或供應商內部細節。
 *
 * @see GrpcExceptionTranslator
 */
public class GatewayException extends RuntimeException {

    private final FailureKind kind;

    public GatewayException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GatewayException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind getKind() {
        return kind;
    }

    public static GatewayException invalidArgument(String message) {
        return new GatewayException(FailureKind.INVALID_ARGUMENT, message);
    }

    public static GatewayException cancelled(String message) {
        return new GatewayException(FailureKind.CANCELLED, message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{kind=" + kind + ", message=" + getMessage() + '}';
    }
}
