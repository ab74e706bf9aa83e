package io.github.samzhu.aigate.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * 全域 gRPC 異常轉換器
 *
 * <p>將內部異常統一轉換為穩定的 gRPC 狀態碼，只回傳 (kind, 可讀訊息)，不暴露堆疊細節。
 * 錯誤分類另外放在 trailer {@code error-kind}，方便客戶端程式判斷。
 *
 * <p>對應關係：
 * <ul>
 *   <li>{@code UNAUTHENTICATED} → {@link Status.Code#UNAUTHENTICATED}</li>
 *   <li>{@code INVALID_ARGUMENT} → {@link Status.Code#INVALID_ARGUMENT}</li>
 *   <li>{@code PROVIDER_UNAVAILABLE} → {@link Status.Code#UNAVAILABLE}</li>
 *   <li>{@code PROVIDER_TIMEOUT} → {@link Status.Code#DEADLINE_EXCEEDED}</li>
 *   <li>{@code PROVIDER_INVALID_RESPONSE} → {@link Status.Code#INTERNAL}</li>
 *   <li>{@code CANCELLED} → {@link Status.Code#CANCELLED}</li>
 *   <li>{@code INTERNAL} 及其他未預期異常 → {@link Status.Code#INTERNAL}</li>
 * </ul>
 *
 * @see FailureKind
 */
@Component
public class GrpcExceptionTranslator {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionTranslator.class);

    public static final Metadata.Key<String> ERROR_KIND_KEY =
        Metadata.Key.of("error-kind", Metadata.ASCII_STRING_MARSHALLER);

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    /**
     * 將任意異常轉換為可回傳給客戶端的 {@link StatusRuntimeException}
     */
    public StatusRuntimeException translate(Throwable e) {
        if (e instanceof StatusRuntimeException statusException) {
            return statusException;
        }
        if (e instanceof GatewayException gatewayException) {
            FailureKind kind = gatewayException.getKind();
            if (kind == FailureKind.INTERNAL) {
                log.error("Internal gateway error: {}", e.getMessage(), e);
            } else {
                log.warn("Request failed: kind={}, message={}", kind, e.getMessage());
            }
            return toStatusException(kind, gatewayException.getMessage());
        }
        log.error("Unexpected error: {}", e.getMessage(), e);
        return toStatusException(FailureKind.INTERNAL, INTERNAL_ERROR_MESSAGE);
    }

    public StatusRuntimeException toStatusException(FailureKind kind, String message) {
        return statusFor(kind).withDescription(message).asRuntimeException(trailersFor(kind));
    }

    public static Status statusFor(FailureKind kind) {
        return switch (kind) {
            case UNAUTHENTICATED -> Status.UNAUTHENTICATED;
            case INVALID_ARGUMENT -> Status.INVALID_ARGUMENT;
            case PROVIDER_UNAVAILABLE -> Status.UNAVAILABLE;
            case PROVIDER_TIMEOUT -> Status.DEADLINE_EXCEEDED;
            case CANCELLED -> Status.CANCELLED;
            case PROVIDER_INVALID_RESPONSE, INTERNAL -> Status.INTERNAL;
        };
    }

    public static Metadata trailersFor(FailureKind kind) {
        Metadata trailers = new Metadata();
        trailers.put(ERROR_KIND_KEY, kind.name());
        return trailers;
    }
}
