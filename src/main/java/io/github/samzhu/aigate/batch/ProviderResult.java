package io.github.samzhu.aigate.batch;

import java.util.Objects;

import io.github.samzhu.aigate.exception.FailureKind;

/**
 * 單一項目的供應商呼叫結果
 *
 * <p>以標記結果取代例外，讓單一項目失敗不會中斷整個批次。
 */
public sealed interface ProviderResult permits ProviderResult.Success, ProviderResult.Failure {

    record Success(String value) implements ProviderResult {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure(FailureKind kind, String message) implements ProviderResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }
    }

    static ProviderResult success(String value) {
        return new Success(value);
    }

    static ProviderResult failure(FailureKind kind, String message) {
        return new Failure(kind, message);
    }

    /**
     * 轉為帶有原始 id 與標籤的回應項目
     */
    default ResponseItem toResponseItem(RequestItem item) {
        if (this instanceof Success success) {
            return ResponseItem.success(item, success.value());
        }
        Failure failure = (Failure) this;
        return ResponseItem.failure(item, failure.kind(), failure.message());
    }
}
