package io.github.samzhu.aigate.exception;

/**
 * 閘道錯誤分類
 *
 * <p>呼叫層級與項目層級共用同一組分類：
 * <ul>
 *   <li>{@code UNAUTHENTICATED} - 缺少或無效的 API Key（在 handler 執行前拒絕）</li>
 *   <li>{@code INVALID_ARGUMENT} - 批次格式錯誤（空白欄位、重複 id、超過上限）</li>
 *   <li>{@code PROVIDER_UNAVAILABLE} - 供應商網路/認證失敗、未設定或熔斷器開路</li>
 *   <li>{@code PROVIDER_TIMEOUT} - 供應商呼叫超過設定的期限</li>
 *   <li>{@code PROVIDER_INVALID_RESPONSE} - 供應商回應無法解析為預期的值</li>
 *   <li>{@code CANCELLED} - 客戶端取消呼叫</li>
 *   <li>{@code INTERNAL} - 未分類的非預期錯誤</li>
 * </ul>
 *
 * @see GrpcExceptionTranslator
 */
public enum FailureKind {
    UNAUTHENTICATED,
    INVALID_ARGUMENT,
    PROVIDER_UNAVAILABLE,
    PROVIDER_TIMEOUT,
    PROVIDER_INVALID_RESPONSE,
    CANCELLED,
    INTERNAL;

    /**
     * 是否為供應商層級（可隔離於單一項目）的錯誤
     */
    public boolean isProviderFailure() {
        return this == PROVIDER_UNAVAILABLE || this == PROVIDER_TIMEOUT || this == PROVIDER_INVALID_RESPONSE;
    }
}
