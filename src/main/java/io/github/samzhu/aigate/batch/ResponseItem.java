package io.github.samzhu.aigate.batch;

import io.github.samzhu.aigate.exception.FailureKind;

/**
 * 批次中的單一回應項目，與請求項目一對一
 *
 * <p>成功時 {@code value} 有值；失敗時 {@code value} 為 {@code null}，
 * 並帶有 {@code errorKind} 與 {@code errorMessage}。
 *
 * @param id 對應請求項目的 id
 * @param label 對應請求項目的標籤
 * @param value 生成內容（失敗時為 {@code null}）
 * @param errorKind 失敗分類（成功時為 {@code null}）
 * @param errorMessage 失敗訊息（成功時為 {@code null}）
 */
public record ResponseItem(
    String id,
    String label,
    String value,
    FailureKind errorKind,
    String errorMessage
) {
    public static ResponseItem success(RequestItem item, String value) {
        return new ResponseItem(item.id(), item.label(), value, null, null);
    }

    public static ResponseItem failure(RequestItem item, FailureKind kind, String message) {
        return new ResponseItem(item.id(), item.label(), null, kind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
