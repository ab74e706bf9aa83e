package io.github.samzhu.aigate.provider;

import java.util.Base64;
import java.util.Objects;

/**
 * 影像或音訊附件
 *
 * <p>內容在建構與讀取時皆會複製，確保不可變。
 *
 * @param content 原始位元組
 * @param mimeType MIME 類型（例如 {@code image/png}、{@code audio/mp3}）
 */
public record MediaAttachment(
    byte[] content,
    String mimeType
) {
    public MediaAttachment {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(mimeType, "mimeType");
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    public int size() {
        return content.length;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(content);
    }

    public String toDataUri() {
        return "data:" + mimeType + ";base64," + toBase64();
    }

    /**
     * 由 MIME 子類型推得副檔名（{@code audio/wav} → {@code wav}），無法判斷時使用預設值
     */
    public String extension(String defaultExtension) {
        int slash = mimeType.indexOf('/');
        if (slash < 0 || slash == mimeType.length() - 1) {
            return defaultExtension;
        }
        return mimeType.substring(slash + 1);
    }

    @Override
    public String toString() {
        return "MediaAttachment{mimeType=" + mimeType + ", size=" + content.length + '}';
    }
}
