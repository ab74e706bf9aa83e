package io.github.samzhu.aigate.provider;

import java.util.List;
import java.util.Set;

/**
 * AI 供應商客戶端
 *
 * <p>每個供應商一個實作，只負責把單一呼叫轉成供應商 API 請求並取回結果，
 * 不包含批次、重試或併發邏輯（由 {@code BatchOrchestrator} 負責）。
 *
 * <p>失敗時拋出 {@link io.github.samzhu.aigate.exception.ProviderException}：
 * <ul>
 *   <li>{@code PROVIDER_UNAVAILABLE} - 網路或供應商認證失敗</li>
 *   <li>{@code PROVIDER_TIMEOUT} - 超過設定的期限</li>
 *   <li>{@code PROVIDER_INVALID_RESPONSE} - 回應無法解析為預期的值</li>
 * </ul>
 *
 * <p>不支援的能力拋出 {@link UnsupportedOperationException}；
 * {@link ProviderRegistry} 會在啟動時拒絕這類路由設定。
 *
 * @see AbstractProviderClient
 */
public interface ProviderClient {

    /**
     * 供應商識別碼（{@code openai}、{@code anthropic}、{@code google}）
     */
    String providerId();

    Set<Capability> capabilities();

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    /**
     * 文字生成
     *
     * @param prompt 指示內容（系統提示）
     * @param context 項目標籤與範例
     * @return 生成的文字
     */
    String generateText(String prompt, PromptContext context);

    /**
     * 影像分析
     *
     * <p>多張影像在同一次請求中送出，依順序標為 {@code Image 1}、{@code Image 2}…
     *
     * @param images 影像（至少一張），各自帶 MIME 類型
     * @param prompt 分析指示（可為空白）
     * @return 分析結果
     */
    String analyzeImage(List<MediaAttachment> images, String prompt);

    /**
     * 語音轉文字
     *
     * @param audio 音訊
     * @param prompt 轉寫提示（可為空白）
     * @return 轉寫文字
     */
    String transcribeAudio(MediaAttachment audio, String prompt);
}
