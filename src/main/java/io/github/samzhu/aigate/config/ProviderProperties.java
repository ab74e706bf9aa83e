package io.github.samzhu.aigate.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.aigate.provider.Capability;
import io.github.samzhu.aigate.provider.Language;

/**
 * AI 供應商配置屬性
 *
 * <p>從 application.yaml 中的 {@code gateway.providers} 前綴載入配置：
 * <ul>
 *   <li>{@code language} - 回應語言（預設 {@code VI_VN}）</li>
 *   <li>{@code connect-timeout} / {@code read-timeout} - HTTP 連線與讀取逾時</li>
 *   <li>{@code routing} - 各能力（Capability）對應的供應商 id</li>
 *   <li>{@code circuit-breaker} - 每個供應商的熔斷器參數</li>
 *   <li>{@code openai} / {@code anthropic} / {@code google} - 各供應商的 API Key 與模型</li>
 * </ul>
 *
 * <p>只有設定了 {@code api-key} 的供應商才會被建立。
 *
 * <p>配置範例：
 * <pre>
 * gateway:
 *   providers:
 *     language: en-us
 *     routing:
 *       text-generation: anthropic
 *       image-analysis: openai
 *       audio-transcription: google
 *     anthropic:
 *       api-key: ${ANTHROPIC_API_KEY:}
 *       model: claude-3-5-haiku-20241022
 * </pre>
 */
@ConfigurationProperties(prefix = "gateway.providers")
public record ProviderProperties(
    Language language,
    Duration connectTimeout,
    Duration readTimeout,
    Routing routing,
    CircuitBreakerSettings circuitBreaker,
    Vendor openai,
    Vendor anthropic,
    Vendor google
) {
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String GOOGLE = "google";

    public ProviderProperties {
        if (language == null) {
            language = Language.VI_VN;
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(120);
        }
        if (routing == null) {
            routing = new Routing(null, null, null);
        }
        if (circuitBreaker == null) {
            circuitBreaker = new CircuitBreakerSettings(null, null, null, null);
        }
        openai = Vendor.withDefaults(openai,
            "https://api.openai.com", "gpt-4o-mini", "gpt-4.1", "gpt-4o-transcribe");
        anthropic = Vendor.withDefaults(anthropic,
            "https://api.anthropic.com", "claude-3-5-haiku-20241022", "claude-opus-4-20250514", null);
        google = Vendor.withDefaults(google,
            "https://generativelanguage.googleapis.com", "gemini-2.0-flash", "gemini-2.0-flash",
            "gemini-2.5-pro-preview-06-05");
    }

    /**
     * 單一供應商設定
     *
     * @param baseUrl API 基礎 URL
     * @param apiKey 供應商 API Key（空白代表不啟用）
     * @param model 文字生成模型
     * @param visionModel 影像分析模型
     * @param transcriptionModel 語音轉文字模型
     */
    public record Vendor(
        String baseUrl,
        String apiKey,
        String model,
        String visionModel,
        String transcriptionModel
    ) {
        static Vendor withDefaults(Vendor vendor, String baseUrl, String model,
                                   String visionModel, String transcriptionModel) {
            if (vendor == null) {
                return new Vendor(baseUrl, "", model, visionModel, transcriptionModel);
            }
            return new Vendor(
                orDefault(vendor.baseUrl(), baseUrl),
                vendor.apiKey() == null ? "" : vendor.apiKey().trim(),
                orDefault(vendor.model(), model),
                orDefault(vendor.visionModel(), visionModel),
                orDefault(vendor.transcriptionModel(), transcriptionModel));
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }

        private static String orDefault(String value, String defaultValue) {
            return value == null || value.isBlank() ? defaultValue : value;
        }
    }

    /**
     * 能力對應的供應商 id（{@code openai}、{@code anthropic} 或 {@code google}）
     */
    public record Routing(
        String textGeneration,
        String imageAnalysis,
        String audioTranscription
    ) {
        public Routing {
            textGeneration = normalize(textGeneration);
            imageAnalysis = normalize(imageAnalysis);
            audioTranscription = normalize(audioTranscription);
        }

        public Map<Capability, String> asMap() {
            Map<Capability, String> routes = new EnumMap<>(Capability.class);
            routes.put(Capability.TEXT_GENERATION, textGeneration);
            routes.put(Capability.IMAGE_ANALYSIS, imageAnalysis);
            routes.put(Capability.AUDIO_TRANSCRIPTION, audioTranscription);
            return routes;
        }

        private static String normalize(String providerId) {
            if (providerId == null || providerId.isBlank()) {
                return OPENAI;
            }
            String id = providerId.trim().toLowerCase();
            if (!id.equals(OPENAI) && !id.equals(ANTHROPIC) && !id.equals(GOOGLE)) {
                throw new IllegalArgumentException("Unknown provider in gateway.providers.routing: " + providerId);
            }
            return id;
        }
    }

    /**
     * 熔斷器參數，套用到每個供應商各自的熔斷器
     */
    public record CircuitBreakerSettings(
        Float failureRateThreshold,
        Integer slidingWindowSize,
        Integer minimumNumberOfCalls,
        Duration waitDurationInOpenState
    ) {
        public CircuitBreakerSettings {
            if (failureRateThreshold == null) {
                failureRateThreshold = 50f;
            }
            if (slidingWindowSize == null) {
                slidingWindowSize = 20;
            }
            if (minimumNumberOfCalls == null) {
                minimumNumberOfCalls = 10;
            }
            if (waitDurationInOpenState == null) {
                waitDurationInOpenState = Duration.ofSeconds(30);
            }
        }
    }
}
