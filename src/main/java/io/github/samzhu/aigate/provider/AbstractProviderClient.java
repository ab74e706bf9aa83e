package io.github.samzhu.aigate.provider;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.function.Supplier;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.aigate.config.ProviderProperties;
import io.github.samzhu.aigate.exception.ProviderException;

/**
 * 以 Spring {@link RestClient} 呼叫供應商 HTTP API 的共用基底
 *
 * <p>負責：
 * <ul>
 *   <li>建立指向供應商 {@code baseUrl} 的 {@code RestClient}</li>
 *   <li>將傳輸層錯誤分類為 {@link ProviderException}</li>
 *   <li>解析 JSON 回應並擷取必要欄位</li>
 * </ul>
 *
 * <p>供應商錯誤回應只寫入日誌，不回傳給呼叫端。
 */
public abstract class AbstractProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractProviderClient.class);

    protected final RestClient restClient;
    protected final ObjectMapper objectMapper;
    protected final ProviderProperties.Vendor settings;
    protected final Language language;

    /**
     * 建構子
     *
     * <p>傳入的 {@code RestClient.Builder} 應已設定好逾時（見 {@code ProviderConfig}），
     * 此處只補上供應商的 {@code baseUrl}。
     *
     * @param settings 供應商設定
     * @param language 回應語言
     * @param restClientBuilder 已設定逾時的 RestClient.Builder
     * @param objectMapper JSON 物件映射器
     */
    protected AbstractProviderClient(ProviderProperties.Vendor settings, Language language,
                                     RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        this.settings = settings;
        this.language = language;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
            .baseUrl(settings.baseUrl())
            .build();
    }

    @Override
    public String generateText(String prompt, PromptContext context) {
        throw unsupported(Capability.TEXT_GENERATION);
    }

    @Override
    public String analyzeImage(List<MediaAttachment> images, String prompt) {
        throw unsupported(Capability.IMAGE_ANALYSIS);
    }

    @Override
    public String transcribeAudio(MediaAttachment audio, String prompt) {
        throw unsupported(Capability.AUDIO_TRANSCRIPTION);
    }

    /**
     * 執行請求並將回應解析為 JSON
     */
    protected JsonNode retrieveJson(String operation, Supplier<RestClient.RequestHeadersSpec<?>> request) {
        String body = retrieveText(operation, request);
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw ProviderException.invalidResponse(providerId(),
                "Malformed JSON from " + providerId() + " " + operation, e);
        }
    }

    /**
     * 執行請求並取回非空白的回應本文
     */
    protected String retrieveText(String operation, Supplier<RestClient.RequestHeadersSpec<?>> request) {
        long startTime = System.currentTimeMillis();
        String body;
        try {
            body = request.get().retrieve().body(String.class);
        } catch (RestClientResponseException e) {
            log.error("Upstream error: provider={}, operation={}, status={}, body={}",
                providerId(), operation, e.getStatusCode().value(), e.getResponseBodyAsString());
            throw ProviderException.unavailable(providerId(),
                providerId() + " " + operation + " failed with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.warn("Upstream timeout: provider={}, operation={}, latencyMs={}",
                    providerId(), operation, System.currentTimeMillis() - startTime);
                throw ProviderException.timeout(providerId(), providerId() + " " + operation + " timed out", e);
            }
            log.warn("Upstream unreachable: provider={}, operation={}, error={}",
                providerId(), operation, e.getMessage());
            throw ProviderException.unavailable(providerId(), providerId() + " is unreachable", e);
        } catch (RestClientException e) {
            log.warn("Upstream call failed: provider={}, operation={}, error={}",
                providerId(), operation, e.getMessage());
            throw ProviderException.unavailable(providerId(), providerId() + " " + operation + " failed", e);
        }

        if (StringUtils.isBlank(body)) {
            throw ProviderException.invalidResponse(providerId(),
                providerId() + " " + operation + " returned an empty body");
        }
        log.debug("Upstream call completed: provider={}, operation={}, latencyMs={}",
            providerId(), operation, System.currentTimeMillis() - startTime);
        return body;
    }

    /**
     * 取出必要的文字欄位，缺少或空白時視為無效回應
     */
    protected String requireText(JsonNode node, String operation) {
        if (node == null || node.isMissingNode() || node.isNull() || !node.isTextual()
                || node.asText().isBlank()) {
            throw ProviderException.invalidResponse(providerId(),
                providerId() + " " + operation + " response has no text content");
        }
        return node.asText();
    }

    protected String languageInstruction() {
        return "Please respond in " + language.displayName() + ".";
    }

    /**
     * 系統提示加上回應語言指示
     */
    protected String systemPrompt(String prompt) {
        if (StringUtils.isBlank(prompt)) {
            return languageInstruction();
        }
        return prompt + "\n\n" + languageInstruction();
    }

    private UnsupportedOperationException unsupported(Capability capability) {
        return new UnsupportedOperationException(providerId() + " does not support " + capability.displayName());
    }

    private static boolean isTimeout(Throwable e) {
        return ExceptionUtils.getThrowableList(e).stream()
            .anyMatch(t -> t instanceof SocketTimeoutException || t instanceof HttpTimeoutException);
    }
}
