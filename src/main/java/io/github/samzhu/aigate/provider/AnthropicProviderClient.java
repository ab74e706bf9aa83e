package io.github.samzhu.aigate.provider;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.aigate.config.ProviderProperties;

/**
 * Anthropic 供應商客戶端
 *
 * <p>透過 {@code POST /v1/messages} 提供文字生成與影像分析，不支援語音轉文字。
 *
 * @see <a href="https://platform.claude.com/docs/en/api/messages/create">Claude Messages API</a>
 */
public class AnthropicProviderClient extends AbstractProviderClient {

    private static final String ANTHROPIC_VERSION_HEADER = "anthropic-version";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int MAX_TOKENS = 1024;
    private static final Set<Capability> CAPABILITIES =
        EnumSet.of(Capability.TEXT_GENERATION, Capability.IMAGE_ANALYSIS);

    public AnthropicProviderClient(ProviderProperties.Vendor settings, Language language,
                                   RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        super(settings, language, restClientBuilder, objectMapper);
    }

    @Override
    public String providerId() {
        return ProviderProperties.ANTHROPIC;
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String generateText(String prompt, PromptContext context) {
        ObjectNode body = messagesRequest(settings.model(), prompt);
        ((ArrayNode) body.get("messages")).addObject()
            .put("role", "user")
            .put("content", context.toUserMessage());
        return messages("message", body);
    }

    @Override
    public String analyzeImage(List<MediaAttachment> images, String prompt) {
        ObjectNode body = messagesRequest(settings.visionModel(), prompt);
        ArrayNode content = ((ArrayNode) body.get("messages")).addObject()
            .put("role", "user")
            .putArray("content");
        for (int i = 0; i < images.size(); i++) {
            MediaAttachment image = images.get(i);
            content.addObject()
                .put("type", "image")
                .putObject("source")
                .put("type", "base64")
                .put("media_type", image.mimeType())
                .put("data", image.toBase64());
            content.addObject()
                .put("type", "text")
                .put("text", "Image " + (i + 1));
        }
        return messages("image analysis", body);
    }

    private ObjectNode messagesRequest(String model, String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", MAX_TOKENS);
        body.put("temperature", 0);
        body.put("system", systemPrompt(prompt));
        body.putArray("messages");
        return body;
    }

    private String messages(String operation, ObjectNode body) {
        JsonNode root = retrieveJson(operation, () -> restClient.post()
            .uri("/v1/messages")
            .header("x-api-key", settings.apiKey())
            .header(ANTHROPIC_VERSION_HEADER, ANTHROPIC_VERSION)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body.toString()));
        return requireText(root.path("content").path(0).path("text"), operation);
    }
}
