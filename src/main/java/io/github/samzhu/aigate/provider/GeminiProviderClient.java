package io.github.samzhu.aigate.provider;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.aigate.config.ProviderProperties;

/**
 * Google Gemini 供應商客戶端
 *
 * <p>三種能力都使用 {@code POST /v1beta/models/{model}:generateContent}，
 * 影像與音訊以 {@code inline_data} 傳送。
 *
 * @see <a href="https://ai.google.dev/api/generate-content">Gemini generateContent API</a>
 */
public class GeminiProviderClient extends AbstractProviderClient {

    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final Set<Capability> CAPABILITIES = EnumSet.allOf(Capability.class);

    public GeminiProviderClient(ProviderProperties.Vendor settings, Language language,
                                RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        super(settings, language, restClientBuilder, objectMapper);
    }

    @Override
    public String providerId() {
        return ProviderProperties.GOOGLE;
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String generateText(String prompt, PromptContext context) {
        String content = StringUtils.defaultString(prompt) + "\n\nUser: " + context.toUserMessage()
            + "\n\n" + languageInstruction();
        ObjectNode body = contentRequest();
        parts(body).addObject().put("text", content);
        return generateContent("generate content", settings.model(), body);
    }

    @Override
    public String analyzeImage(List<MediaAttachment> images, String prompt) {
        ObjectNode body = contentRequest();
        ArrayNode parts = parts(body);
        parts.addObject().put("text", systemPrompt(prompt));
        for (int i = 0; i < images.size(); i++) {
            parts.addObject().put("text", "Image " + (i + 1));
            addInlineData(parts, images.get(i));
        }
        return generateContent("image analysis", settings.visionModel(), body);
    }

    @Override
    public String transcribeAudio(MediaAttachment audio, String prompt) {
        String instruction = StringUtils.isBlank(prompt)
            ? "Transcribe the following audio to text in " + language.displayName() + "."
            : prompt + "\nThe audio will mainly be in " + language.displayName()
                + ", however, they sometimes use terminology from other languages,"
                + " you should transcribe the text in multiple languages accordingly.";
        ObjectNode body = contentRequest();
        ArrayNode parts = parts(body);
        parts.addObject().put("text", instruction);
        addInlineData(parts, audio);
        return generateContent("audio transcription", settings.transcriptionModel(), body);
    }

    private ObjectNode contentRequest() {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents").addObject().putArray("parts");
        body.putObject("generationConfig").put("temperature", 0);
        return body;
    }

    private static ArrayNode parts(ObjectNode body) {
        return (ArrayNode) body.path("contents").path(0).path("parts");
    }

    private static void addInlineData(ArrayNode parts, MediaAttachment media) {
        parts.addObject()
            .putObject("inline_data")
            .put("mime_type", media.mimeType())
            .put("data", media.toBase64());
    }

    private String generateContent(String operation, String model, ObjectNode body) {
        JsonNode root = retrieveJson(operation, () -> restClient.post()
            .uri("/v1beta/models/{model}:generateContent", model)
            .header(API_KEY_HEADER, settings.apiKey())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body.toString()));
        return requireText(root.path("candidates").path(0).path("content").path("parts").path(0).path("text"),
            operation);
    }
}
