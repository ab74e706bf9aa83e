package io.github.samzhu.aigate.provider;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.aigate.config.ProviderProperties;

/**
 * OpenAI 供應商客戶端
 *
 * <p>支援的能力：
 * <ul>
 *   <li>文字生成 - {@code POST /v1/chat/completions}</li>
 *   <li>影像分析 - {@code POST /v1/chat/completions}，影像以 base64 data URI 傳送</li>
 *   <li>語音轉文字 - {@code POST /v1/audio/transcriptions}（multipart，{@code response_format=text}）</li>
 * </ul>
 *
 * @see <a href="https://platform.openai.com/docs/api-reference/chat/create">Chat Completions API</a>
 * @see <a href="https://platform.openai.com/docs/api-reference/audio/createTranscription">Transcriptions API</a>
 */
public class OpenAiProviderClient extends AbstractProviderClient {

    private static final Set<Capability> CAPABILITIES = EnumSet.allOf(Capability.class);

    public OpenAiProviderClient(ProviderProperties.Vendor settings, Language language,
                                RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        super(settings, language, restClientBuilder, objectMapper);
    }

    @Override
    public String providerId() {
        return ProviderProperties.OPENAI;
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String generateText(String prompt, PromptContext context) {
        ObjectNode body = chatRequest(settings.model(), prompt);
        ((ArrayNode) body.get("messages")).addObject()
            .put("role", "user")
            .put("content", context.toUserMessage());
        return chatCompletion("chat completion", body);
    }

    @Override
    public String analyzeImage(List<MediaAttachment> images, String prompt) {
        ObjectNode body = chatRequest(settings.visionModel(), prompt);
        ObjectNode userMessage = ((ArrayNode) body.get("messages")).addObject().put("role", "user");
        ArrayNode content = userMessage.putArray("content");
        for (int i = 0; i < images.size(); i++) {
            content.addObject()
                .put("type", "text")
                .put("text", "Image " + (i + 1));
            content.addObject()
                .put("type", "image_url")
                .putObject("image_url")
                .put("url", images.get(i).toDataUri());
        }
        return chatCompletion("image analysis", body);
    }

    @Override
    public String transcribeAudio(MediaAttachment audio, String prompt) {
        String filename = "audio." + audio.extension("mp3");
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("file", new ByteArrayResource(audio.content()) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        parts.add("model", settings.transcriptionModel());
        parts.add("response_format", "text");
        parts.add("prompt", transcriptionPrompt(prompt));

        return retrieveText("audio transcription", () -> restClient.post()
            .uri("/v1/audio/transcriptions")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey())
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(parts)).trim();
    }

    private ObjectNode chatRequest(String model, String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", 0);
        body.putArray("messages").addObject()
            .put("role", "system")
            .put("content", systemPrompt(prompt));
        return body;
    }

    private String chatCompletion(String operation, ObjectNode body) {
        JsonNode root = retrieveJson(operation, () -> restClient.post()
            .uri("/v1/chat/completions")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body.toString()));
        return requireText(root.path("choices").path(0).path("message").path("content"), operation);
    }

    private String transcriptionPrompt(String prompt) {
        if (StringUtils.isBlank(prompt)) {
            return "The audio will mainly be in " + language.displayName()
                + ", however, they sometimes use terminology from other languages,"
                + " you should transcribe the text in multiple languages accordingly.";
        }
        return prompt + "\nTranscribe the following audio to text in " + language.displayName() + ".";
    }
}
