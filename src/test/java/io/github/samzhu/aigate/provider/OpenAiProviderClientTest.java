package io.github.samzhu.aigate.provider;

import java.net.SocketTimeoutException;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.aigate.config.ProviderProperties;
import io.github.samzhu.aigate.exception.FailureKind;
import io.github.samzhu.aigate.exception.ProviderException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OpenAiProviderClientTest {

    private static final String CHAT_URL = "https://api.openai.com/v1/chat/completions";

    private MockRestServiceServer server;
    private OpenAiProviderClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        ProviderProperties properties = new ProviderProperties(null, null, null, null, null,
            new ProviderProperties.Vendor(null, "sk-test", null, null, null), null, null);
        client = new OpenAiProviderClient(properties.openai(), properties.language(), builder, new ObjectMapper());
    }

    @Test
    @DisplayName("Text generation sends the guide as system prompt and label/sample as user message")
    void generateText() {
        server.expect(requestTo(CHAT_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
            .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
            .andExpect(jsonPath("$.temperature").value(0))
            .andExpect(jsonPath("$.messages[0].role").value("system"))
            .andExpect(jsonPath("$.messages[0].content").value("Write a note\n\nPlease respond in Vietnamese."))
            .andExpect(jsonPath("$.messages[1].content").value("Label: L1\n\nSample:\nS1"))
            .andRespond(withSuccess("""
                {"choices":[{"message":{"role":"assistant","content":"generated note"}}]}
                """, MediaType.APPLICATION_JSON));

        String value = client.generateText("Write a note", new PromptContext("L1", "S1"));

        assertEquals("generated note", value);
        server.verify();
    }

    @Test
    @DisplayName("Image analysis numbers each image and embeds it as a base64 data URI with its own mime type")
    void analyzeImage() {
        server.expect(requestTo(CHAT_URL))
            .andExpect(jsonPath("$.model").value("gpt-4.1"))
            .andExpect(jsonPath("$.messages[1].content.length()").value(4))
            .andExpect(jsonPath("$.messages[1].content[0].text").value("Image 1"))
            .andExpect(jsonPath("$.messages[1].content[1].image_url.url").value("data:image/png;base64,AQID"))
            .andExpect(jsonPath("$.messages[1].content[2].text").value("Image 2"))
            .andExpect(jsonPath("$.messages[1].content[3].image_url.url").value("data:image/jpeg;base64,BA=="))
            .andRespond(withSuccess("""
                {"choices":[{"message":{"content":"a receipt"}}]}
                """, MediaType.APPLICATION_JSON));

        String value = client.analyzeImage(List.of(
            new MediaAttachment(new byte[] {1, 2, 3}, "image/png"),
            new MediaAttachment(new byte[] {4}, "image/jpeg")), "Describe");

        assertEquals("a receipt", value);
    }

    @Test
    @DisplayName("Audio transcription posts multipart form data and trims the plain text reply")
    void transcribeAudio() {
        server.expect(requestTo("https://api.openai.com/v1/audio/transcriptions"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
            .andRespond(withSuccess("  xin chao  \n", MediaType.TEXT_PLAIN));

        String value = client.transcribeAudio(new MediaAttachment(new byte[] {9, 9}, "audio/mp3"), "");

        assertEquals("xin chao", value);
    }

    @Test
    @DisplayName("Non-2xx vendor status maps to PROVIDER_UNAVAILABLE")
    void upstreamErrorStatus() {
        server.expect(requestTo(CHAT_URL)).andRespond(withServiceUnavailable());

        ProviderException thrown = assertThrows(ProviderException.class,
            () -> client.generateText("g", new PromptContext("L1", "")));

        assertEquals(FailureKind.PROVIDER_UNAVAILABLE, thrown.getKind());
        assertEquals("openai", thrown.getProviderId());
        assertEquals("openai chat completion failed with status 503", thrown.getMessage());
    }

    @Test
    @DisplayName("Socket timeout maps to PROVIDER_TIMEOUT")
    void upstreamTimeout() {
        server.expect(requestTo(CHAT_URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        ProviderException thrown = assertThrows(ProviderException.class,
            () -> client.generateText("g", new PromptContext("L1", "")));

        assertEquals(FailureKind.PROVIDER_TIMEOUT, thrown.getKind());
    }

    @Test
    @DisplayName("Malformed JSON or missing content maps to PROVIDER_INVALID_RESPONSE")
    void invalidResponse() {
        server.expect(requestTo(CHAT_URL)).andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));
        server.expect(requestTo(CHAT_URL)).andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        ProviderException malformed = assertThrows(ProviderException.class,
            () -> client.generateText("g", new PromptContext("L1", "")));
        ProviderException empty = assertThrows(ProviderException.class,
            () -> client.generateText("g", new PromptContext("L1", "")));

        assertEquals(FailureKind.PROVIDER_INVALID_RESPONSE, malformed.getKind());
        assertEquals(FailureKind.PROVIDER_INVALID_RESPONSE, empty.getKind());
    }
}
