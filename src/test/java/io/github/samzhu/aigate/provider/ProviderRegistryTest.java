package io.github.samzhu.aigate.provider;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.aigate.config.ProviderProperties;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRegistryTest {

    @Test
    @DisplayName("Resolves the configured provider routed for each capability")
    void resolvesRoutedProvider() {
        StubProviderClient openai = new StubProviderClient("openai", (p, c) -> "o");
        StubProviderClient google = new StubProviderClient("google", (p, c) -> "g");

        ProviderRegistry registry = new ProviderRegistry(List.of(openai, google), Map.of(
            Capability.TEXT_GENERATION, "google",
            Capability.IMAGE_ANALYSIS, "openai"));

        assertSame(google, registry.resolve(Capability.TEXT_GENERATION).orElseThrow());
        assertSame(openai, registry.resolve(Capability.IMAGE_ANALYSIS).orElseThrow());
        assertTrue(registry.resolve(Capability.AUDIO_TRANSCRIPTION).isEmpty());
    }

    @Test
    @DisplayName("Routing to an unconfigured provider resolves to empty instead of failing")
    void unconfiguredProvider() {
        ProviderRegistry registry = new ProviderRegistry(List.of(), Map.of(Capability.TEXT_GENERATION, "anthropic"));

        assertTrue(registry.resolve(Capability.TEXT_GENERATION).isEmpty());
        assertEquals("anthropic", registry.routedProviderId(Capability.TEXT_GENERATION).orElseThrow());
    }

    @Test
    @DisplayName("Routing a capability to a provider that lacks it fails at startup")
    void rejectsUnsupportedRoute() {
        ProviderProperties properties = new ProviderProperties(null, null, null, null, null, null,
            new ProviderProperties.Vendor(null, "ak", null, null, null), null);
        AnthropicProviderClient anthropic = new AnthropicProviderClient(properties.anthropic(),
            properties.language(), RestClient.builder(), new ObjectMapper());

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> new ProviderRegistry(List.of(anthropic), Map.of(Capability.AUDIO_TRANSCRIPTION, "anthropic")));
        assertEquals("Provider 'anthropic' does not support audio transcription", thrown.getMessage());
    }

    @Test
    @DisplayName("Duplicate provider ids are rejected")
    void rejectsDuplicateIds() {
        assertThrows(IllegalStateException.class, () -> new ProviderRegistry(List.of(
            new StubProviderClient("openai", (p, c) -> "a"),
            new StubProviderClient("openai", (p, c) -> "b")), Map.of()));
    }
}
