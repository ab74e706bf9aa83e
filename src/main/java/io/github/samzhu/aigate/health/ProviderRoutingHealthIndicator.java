package io.github.samzhu.aigate.health;

import java.util.Map;
import java.util.TreeMap;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.aigate.provider.Capability;
import io.github.samzhu.aigate.provider.ProviderRegistry;

/**
 * 供應商路由健康指標
 *
 * <p>每個能力回報路由到的供應商與是否已設定。任一能力沒有可用供應商時為 DOWN，
 * 該能力的批次項目會全部以 {@code PROVIDER_UNAVAILABLE} 回應。
 */
@Component
public class ProviderRoutingHealthIndicator implements HealthIndicator {

    private final ProviderRegistry providerRegistry;

    public ProviderRoutingHealthIndicator(ProviderRegistry providerRegistry) {
        this.providerRegistry = providerRegistry;
    }

    @Override
    public Health health() {
        Map<String, String> routes = new TreeMap<>();
        boolean allAvailable = true;
        for (Capability capability : Capability.values()) {
            String providerId = providerRegistry.routedProviderId(capability).orElse("none");
            boolean available = providerRegistry.resolve(capability).isPresent();
            allAvailable &= available;
            routes.put(capability.displayName(), providerId + (available ? "" : " (not configured)"));
        }

        Health.Builder builder = allAvailable ? Health.up() : Health.down();
        return builder
            .withDetail("providers", providerRegistry.providerIds())
            .withDetail("routing", routes)
            .build();
    }
}
