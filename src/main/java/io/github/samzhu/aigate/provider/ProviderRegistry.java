package io.github.samzhu.aigate.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 能力到供應商的路由表
 *
 * <p>只包含已設定 API Key 的供應商。路由到未設定的供應商不是錯誤（該能力的項目會以
 * {@code PROVIDER_UNAVAILABLE} 回應），但路由到不支援該能力的供應商會在啟動時失敗。
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderClient> clients;
    private final Map<Capability, String> routing;

    public ProviderRegistry(Collection<? extends ProviderClient> clients, Map<Capability, String> routing) {
        Map<String, ProviderClient> byId = new LinkedHashMap<>();
        for (ProviderClient client : clients) {
            if (byId.putIfAbsent(client.providerId(), client) != null) {
                throw new IllegalStateException("Duplicate provider id: " + client.providerId());
            }
        }
        this.clients = Collections.unmodifiableMap(byId);
        Map<Capability, String> routes = new EnumMap<>(Capability.class);
        routes.putAll(routing);
        this.routing = Collections.unmodifiableMap(routes);

        for (Map.Entry<Capability, String> route : this.routing.entrySet()) {
            ProviderClient client = byId.get(route.getValue());
            if (client == null) {
                log.warn("Provider '{}' routed for {} is not configured", route.getValue(), route.getKey().displayName());
            } else if (!client.supports(route.getKey())) {
                throw new IllegalStateException(
                    "Provider '" + route.getValue() + "' does not support " + route.getKey().displayName());
            }
        }
        log.info("Loaded {} provider(s): {}, routing={}", byId.size(), byId.keySet(), this.routing);
    }

    /**
     * 取得處理指定能力的供應商
     *
     * @return 已設定的供應商，未路由或未設定時為空
     */
    public Optional<ProviderClient> resolve(Capability capability) {
        String providerId = routing.get(capability);
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(providerId));
    }

    public Optional<String> routedProviderId(Capability capability) {
        return Optional.ofNullable(routing.get(capability));
    }

    public Set<String> providerIds() {
        return clients.keySet();
    }

    public Map<Capability, String> routing() {
        return routing;
    }
}
