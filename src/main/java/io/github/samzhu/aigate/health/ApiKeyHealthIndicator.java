package io.github.samzhu.aigate.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.aigate.auth.ApiKeyRegistry;
import io.github.samzhu.aigate.config.GatewayProperties;

/**
 * 呼叫端 API Key 健康指標
 *
 * <p>健康狀態：
 * <ul>
 *   <li>UP - 至少有一個呼叫端 API Key，或驗證已停用</li>
 *   <li>DOWN - 驗證啟用但沒有任何可用的 API Key（所有受保護的呼叫都會被拒絕）</li>
 * </ul>
 *
 * <p>存取方式：{@code GET /actuator/health}
 *
 * <p>回應範例（健康）：
 * <pre>{@code
 * {
 *   "components": {
 *     "apiKey": {
 *       "status": "UP",
 *       "details": { "count": 2, "authEnabled": true }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @see ApiKeyRegistry
 */
@Component
public class ApiKeyHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyHealthIndicator.class);

    private final ApiKeyRegistry apiKeyRegistry;
    private final boolean authEnabled;

    public ApiKeyHealthIndicator(ApiKeyRegistry apiKeyRegistry, GatewayProperties properties) {
        this.apiKeyRegistry = apiKeyRegistry;
        this.authEnabled = properties.auth().enabled();
    }

    @Override
    public Health health() {
        int keyCount = apiKeyRegistry.getKeyCount();

        if (authEnabled && keyCount == 0) {
            log.warn("API Key health check failed: no caller keys configured");
            return Health.down()
                .withDetail("count", 0)
                .withDetail("authEnabled", true)
                .withDetail("message", "No caller API keys configured")
                .build();
        }

        log.debug("API Key health check passed: {} key(s) available", keyCount);
        return Health.up()
            .withDetail("count", keyCount)
            .withDetail("authEnabled", authEnabled)
            .build();
    }
}
