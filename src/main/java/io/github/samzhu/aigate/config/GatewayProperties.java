package io.github.samzhu.aigate.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.aigate.batch.FailurePolicy;

/**
 * 閘道配置屬性
 *
 * <p>從 application.yaml 中的 {@code gateway} 前綴載入配置：
 * <ul>
 *   <li>{@code grpc} - gRPC 伺服器監聽埠與關閉寬限期</li>
 *   <li>{@code auth} - 呼叫端 API Key 與免驗證方法</li>
 *   <li>{@code batch} - 批次上限、每次呼叫的併發上限、單項逾時與失敗策略</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * gateway:
 *   grpc:
 *     port: 50051
 *   auth:
 *     header-name: api-key
 *     api-keys:
 *       - alias: "primary"
 *         value: secret-1
 *   batch:
 *     max-concurrency: 4
 *     item-timeout: 60s
 *     failure-policies:
 *       note-generation: partial
 * </pre>
 */
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
    GrpcSettings grpc,
    AuthSettings auth,
    BatchSettings batch
) {
    public GatewayProperties {
        if (grpc == null) {
            grpc = new GrpcSettings(null, null, null);
        }
        if (auth == null) {
            auth = new AuthSettings(null, null, null, null);
        }
        if (batch == null) {
            batch = new BatchSettings(null, null, null, null);
        }
    }

    /**
     * @param port 監聽埠（預設 50051，0 代表隨機埠）
     * @param shutdownGracePeriod 關閉時等待進行中呼叫的時間（預設 30 秒）
     * @param reflectionEnabled 是否啟用 gRPC Server Reflection（預設啟用）
     */
    public record GrpcSettings(
        Integer port,
        Duration shutdownGracePeriod,
        Boolean reflectionEnabled
    ) {
        public GrpcSettings {
            if (port == null) {
                port = 50051;
            }
            if (port < 0) {
                throw new IllegalArgumentException("gRPC port cannot be negative");
            }
            if (shutdownGracePeriod == null) {
                shutdownGracePeriod = Duration.ofSeconds(30);
            }
            if (reflectionEnabled == null) {
                reflectionEnabled = true;
            }
        }
    }

    /**
     * @param enabled 是否啟用 API Key 驗證（預設啟用）
     * @param headerName 攜帶 API Key 的 metadata 名稱（預設 {@code api-key}）
     * @param apiKeys 允許的 API Key 清單
     * @param publicMethods 免驗證的完整 gRPC 方法名稱
     */
    public record AuthSettings(
        Boolean enabled,
        String headerName,
        List<ApiKeyConfig> apiKeys,
        Set<String> publicMethods
    ) {
        public static final String DEFAULT_HEADER_NAME = "api-key";
        public static final Set<String> DEFAULT_PUBLIC_METHODS = Set.of(
            "aigate.v1.HealthService/Health",
            "grpc.reflection.v1alpha.ServerReflection/ServerReflectionInfo");

        public AuthSettings {
            if (enabled == null) {
                enabled = true;
            }
            if (headerName == null || headerName.isBlank()) {
                headerName = DEFAULT_HEADER_NAME;
            }
            if (apiKeys == null) {
                apiKeys = List.of();
            }
            if (publicMethods == null) {
                publicMethods = DEFAULT_PUBLIC_METHODS;
            }
        }
    }

    /**
     * @param maxItems 單一批次的項目上限（預設 100）
     * @param maxConcurrency 單一呼叫同時進行的供應商呼叫上限（預設 4）
     * @param itemTimeout 單一項目的供應商呼叫期限（預設 60 秒）
     * @param failurePolicies 各端點的失敗策略，未列出者為 {@link FailurePolicy#PARTIAL}
     */
    public record BatchSettings(
        Integer maxItems,
        Integer maxConcurrency,
        Duration itemTimeout,
        Map<String, FailurePolicy> failurePolicies
    ) {
        public BatchSettings {
            if (maxItems == null) {
                maxItems = 100;
            }
            if (maxConcurrency == null) {
                maxConcurrency = 4;
            }
            if (maxItems < 1 || maxConcurrency < 1) {
                throw new IllegalArgumentException("gateway.batch.max-items and max-concurrency must be positive");
            }
            if (itemTimeout == null) {
                itemTimeout = Duration.ofSeconds(60);
            }
            if (itemTimeout.isNegative() || itemTimeout.isZero()) {
                throw new IllegalArgumentException("gateway.batch.item-timeout must be positive");
            }
            if (failurePolicies == null) {
                failurePolicies = Map.of();
            }
        }

        public FailurePolicy policyFor(String endpoint) {
            return failurePolicies.getOrDefault(endpoint, FailurePolicy.PARTIAL);
        }
    }
}
