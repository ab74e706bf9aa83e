package io.github.samzhu.aigate.config;

/**
 * 呼叫端 API Key 配置
 *
 * <p>每個 API Key 配置包含：
 * <ul>
 *   <li>{@code alias} - 人類可讀的別名，作為呼叫端識別碼寫入日誌（不暴露實際 Key）</li>
 *   <li>{@code value} - 呼叫端在 {@code api-key} metadata 帶入的 Key</li>
 * </ul>
 *
 * <p>{@code value} 允許空白，以便從未設定的環境變數綁定；空白的 Key 永遠不會通過驗證。
 *
 * <p>配置範例：
 * <pre>
 * gateway:
 *   auth:
 *     api-keys:
 *       - alias: "backend"
 *         value: ${GRPC_SECRET_API_KEY_1:}
 * </pre>
 *
 * @param alias API Key 別名（必填，用於追蹤）
 * @param value 實際的 API Key
 * @see GatewayProperties.AuthSettings
 */
public record ApiKeyConfig(
    String alias,
    String value
) {
    public ApiKeyConfig {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("API Key alias cannot be blank");
        }
        if (value == null) {
            value = "";
        }
    }

    public boolean isUsable() {
        return !value.isBlank();
    }
}
