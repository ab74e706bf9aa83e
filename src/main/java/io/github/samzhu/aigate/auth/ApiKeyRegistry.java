package io.github.samzhu.aigate.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.aigate.config.ApiKeyConfig;
import io.github.samzhu.aigate.config.GatewayProperties;

/**
 * 呼叫端 API Key 清單
 *
 * <p>啟動時從 {@code gateway.auth.api-keys} 載入一次，之後不再變動（不支援輪換）。
 * 空白的 Key（例如未設定的環境變數）會被忽略。
 *
 * <p>比對使用 {@link MessageDigest#isEqual(byte[], byte[])} 並走訪所有 Key，
 * 比對時間不因哪一把 Key 相符而不同。日誌只記錄 alias。
 *
 * @see ApiKeyConfig
 */
@Service
public class ApiKeyRegistry {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyRegistry.class);

    private final List<ApiKeyConfig> apiKeys;

    public ApiKeyRegistry(GatewayProperties properties) {
        this.apiKeys = properties.auth().apiKeys().stream()
            .filter(ApiKeyConfig::isUsable)
            .toList();
        if (apiKeys.isEmpty()) {
            log.warn("No caller API keys configured. Please configure gateway.auth.api-keys in application.yaml");
        } else {
            log.info("Loaded {} caller API key(s): {}",
                apiKeys.size(),
                apiKeys.stream().map(ApiKeyConfig::alias).toList());
        }
    }

    /**
     * 驗證呼叫端帶入的 API Key
     *
     * @param presentedKey metadata 中的 Key，可為 {@code null}
     * @return 相符時為 {@link AuthContext.Authenticated}，否則為 {@link AuthContext.Rejected}
     */
    public AuthContext authenticate(String presentedKey) {
        if (StringUtils.isBlank(presentedKey)) {
            return AuthContext.rejected("missing api key");
        }
        byte[] presented = presentedKey.getBytes(StandardCharsets.UTF_8);
        ApiKeyConfig matched = null;
        for (ApiKeyConfig apiKey : apiKeys) {
            if (MessageDigest.isEqual(presented, apiKey.value().getBytes(StandardCharsets.UTF_8)) && matched == null) {
                matched = apiKey;
            }
        }
        return matched != null
            ? AuthContext.authenticated(matched.alias())
            : AuthContext.rejected("unknown api key");
    }

    public int getKeyCount() {
        return apiKeys.size();
    }
}
