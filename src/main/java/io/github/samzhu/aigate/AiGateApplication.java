package io.github.samzhu.aigate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AI gRPC Gateway 應用程式入口
 *
 * <p>以 gRPC 對外提供批次 AI 服務：
 * <ul>
 *   <li>呼叫端 API Key 驗證（metadata {@code api-key}）</li>
 *   <li>文字生成、影像分析、語音轉文字批次端點</li>
 *   <li>OpenAI / Anthropic / Google 供應商路由與熔斷</li>
 *   <li>Actuator 健康檢查（HTTP）</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AiGateApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiGateApplication.class, args);
	}

}
