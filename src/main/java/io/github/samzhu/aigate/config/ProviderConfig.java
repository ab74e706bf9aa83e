package io.github.samzhu.aigate.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.github.samzhu.aigate.exception.FailureKind;
import io.github.samzhu.aigate.exception.ProviderException;
import io.github.samzhu.aigate.provider.AnthropicProviderClient;
import io.github.samzhu.aigate.provider.GeminiProviderClient;
import io.github.samzhu.aigate.provider.OpenAiProviderClient;
import io.github.samzhu.aigate.provider.ProviderClient;
import io.github.samzhu.aigate.provider.ProviderRegistry;

/**
 * AI 供應商配置
 *
 * <p>建立：
 * <ul>
 *   <li>{@link ProviderRegistry} - 只包含已設定 API Key 的供應商，以及能力路由</li>
 *   <li>{@link CircuitBreakerRegistry} - 每個供應商一個熔斷器，逾時也計入失敗率</li>
 *   <li>{@link TimeLimiterRegistry} - 每個項目的呼叫期限（{@code gateway.batch.item-timeout}）</li>
 *   <li>供應商呼叫執行緒池與 TimeLimiter 使用的排程器</li>
 * </ul>
 *
 * <p>RestClient 使用 Spring 自動配置的 {@code RestClient.Builder}，
 * 每個供應商各自 clone 一份並套用連線／讀取逾時。讀取逾時不超過項目期限，
 * 逾時的項目不會讓底層連線繼續佔用併發名額。
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    public static final String PROVIDER_EXECUTOR = "providerExecutor";
    public static final String PROVIDER_TIMEOUT_SCHEDULER = "providerTimeoutScheduler";

    @Bean
    public ProviderRegistry providerRegistry(ProviderProperties properties,
                                             GatewayProperties gatewayProperties,
                                             RestClient.Builder restClientBuilder,
                                             ObjectMapper objectMapper) {
        Duration readTimeout = effectiveReadTimeout(properties.readTimeout(), gatewayProperties.batch().itemTimeout());
        if (readTimeout.compareTo(properties.readTimeout()) < 0) {
            log.info("Provider read timeout capped at item timeout: configured={}, effective={}",
                properties.readTimeout(), readTimeout);
        }
        List<ProviderClient> clients = new ArrayList<>();
        if (properties.openai().isConfigured()) {
            clients.add(new OpenAiProviderClient(properties.openai(), properties.language(),
                vendorBuilder(restClientBuilder, properties.connectTimeout(), readTimeout), objectMapper));
        }
        if (properties.anthropic().isConfigured()) {
            clients.add(new AnthropicProviderClient(properties.anthropic(), properties.language(),
                vendorBuilder(restClientBuilder, properties.connectTimeout(), readTimeout), objectMapper));
        }
        if (properties.google().isConfigured()) {
            clients.add(new GeminiProviderClient(properties.google(), properties.language(),
                vendorBuilder(restClientBuilder, properties.connectTimeout(), readTimeout), objectMapper));
        }
        if (clients.isEmpty()) {
            log.warn("No AI provider API keys configured, every batch item will fail with PROVIDER_UNAVAILABLE");
        }
        return new ProviderRegistry(clients, properties.routing().asMap());
    }

    /**
     * 供應商熔斷器
     *
     * <p>只記錄供應商不可用與逾時（包含 TimeLimiter 的 {@link TimeoutException}）；
     * 無效回應不代表供應商故障，不計入失敗率。
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ProviderProperties properties) {
        ProviderProperties.CircuitBreakerSettings settings = properties.circuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(settings.failureRateThreshold())
            .slidingWindowSize(settings.slidingWindowSize())
            .minimumNumberOfCalls(settings.minimumNumberOfCalls())
            .waitDurationInOpenState(settings.waitDurationInOpenState())
            .recordException(ProviderConfig::isProviderFailure)
            .build();
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * 項目呼叫期限
     *
     * <p>逾時後 TimeLimiter 取消執行中的呼叫；實際的中斷由 {@code BatchOrchestrator} 負責。
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(GatewayProperties gatewayProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
            .timeoutDuration(gatewayProperties.batch().itemTimeout())
            .cancelRunningFuture(true)
            .build();
        return TimeLimiterRegistry.of(config);
    }

    /**
     * 供應商呼叫執行緒池
     *
     * <p>同時進行的呼叫數由 {@code BatchOrchestrator} 以每次呼叫的 Semaphore 限制。
     */
    @Bean(name = PROVIDER_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("provider-"));
    }

    /**
     * TimeLimiter 用來排定期限的排程器
     */
    @Bean(name = PROVIDER_TIMEOUT_SCHEDULER, destroyMethod = "shutdownNow")
    public ScheduledExecutorService providerTimeoutScheduler() {
        ScheduledThreadPoolExecutor scheduler =
            new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("provider-timeout-"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * 熔斷器的失敗判定，{@link CompletionException} 會先拆開
     */
    public static boolean isProviderFailure(Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
            ? throwable.getCause()
            : throwable;
        if (cause instanceof TimeoutException) {
            return true;
        }
        return cause instanceof ProviderException providerException
            && providerException.getKind() != FailureKind.PROVIDER_INVALID_RESPONSE;
    }

    static Duration effectiveReadTimeout(Duration readTimeout, Duration itemTimeout) {
        return readTimeout.compareTo(itemTimeout) > 0 ? itemTimeout : readTimeout;
    }

    private static RestClient.Builder vendorBuilder(RestClient.Builder restClientBuilder,
                                                    Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return restClientBuilder.clone().requestFactory(requestFactory);
    }
}
