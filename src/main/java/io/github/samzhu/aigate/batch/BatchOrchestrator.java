package io.github.samzhu.aigate.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.github.samzhu.aigate.config.GatewayProperties;
import io.github.samzhu.aigate.config.ProviderConfig;
import io.github.samzhu.aigate.exception.FailureKind;
import io.github.samzhu.aigate.exception.GatewayException;
import io.github.samzhu.aigate.exception.ProviderException;
import io.github.samzhu.aigate.provider.Capability;
import io.github.samzhu.aigate.provider.MediaAttachment;
import io.github.samzhu.aigate.provider.PromptContext;
import io.github.samzhu.aigate.provider.ProviderClient;
import io.github.samzhu.aigate.provider.ProviderRegistry;

/**
 * 批次協調器
 *
 * <p>將一個有序批次對應到多次供應商呼叫，並組成一對一的回應：
 * <ol>
 *   <li>依能力（Capability）從 {@link ProviderRegistry} 取得供應商</li>
 *   <li>依輸入順序提交每個項目，單一呼叫最多同時 {@code maxConcurrency} 個供應商呼叫</li>
 *   <li>每個項目獨立：失敗（供應商錯誤、逾時、無效回應）只影響該項目</li>
 *   <li>等待全部項目完成後，依輸入順序組成 {@link ResponseItem}</li>
 * </ol>
 *
 * <p>保證：輸出長度等於輸入長度，且 {@code output[i].id == input[i].id}。
 *
 * <p>每個項目的呼叫以 Resilience4j 組合：{@link CircuitBreaker} 包住 {@link TimeLimiter}，
 * 逾時會計入熔斷器失敗率。項目從取得併發名額後開始計時，超過期限即以
 * {@code PROVIDER_TIMEOUT} 結束並中斷執行中的呼叫；併發名額則在供應商呼叫真正結束時才釋放，
 * 忽略中斷的呼叫不會讓同時進行的呼叫數超過上限。
 *
 * <p>取消：{@link BatchCancellation} 觸發時取消所有進行中的呼叫，丟棄已完成的結果並拋出
 * {@code CANCELLED}。
 *
 * <p>不做重試；熔斷器開路時項目直接以 {@code PROVIDER_UNAVAILABLE} 結束。
 *
 * @see ProviderResult
 * @see FailurePolicy
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final long PERMIT_POLL_MILLIS = 50;

    private final ProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService providerExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final int maxConcurrency;

    public BatchOrchestrator(
            ProviderRegistry providerRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            TimeLimiterRegistry timeLimiterRegistry,
            @Qualifier(ProviderConfig.PROVIDER_EXECUTOR) ExecutorService providerExecutor,
            @Qualifier(ProviderConfig.PROVIDER_TIMEOUT_SCHEDULER) ScheduledExecutorService timeoutScheduler,
            GatewayProperties gatewayProperties) {
        this.providerRegistry = providerRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.providerExecutor = providerExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.maxConcurrency = gatewayProperties.batch().maxConcurrency();
    }

    /**
     * 處理批次
     *
     * @param batch 已驗證的批次
     * @param capability 端點固定的能力
     * @param cancellation 呼叫取消訊號
     * @return 與輸入順序一致的回應項目
     * @throws GatewayException {@code CANCELLED}，呼叫被取消時
     */
    public List<ResponseItem> process(Batch batch, Capability capability, BatchCancellation cancellation) {
        if (batch.isEmpty()) {
            return List.of();
        }

        Optional<ProviderClient> resolved = providerRegistry.resolve(capability);
        if (resolved.isEmpty()) {
            String message = "No provider configured for " + capability.displayName();
            log.warn("{}: items={}", message, batch.size());
            return batch.items().stream()
                .map(item -> ResponseItem.failure(item, FailureKind.PROVIDER_UNAVAILABLE, message))
                .toList();
        }

        ProviderClient client = resolved.get();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(client.providerId());
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(client.providerId());
        long startTime = System.currentTimeMillis();

        Semaphore permits = new Semaphore(maxConcurrency);
        List<CompletableFuture<ProviderResult>> slots = new CopyOnWriteArrayList<>();
        List<ProviderCall> calls = new CopyOnWriteArrayList<>();
        cancellation.onCancel(() -> cancelAll(slots, calls));

        boolean completed = false;
        try {
            for (RequestItem item : batch.items()) {
                acquirePermit(permits, cancellation);
                ProviderCall call = new ProviderCall(item, capability, client, permits);
                calls.add(call);
                slots.add(submit(call, circuitBreaker, timeLimiter));
            }
            awaitAll(slots);
            if (cancellation.isCancelled()) {
                throw GatewayException.cancelled("Batch cancelled by client");
            }
            completed = true;
        } finally {
            if (!completed) {
                cancelAll(slots, calls);
            }
        }

        List<ResponseItem> responses = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            responses.add(slots.get(i).join().toResponseItem(batch.items().get(i)));
        }

        long failed = responses.stream().filter(response -> !response.isSuccess()).count();
        log.debug("Batch processed: provider={}, capability={}, items={}, failed={}, latencyMs={}",
            client.providerId(), capability, batch.size(), failed, System.currentTimeMillis() - startTime);
        return responses;
    }

    /**
     * 提交單一項目，回傳必定以 {@link ProviderResult} 完成（或因取消而取消）的 slot
     *
     * <p>熔斷器在外層，TimeLimiter 逾時產生的 {@link TimeoutException} 會被記錄為失敗。
     */
    private CompletableFuture<ProviderResult> submit(ProviderCall call, CircuitBreaker circuitBreaker,
                                                     TimeLimiter timeLimiter) {
        Supplier<CompletionStage<String>> timed =
            () -> timeLimiter.executeCompletionStage(timeoutScheduler, () -> call.start(providerExecutor));
        Supplier<CompletionStage<String>> guarded = CircuitBreaker.decorateCompletionStage(circuitBreaker, timed);
        return guarded.get()
            .toCompletableFuture()
            .handle((value, error) -> {
                if (error == null) {
                    return ProviderResult.success(value);
                }
                call.releaseUnlessStarted();
                return toFailure(call, timeLimiter, unwrap(error));
            });
    }

    private static ProviderResult toFailure(ProviderCall call, TimeLimiter timeLimiter, Throwable error) {
        String providerId = call.client.providerId();
        String itemId = call.item.id();
        if (error instanceof TimeoutException) {
            call.abort();
            long timeoutMillis = timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis();
            log.warn("Provider call timed out: provider={}, itemId={}, timeoutMs={}",
                providerId, itemId, timeoutMillis);
            return ProviderResult.failure(FailureKind.PROVIDER_TIMEOUT,
                providerId + " did not respond within " + timeoutMillis + " ms");
        }
        if (error instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open: provider={}, itemId={}", providerId, itemId);
            return ProviderResult.failure(FailureKind.PROVIDER_UNAVAILABLE,
                providerId + " is temporarily unavailable");
        }
        if (error instanceof ProviderException e) {
            log.warn("Provider call failed: provider={}, itemId={}, kind={}, message={}",
                providerId, itemId, e.getKind(), e.getMessage());
            return ProviderResult.failure(e.getKind(), e.getMessage());
        }
        if (error instanceof RejectedExecutionException) {
            log.error("Provider executor rejected item: itemId={}", itemId, error);
            return ProviderResult.failure(FailureKind.INTERNAL, "Gateway is shutting down");
        }
        log.error("Unexpected provider failure: provider={}, itemId={}, error={}",
            providerId, itemId, error.getMessage(), error);
        return ProviderResult.failure(FailureKind.INTERNAL, "Unexpected provider failure");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String call(ProviderClient client, Capability capability, RequestItem item) {
        String value = switch (capability) {
            case TEXT_GENERATION -> client.generateText(item.guide(), new PromptContext(item.label(), item.sample()));
            case IMAGE_ANALYSIS -> client.analyzeImage(requireMedia(item, capability), item.guide());
            case AUDIO_TRANSCRIPTION -> client.transcribeAudio(requireMedia(item, capability).get(0), item.guide());
        };
        if (value == null) {
            throw ProviderException.invalidResponse(client.providerId(), client.providerId() + " returned no content");
        }
        return value;
    }

    private static List<MediaAttachment> requireMedia(RequestItem item, Capability capability) {
        if (!item.hasMedia()) {
            throw new IllegalStateException("Item '" + item.id() + "' has no media for " + capability.displayName());
        }
        return item.media();
    }

    private static void acquirePermit(Semaphore permits, BatchCancellation cancellation) {
        try {
            while (!permits.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    throw GatewayException.cancelled("Batch cancelled by client");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GatewayException.cancelled("Batch processing interrupted");
        }
        if (cancellation.isCancelled()) {
            permits.release();
            throw GatewayException.cancelled("Batch cancelled by client");
        }
    }

    private static void awaitAll(List<CompletableFuture<ProviderResult>> slots) {
        try {
            CompletableFuture.allOf(slots.toArray(CompletableFuture[]::new)).join();
        } catch (CancellationException | CompletionException e) {
            // slots only ever complete exceptionally through cancellation
            throw GatewayException.cancelled("Batch cancelled by client");
        }
    }

    private static void cancelAll(List<CompletableFuture<ProviderResult>> slots, List<ProviderCall> calls) {
        slots.forEach(slot -> slot.cancel(false));
        calls.forEach(ProviderCall::abort);
    }

    /**
     * 單一項目的供應商呼叫
     *
     * <p>持有一個併發名額，只在工作執行緒結束呼叫後歸還；呼叫從未開始（熔斷器開路、
     * 執行緒池拒絕、開始前即被取消）時由取得歸還權的一方歸還。名額只歸還一次。
     */
    private static final class ProviderCall {

        private final RequestItem item;
        private final Capability capability;
        private final ProviderClient client;
        private final Semaphore permits;
        private final CompletableFuture<String> result = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final AtomicBoolean aborted = new AtomicBoolean();
        private volatile Future<?> task;

        ProviderCall(RequestItem item, Capability capability, ProviderClient client, Semaphore permits) {
            this.item = item;
            this.capability = capability;
            this.client = client;
            this.permits = permits;
        }

        CompletableFuture<String> start(ExecutorService executor) {
            try {
                task = executor.submit(this::run);
            } catch (RejectedExecutionException e) {
                releaseUnlessStarted();
                result.completeExceptionally(e);
                return result;
            }
            if (aborted.get()) {
                task.cancel(true);
            }
            return result;
        }

        void abort() {
            if (!aborted.compareAndSet(false, true)) {
                return;
            }
            Future<?> current = task;
            if (current != null) {
                current.cancel(true);
            }
            releaseUnlessStarted();
            result.cancel(false);
        }

        private void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                result.complete(call(client, capability, item));
            } catch (RuntimeException e) {
                if (aborted.get()) {
                    log.debug("Aborted provider call ended: provider={}, itemId={}, error={}",
                        client.providerId(), item.id(), e.toString());
                }
                result.completeExceptionally(e);
            } finally {
                permits.release();
            }
        }

        void releaseUnlessStarted() {
            if (claimed.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
