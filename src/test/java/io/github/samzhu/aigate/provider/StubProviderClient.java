package io.github.samzhu.aigate.provider;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 測試用供應商：依設定的函式回應，並記錄呼叫次數、最大同時呼叫數與被中斷的呼叫數
 */
public class StubProviderClient implements ProviderClient {

    private final String providerId;
    private final BiFunction<String, PromptContext, String> textHandler;
    private final BiFunction<List<MediaAttachment>, String, String> mediaHandler;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger interrupted = new AtomicInteger();

    public StubProviderClient(String providerId, BiFunction<String, PromptContext, String> textHandler) {
        this(providerId, textHandler, (media, prompt) -> "media:" + media.size());
    }

    public StubProviderClient(String providerId,
                              BiFunction<String, PromptContext, String> textHandler,
                              BiFunction<List<MediaAttachment>, String, String> mediaHandler) {
        this.providerId = providerId;
        this.textHandler = textHandler;
        this.mediaHandler = mediaHandler;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public Set<Capability> capabilities() {
        return EnumSet.allOf(Capability.class);
    }

    @Override
    public String generateText(String prompt, PromptContext context) {
        return track(() -> textHandler.apply(prompt, context));
    }

    @Override
    public String analyzeImage(List<MediaAttachment> images, String prompt) {
        return track(() -> mediaHandler.apply(images, prompt));
    }

    @Override
    public String transcribeAudio(MediaAttachment audio, String prompt) {
        return track(() -> mediaHandler.apply(List.of(audio), prompt));
    }

    public int calls() {
        return calls.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int interrupted() {
        return interrupted.get();
    }

    private String track(Supplier<String> call) {
        calls.incrementAndGet();
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            return call.get();
        } finally {
            if (Thread.currentThread().isInterrupted()) {
                interrupted.incrementAndGet();
            }
            inFlight.decrementAndGet();
        }
    }

    /**
     * 測試中模擬供應商延遲，被中斷時結束等待
     */
    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    /**
     * 模擬不理會中斷的阻塞呼叫（例如卡在 socket 讀取），等滿時間後才恢復中斷旗標
     */
    public static void sleepIgnoringInterrupts(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        boolean interrupted = false;
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
