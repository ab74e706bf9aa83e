package io.github.samzhu.aigate.batch;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 批次取消訊號
 *
 * <p>由 gRPC handler 在客戶端取消呼叫時觸發，{@link BatchOrchestrator} 註冊回呼以取消進行中的供應商呼叫。
 * 在取消之後註冊的回呼會立即執行。
 */
public final class BatchCancellation {

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    /**
     * 永遠不會被取消的訊號（測試或非 gRPC 呼叫端使用）
     */
    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        callbacks.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled) {
            callback.run();
        }
    }
}
