package io.github.samzhu.aigate.batch;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchCancellationTest {

    @Test
    @DisplayName("Callbacks run once on cancel, and immediately when registered after cancel")
    void runsCallbacks() {
        BatchCancellation cancellation = new BatchCancellation();
        AtomicInteger before = new AtomicInteger();
        AtomicInteger after = new AtomicInteger();

        cancellation.onCancel(before::incrementAndGet);
        cancellation.cancel();
        cancellation.cancel();
        cancellation.onCancel(after::incrementAndGet);

        assertTrue(cancellation.isCancelled());
        assertEquals(1, before.get());
        assertEquals(1, after.get());
    }

    @Test
    @DisplayName("none() is not cancelled")
    void none() {
        assertFalse(BatchCancellation.none().isCancelled());
    }
}
