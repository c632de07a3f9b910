package com.crossreview.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("cancel runs callbacks exactly once")
    void callbacksOnce() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("callbacks registered after cancellation run immediately")
    void lateRegistration() {
        var token = new CancellationToken();
        token.cancel();
        var calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("unregistered callbacks do not run")
    void unregister() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet).unregister();

        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("a child follows its parent but not the other way round")
    void child() {
        var parent = new CancellationToken();
        CancellationToken.Linked linked = parent.child();

        linked.token().cancel();
        assertFalse(parent.isCancelled());

        CancellationToken.Linked second = parent.child();
        parent.cancel();
        assertTrue(second.token().isCancelled());
    }

    @Test
    @DisplayName("a failing callback does not stop the rest")
    void failingCallback() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(() -> { throw new IllegalStateException("boom"); });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }
}
