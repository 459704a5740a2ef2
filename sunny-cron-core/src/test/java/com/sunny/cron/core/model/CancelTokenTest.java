package com.sunny.cron.core.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancelToken 单元测试
 *
 * @author SunnyX6
 * @date 2026-10-13
 */
public class CancelTokenTest {

    @Test
    public void cancelTakesEffectOnce() {
        CancelToken token = new CancelToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    public void callbackRegisteredAfterCancelRunsImmediately() {
        CancelToken token = new CancelToken();
        token.cancel();

        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);
        assertEquals(1, calls.get());
    }

    @Test
    public void cancelAfterCompleteIsNoop() {
        CancelToken token = new CancelToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.complete();

        assertFalse(token.cancel());
        assertFalse(token.isCancelled());
        assertEquals(0, calls.get());
    }

    @Test
    public void failingCallbackDoesNotEscape() {
        CancelToken token = new CancelToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertEquals(1, calls.get());
    }
}
