package com.tokenwatch.indexer.util;

import com.tokenwatch.indexer.modules.chain.rpc.RpcException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @Test
    void succeedsAfterThreeTransientFailuresWithGrowingBackoff() {
        RetryPolicy policy = new RetryPolicy(5, 100, 0, recordingSleeper);
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("eth_getLogs", () -> {
            if (calls.incrementAndGet() <= 3) {
                throw new RpcException("429 Too Many Requests", true);
            }
            return "logs";
        });

        assertEquals("logs", result);
        assertEquals(4, calls.get());
        assertEquals(List.of(200L, 400L, 800L), sleeps);
    }

    @Test
    void rethrowsLastFailureWhenAttemptsAreExhausted() {
        RetryPolicy policy = new RetryPolicy(3, 10, 0, recordingSleeper);
        AtomicInteger calls = new AtomicInteger();

        RpcException thrown = assertThrows(RpcException.class, () -> policy.execute("eth_blockNumber", () -> {
            throw new RpcException("timeout #" + calls.incrementAndGet(), true);
        }));

        assertEquals("timeout #3", thrown.getMessage());
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void doesNotRetryPermanentFailures() {
        RetryPolicy policy = new RetryPolicy(6, 10, 0, recordingSleeper);
        AtomicInteger calls = new AtomicInteger();
        RpcException permanent = new RpcException("invalid params", false);

        RpcException thrown = assertThrows(RpcException.class, () -> policy.execute("eth_getLogs", () -> {
            calls.incrementAndGet();
            throw permanent;
        }));

        assertSame(permanent, thrown);
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void wrapsCheckedFailuresAfterRetrying() {
        RetryPolicy policy = new RetryPolicy(2, 10, 0, recordingSleeper);

        RpcException thrown = assertThrows(RpcException.class, () -> policy.execute("eth_getLogs", () -> {
            throw new IOException("connection reset");
        }));

        assertTrue(thrown.getCause() instanceof IOException);
        assertFalse(thrown.isTransient());
        assertEquals(List.of(20L), sleeps);
    }

    @Test
    void delayDoublesPerAttemptAndAddsBoundedJitter() {
        RetryPolicy policy = new RetryPolicy(6, 1000, 300, recordingSleeper,
                RetryPolicy::isTransient, ceiling -> ceiling);

        assertEquals(0L, policy.delayBeforeAttempt(1));
        assertEquals(2300L, policy.delayBeforeAttempt(2));
        assertEquals(4300L, policy.delayBeforeAttempt(3));
        assertEquals(32300L, policy.delayBeforeAttempt(6));
    }

    @Test
    void randomJitterStaysWithinBounds() {
        RetryPolicy policy = new RetryPolicy(6, 1000, 300, recordingSleeper);

        for (int i = 0; i < 200; i++) {
            long delay = policy.delayBeforeAttempt(2);
            assertTrue(delay >= 2000L && delay <= 2300L, "delay out of range: " + delay);
        }
    }

    @Test
    void classifiesIoAndTransientRpcFailuresAsRetryable() {
        assertTrue(RetryPolicy.isTransient(new IOException("reset")));
        assertTrue(RetryPolicy.isTransient(new RpcException("rate limited", true)));
        assertFalse(RetryPolicy.isTransient(new RpcException("execution reverted", false)));
        assertFalse(RetryPolicy.isTransient(new IllegalStateException("bug")));
    }

    @Test
    void rejectsNonPositiveAttemptBudget() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 10, 0, recordingSleeper));
    }
}
