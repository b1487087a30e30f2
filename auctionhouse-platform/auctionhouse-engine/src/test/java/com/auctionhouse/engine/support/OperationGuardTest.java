package com.auctionhouse.engine.support;

import com.auctionhouse.core.error.StateException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OperationGuardTest {

    @Test
    void nestedOperationIsRejected() {
        OperationGuard guard = new OperationGuard();

        assertThatThrownBy(() -> guard.run("outer", () -> guard.run("inner", () -> 1)))
                .isInstanceOf(StateException.class)
                .hasFieldOrPropertyWithValue("reason", "REENTRANT_CALL");
        assertThat(guard.isBusy()).isFalse();
    }

    @Test
    void readInsideOperationIsAllowed() {
        OperationGuard guard = new OperationGuard();

        int value = guard.run("outer", () -> guard.read(() -> 42));

        assertThat(value).isEqualTo(42);
    }

    @Test
    void operationsNeverOverlap() throws Exception {
        OperationGuard guard = new OperationGuard();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[200];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    return guard.run("op", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        inside.decrementAndGet();
                        return now;
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }
}
