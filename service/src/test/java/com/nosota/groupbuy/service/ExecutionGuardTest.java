package com.nosota.groupbuy.service;

import com.nosota.groupbuy.error.StateConflictException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionGuardTest {

    private final ExecutionGuard guard = new ExecutionGuard();

    @Test
    void execute_ShouldReturnActionResult() {
        assertThat(guard.execute("op", () -> 42)).isEqualTo(42);
        assertThat(guard.isHeldByCurrentThread()).isFalse();
    }

    @Test
    void execute_ReentrantCall_ShouldBeRejected() {
        assertThatThrownBy(() -> guard.execute("outer", () -> guard.execute("inner", () -> 1)))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("inner");

        assertThat(guard.isHeldByCurrentThread()).isFalse();
    }

    @Test
    void execute_FailingAction_ShouldReleaseGuard() {
        assertThatThrownBy(() -> guard.run("failing", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(guard.isHeldByCurrentThread()).isFalse();
        assertThat(guard.execute("next", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void execute_ConcurrentCalls_ShouldBeSerialized() throws Exception {
        int threads = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            Future<?>[] futures = new Future<?>[threads];
            for (int i = 0; i < threads; i++) {
                futures[i] = executor.submit(() -> {
                    start.await();
                    guard.run("concurrent", () -> {
                        int current = inside.incrementAndGet();
                        maxInside.accumulateAndGet(current, Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                    });
                    return null;
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }
}
