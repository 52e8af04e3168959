package com.example.autoschedule.schedule;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserScheduleLocksTest {

    private final UserScheduleLocks locks = new UserScheduleLocks();

    @Test
    void withLock_serializesRunsOfSameUser() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return locks.withLock("same-user", () -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return active.decrementAndGet();
                    });
                }));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(locks.isLocked("same-user")).isFalse();
        assertThat(locks.trackedUsers()).isZero();
    }

    @Test
    void withLock_isReentrantAndReleasesOnFailure() {
        String result = locks.withLock("u", () -> locks.withLock("u", () -> "nested"));
        assertThat(result).isEqualTo("nested");

        assertThatThrownBy(() -> locks.withLock("u", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(locks.isLocked("u")).isFalse();
        assertThat(locks.trackedUsers()).isZero();
    }
}
