package com.example.autoschedule.schedule;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per user so that two reschedule runs for the same user never interleave their
 * clear and write steps. Runs for different users proceed in parallel.
 * <p>
 * An entry lives only while some thread holds or waits for it; the holder count is changed
 * inside {@code compute} so that removal never races with a thread about to lock.
 */
@Component
public class UserScheduleLocks {

    private final Map<String, UserLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String userId, Supplier<T> action) {
        UserLock entry = locks.compute(userId, (k, existing) -> {
            UserLock lock = existing != null ? existing : new UserLock();
            lock.holders++;
            return lock;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(userId, (k, lock) -> --lock.holders == 0 ? null : lock);
        }
    }

    public boolean isLocked(String userId) {
        UserLock entry = locks.get(userId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedUsers() {
        return locks.size();
    }

    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int holders;
    }
}
