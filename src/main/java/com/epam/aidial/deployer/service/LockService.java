package com.epam.aidial.deployer.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Simple spin-lock keyed by string. Locks live in the process: records and artifacts are owned by a single deployer.
 */
@Slf4j
public class LockService {

    private static final long WAIT_MIN = TimeUnit.MILLISECONDS.toNanos(1);
    private static final long WAIT_MAX = TimeUnit.MILLISECONDS.toNanos(128);

    private final ConcurrentMap<String, Long> owners = new ConcurrentHashMap<>();

    public Lock lock(String key) {
        String id = id(key);
        long owner = ThreadLocalRandom.current().nextLong();

        long interval = WAIT_MIN;
        while (!tryLock(id, owner)) {
            LockSupport.parkNanos(interval);
            interval = Math.min(2 * interval, WAIT_MAX);
        }

        return () -> unlock(id, owner);
    }

    /**
     * @return the lock or null if it is not acquired within the timeout
     */
    @Nullable
    public Lock lock(String key, long timeoutMs) {
        String id = id(key);
        long owner = ThreadLocalRandom.current().nextLong();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        long interval = WAIT_MIN;
        while (!tryLock(id, owner)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            LockSupport.parkNanos(Math.min(interval, remaining));
            interval = Math.min(2 * interval, WAIT_MAX);
        }

        return () -> unlock(id, owner);
    }

    @Nullable
    public Lock tryLock(String key) {
        String id = id(key);
        long owner = ThreadLocalRandom.current().nextLong();
        return tryLock(id, owner) ? () -> unlock(id, owner) : null;
    }

    public <T> T underLock(String key, Supplier<T> function) {
        try (var ignored = lock(key)) {
            return function.get();
        }
    }

    private boolean tryLock(String id, long owner) {
        return owners.putIfAbsent(id, owner) == null;
    }

    private void unlock(String id, long owner) {
        boolean ok = owners.remove(id, owner);
        if (!ok) {
            log.error("Lock service failed to unlock: {}", id);
        }
    }

    private static String id(String key) {
        return "lock:" + key;
    }

    public interface Lock extends AutoCloseable {
        @Override
        void close();
    }
}
