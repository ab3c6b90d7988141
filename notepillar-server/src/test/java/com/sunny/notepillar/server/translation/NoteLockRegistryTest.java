package com.sunny.notepillar.server.translation;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class NoteLockRegistryTest {

    @Test
    void tryLock_shouldTimeOutWhileAnotherThreadHoldsSameNote() throws Exception {
        NoteLockRegistry registry = new NoteLockRegistry(8);
        ReentrantLock held = registry.tryLock(5L, Duration.ofMillis(10));
        assertNotNull(held);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ReentrantLock> contended = executor.submit(() -> registry.tryLock(5L, Duration.ofMillis(20)));
            assertNull(contended.get(5, TimeUnit.SECONDS));

            held.unlock();
            Future<ReentrantLock> released = executor.submit(() -> {
                ReentrantLock lock = registry.tryLock(5L, Duration.ofMillis(200));
                if (lock != null) {
                    lock.unlock();
                }
                return lock;
            });
            assertNotNull(released.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
