package com.sunny.notepillar.server.translation;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import com.sunny.notepillar.common.exception.InternalException;

/**
 * 笔记级互斥锁
 * 按笔记ID分段加锁，只在单进程内生效，跨进程依赖条件更新兜底
 *
 * @author Sunny
 * @date 2026-03-05
 */
public class NoteLockRegistry {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public NoteLockRegistry() {
        this(DEFAULT_STRIPES);
    }

    public NoteLockRegistry(int stripeCount) {
        this.stripes = new ReentrantLock[Math.max(1, stripeCount)];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * 在限定时间内获取锁，成功返回已持有的锁，超时返回 null
     */
    public ReentrantLock tryLock(Long noteId, Duration wait) {
        ReentrantLock lock = stripes[Math.floorMod(Long.hashCode(noteId), stripes.length)];
        try {
            return lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS) ? lock : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalException(e, "等待笔记锁被中断: noteId=%s", noteId);
        }
    }
}
