package com.ryuqq.queuestore.adapter.inmemory.storage;

import com.ryuqq.queuestore.core.exception.QueueFullException;
import com.ryuqq.queuestore.core.model.Frame;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered frame sequence of one destination, guarded by its own lock.
 *
 * <p>Every read and write of the deque happens under {@link #lock}, so operations on one
 * destination are linearizable while different destinations never contend.</p>
 *
 * <p><strong>Retirement:</strong> eviction marks an empty, idle queue as retired while
 * holding its lock. A retired queue rejects writes ({@code offer*} returns false) so the
 * caller re-resolves a fresh queue from the destination map. Nothing is ever stored in a
 * retired queue, which is why eviction cannot lose a frame.</p>
 */
final class DestinationQueue {

    private final String name;
    private final Deque<Frame> frames;
    private final ReentrantLock lock;

    private long lastActivityAt;
    private boolean retired;

    DestinationQueue(String name, long createdAt) {
        this.name = name;
        this.frames = new ArrayDeque<>();
        this.lock = new ReentrantLock();
        this.lastActivityAt = createdAt;
    }

    String name() {
        return name;
    }

    /**
     * Appends a frame at the tail.
     *
     * @return false if this queue was retired and the caller must retry on a fresh queue
     * @throws QueueFullException if maxDepth is positive and already reached
     */
    boolean offerLast(Frame frame, int maxDepth, long now) {
        lock.lock();
        try {
            if (retired) {
                return false;
            }
            checkCapacity(maxDepth);
            frames.addLast(frame);
            lastActivityAt = now;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a frame at the head.
     *
     * @return false if this queue was retired and the caller must retry on a fresh queue
     * @throws QueueFullException if maxDepth is positive and already reached
     */
    boolean offerFirst(Frame frame, int maxDepth, long now) {
        lock.lock();
        try {
            if (retired) {
                return false;
            }
            checkCapacity(maxDepth);
            frames.addFirst(frame);
            lastActivityAt = now;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head frame.
     *
     * @return the head frame, or null if empty
     */
    Frame pollFirst(long now) {
        lock.lock();
        try {
            Frame frame = frames.pollFirst();
            if (frame != null) {
                lastActivityAt = now;
            }
            return frame;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isIdle(long idleThresholdMs, long now) {
        lock.lock();
        try {
            return idleLocked(idleThresholdMs, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retires this queue if it is still empty and idle.
     *
     * <p>Called from within the destination map's compute block, so the mapping is removed
     * atomically with retirement.</p>
     *
     * @return true if retired
     */
    boolean retireIfIdle(long idleThresholdMs, long now) {
        lock.lock();
        try {
            if (!retired && idleLocked(idleThresholdMs, now)) {
                retired = true;
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    private boolean idleLocked(long idleThresholdMs, long now) {
        return frames.isEmpty() && now - lastActivityAt >= idleThresholdMs;
    }

    private void checkCapacity(int maxDepth) {
        if (maxDepth > 0 && frames.size() >= maxDepth) {
            throw new QueueFullException(name, maxDepth);
        }
    }
}
