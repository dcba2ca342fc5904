package org.gamma.geobatch.processing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Closable bounded FIFO connecting the pipeline stages.
 * <p>
 * Producers block while the channel is full, consumers block while it is empty and open. After {@link #close()}
 * consumers drain what is left and then see end of stream ({@code null}); after {@link #abort()} buffered items are
 * discarded as well.
 */
public class BoundedChannel<T> {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public BoundedChannel(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Blocks until there is room, then enqueues the item.
     *
     * @return false if the channel was closed, in which case the item was not enqueued
     */
    public boolean put(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) return false;
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available.
     *
     * @return the next item, or null once the channel is closed and drained
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            T item = items.pollFirst();
            if (item != null) notFull.signal();
            return item;
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel and drops everything still buffered.
     *
     * @return number of discarded items
     */
    public int abort() {
        lock.lock();
        try {
            int dropped = items.size();
            items.clear();
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
