package com.ttennebkram.batchblur.model;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO work queue with blocking push/pop.
 *
 * All state is guarded by a single lock. Producers wait on {@code notFull},
 * consumers wait on {@code notEmpty}, so a pop only ever wakes producers and a
 * push only ever wakes consumers.
 *
 * Without a call to {@link #close()} the queue never stops blocking: a pop on
 * an empty queue waits until something is pushed, however long that takes.
 * {@code close()} is the opt-in shutdown path. Once closed, pop drains the
 * remaining items and then returns {@code null} instead of blocking, and push
 * throws {@link QueueClosedException}.
 *
 * Also counts total items added over the queue's lifetime.
 */
public class BoundedTaskQueue<E> {

    public static final int DEFAULT_CAPACITY = 1000;

    private final RingBuffer<E> buffer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();

    private boolean closed = false;
    private long totalAdded = 0;

    public BoundedTaskQueue() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedTaskQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.buffer = new RingBuffer<>(capacity);
    }

    /**
     * Insert an item at the tail, waiting for space if the queue is full.
     *
     * @throws IllegalArgumentException if item is null
     * @throws QueueClosedException if the queue is closed, including while waiting
     */
    public void push(E item) throws InterruptedException {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        lock.lock();
        try {
            while (!closed && buffer.isFull()) {
                notFull.await();
            }
            if (closed) {
                throw new QueueClosedException("push after close");
            }
            buffer.addLast(item);
            totalAdded++;
            assert checkInvariant();
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the head item, waiting while the queue is empty.
     *
     * @return the head item, or null once the queue is closed and drained
     */
    public E pop() throws InterruptedException {
        lock.lock();
        try {
            while (!closed && buffer.isEmpty()) {
                notEmpty.await();
            }
            if (buffer.isEmpty()) {
                return null;
            }
            E item = buffer.removeFirst();
            assert checkInvariant();
            notFull.signal();
            return item;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop accepting items and wake every waiter. Items already queued are
     * still handed out by {@link #pop()}. Idempotent.
     */
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
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return buffer.capacity();
    }

    public int remainingCapacity() {
        lock.lock();
        try {
            return buffer.capacity() - buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public long getTotalAdded() {
        lock.lock();
        try {
            return totalAdded;
        } finally {
            lock.unlock();
        }
    }

    private boolean checkInvariant() {
        int count = buffer.size();
        if (count < 0 || count > buffer.capacity()) {
            throw new AssertionError("queue count " + count + " outside [0, " + buffer.capacity() + "]");
        }
        return true;
    }

    /**
     * Circular storage with head/tail cursors advancing modulo capacity.
     * Not thread-safe; only touched while the queue lock is held.
     */
    private static final class RingBuffer<E> {
        private final Object[] slots;
        private int head = 0;
        private int tail = 0;
        private int count = 0;

        RingBuffer(int capacity) {
            this.slots = new Object[capacity];
        }

        int capacity() {
            return slots.length;
        }

        int size() {
            return count;
        }

        boolean isEmpty() {
            return count == 0;
        }

        boolean isFull() {
            return count == slots.length;
        }

        void addLast(E item) {
            if (isFull()) {
                throw new IllegalStateException("ring buffer full");
            }
            slots[tail] = item;
            tail = (tail + 1) % slots.length;
            count++;
        }

        @SuppressWarnings("unchecked")
        E removeFirst() {
            if (isEmpty()) {
                throw new IllegalStateException("ring buffer empty");
            }
            E item = (E) slots[head];
            slots[head] = null;
            head = (head + 1) % slots.length;
            count--;
            return item;
        }
    }
}
