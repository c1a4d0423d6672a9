package com.pulselog.core;

import org.agrona.concurrent.ManyToManyConcurrentArrayQueue;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * <h1>Object Pool: Recycling Short-Lived Records</h1>
 *
 * <p>
 * Every log call needs a record to carry level, time, template and values to
 * the receiver. Under heavy logging, allocating one per call produces a steady
 * stream of garbage whose only purpose is to live for a few microseconds.
 * </p>
 *
 * <h2>Design Rationality</h2>
 * <ul>
 * <li><b>Many Writers:</b> Unlike a single-threaded engine, a logger is called
 * from every application thread at once. The free list is therefore an Agrona
 * {@link ManyToManyConcurrentArrayQueue}: a bounded, lock-free ring that never
 * allocates on offer/poll.</li>
 * <li><b>Decoupled From Receivers:</b> The pool has its own synchronization.
 * Borrowing an entry never contends with a receiver's write lock.</li>
 * <li><b>Never Exhausted:</b> When the free list is empty a fresh instance is
 * created. When it is full a released instance is simply dropped and left to
 * the GC. A logging call must not fail because of pool sizing.</li>
 * <li><b>Reset on Release:</b> The resetter runs before an instance is
 * offered back, so no field of one call can leak into the next.</li>
 * </ul>
 *
 * @param <T> The type of object to pool.
 */
public class ObjectPool<T> {

    private final ManyToManyConcurrentArrayQueue<T> free;
    private final Supplier<T> factory;
    private final Consumer<T> resetter;

    public ObjectPool(int capacity, Supplier<T> factory, Consumer<T> resetter) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Pool capacity must be at least 2: " + capacity);
        }
        this.free = new ManyToManyConcurrentArrayQueue<>(capacity);
        this.factory = factory;
        this.resetter = resetter;

        // Pre-allocate half; the rest fills up from released instances
        for (int i = 0, n = capacity / 2; i < n; i++) {
            free.offer(factory.get());
        }
    }

    public T acquire() {
        T object = free.poll();
        return object != null ? object : factory.get();
    }

    public void release(T object) {
        if (object == null) {
            return;
        }
        resetter.accept(object);
        free.offer(object);
    }

    public int available() {
        return free.size();
    }

    public int capacity() {
        return free.capacity();
    }
}
