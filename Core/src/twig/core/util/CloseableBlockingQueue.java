package twig.core.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * A bounded, thread-safe blocking queue that can be closed.
 *
 * Closing the queue wakes every blocked producer and consumer. Producers are refused once the queue is closed, while
 * consumers may keep draining whatever elements remain. This lets the threads that feed and drain a queue be shut down
 * without interrupting them.
 */
public final class CloseableBlockingQueue<E> {
    private final Object monitor = new Object();
    private final int capacity;
    private final Deque<E> queue = new ArrayDeque<>();
    private boolean isClosed = false;

    private CloseableBlockingQueue(int capacity) {
        ObjectChecker.assertPositive(capacity);
        this.capacity = capacity;
    }

    /**
     * Constructs a new closeable blocking queue with the specified capacity.
     *
     * @param capacity The maximum amount of elements allowed in the queue at once.
     * @return the new queue.
     */
    public static <E> CloseableBlockingQueue<E> withCapacity(int capacity) {
        return new CloseableBlockingQueue<>(capacity);
    }

    /**
     * Adds the element to the queue, blocking while the queue is full.
     *
     * Returns true iff the element was added, which is the case unless the queue is or becomes closed first.
     *
     * @param element The element to add.
     * @return whether or not the element was added.
     */
    public boolean add(E element) throws InterruptedException {
        ObjectChecker.assertNonNull(element);

        synchronized (this.monitor) {
            while ((!this.isClosed) && (this.queue.size() == this.capacity)) {
                this.monitor.wait();
            }

            if (this.isClosed) {
                return false;
            }
            this.queue.addLast(element);
            this.monitor.notifyAll();
            return true;
        }
    }

    /**
     * Polls the next element in the queue. If the queue is empty then this method blocks until a new element is added,
     * the queue is closed or the timeout elapses, whichever happens first.
     *
     * Returns null if no element became available. Once the queue is closed and drained this method always returns null
     * without blocking.
     *
     * @param timeout The timeout duration.
     * @param unit The timeout duration units.
     * @return the next element or null.
     */
    public E poll(long timeout, TimeUnit unit) throws InterruptedException {
        ObjectChecker.assertNonNegative(timeout);
        ObjectChecker.assertNonNull(unit);

        long deadline = System.nanoTime() + unit.toNanos(timeout);

        synchronized (this.monitor) {
            long remainingNanos = deadline - System.nanoTime();
            while ((remainingNanos > 0) && (!this.isClosed) && (this.queue.isEmpty())) {
                TimeUnit.NANOSECONDS.timedWait(this.monitor, remainingNanos);
                remainingNanos = deadline - System.nanoTime();
            }

            E element = this.queue.pollFirst();
            if (element != null) {
                this.monitor.notifyAll();
            }
            return element;
        }
    }

    /**
     * Returns true iff this queue is closed and contains no more elements.
     *
     * @return whether the queue is closed and drained.
     */
    public boolean isDrained() {
        synchronized (this.monitor) {
            return this.isClosed && this.queue.isEmpty();
        }
    }

    /**
     * Closes this queue. Once this queue is closed it cannot be reopened.
     */
    public void close() {
        synchronized (this.monitor) {
            this.isClosed = true;
            this.monitor.notifyAll();
        }
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { size: " + this.queue.size() + ", capacity: " + this.capacity + (this.isClosed ? ", [closed] }" : ", [open] }");
        }
    }
}
