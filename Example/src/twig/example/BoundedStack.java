package twig.example;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A last-in first-out stack holding at most a fixed number of elements.
 */
public final class BoundedStack<E> {
    private final int capacity;
    private final List<E> elements = new ArrayList<>();

    private BoundedStack(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be strictly positive but was: " + capacity);
        }
        this.capacity = capacity;
    }

    public static <E> BoundedStack<E> withCapacity(int capacity) {
        return new BoundedStack<>(capacity);
    }

    public synchronized void push(E element) {
        if (element == null) {
            throw new NullPointerException("element must be non-null.");
        }
        if (this.elements.size() == this.capacity) {
            throw new IllegalStateException("stack is full.");
        }
        this.elements.add(element);
    }

    public synchronized E pop() {
        if (this.elements.isEmpty()) {
            throw new NoSuchElementException("stack is empty.");
        }
        return this.elements.remove(this.elements.size() - 1);
    }

    public synchronized E peek() {
        if (this.elements.isEmpty()) {
            throw new NoSuchElementException("stack is empty.");
        }
        return this.elements.get(this.elements.size() - 1);
    }

    public synchronized int size() {
        return this.elements.size();
    }

    public synchronized boolean isEmpty() {
        return this.elements.isEmpty();
    }

    public synchronized boolean isFull() {
        return this.elements.size() == this.capacity;
    }

    public int capacity() {
        return this.capacity;
    }

    @Override
    public synchronized String toString() {
        return this.getClass().getSimpleName() + " { size: " + this.elements.size() + ", capacity: " + this.capacity + " }";
    }
}
