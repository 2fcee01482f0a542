package com.jsearch.segment;

import java.util.Arrays;

/**
 * Growable int array used by the in-memory write buffer.
 */
public class IntArrayBuffer {
    private int[] values;
    private int size;

    public IntArrayBuffer() {
        this(8);
    }

    public IntArrayBuffer(int initialCapacity) {
        this.values = new int[Math.max(1, initialCapacity)];
    }

    public void add(int value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, values.length * 2);
        }
        values[size++] = value;
    }

    public void addAll(int[] source) {
        for (int value : source) {
            add(value);
        }
    }

    public int get(int index) {
        if (index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size);
        }
        return values[index];
    }

    /**
     * Sets a slot, growing and zero-filling up to it if needed.
     */
    public void set(int index, int value) {
        if (index >= values.length) {
            values = Arrays.copyOf(values, Math.max(values.length * 2, index + 1));
        }
        values[index] = value;
        size = Math.max(size, index + 1);
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(values, size);
    }
}
