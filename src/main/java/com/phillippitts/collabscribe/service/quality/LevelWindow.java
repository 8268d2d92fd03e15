package com.phillippitts.collabscribe.service.quality;

/**
 * Fixed-capacity sliding window of audio levels. When full, each new sample evicts the oldest.
 * Thread-safe for concurrent writers and readers.
 */
final class LevelWindow {

    private final double[] samples;
    private int writePos = 0;
    private int size = 0;

    LevelWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.samples = new double[capacity];
    }

    int capacity() {
        return samples.length;
    }

    synchronized void add(double value) {
        // once full, writePos points at the oldest sample
        samples[writePos] = value;
        writePos = (writePos + 1) % samples.length;
        size = Math.min(size + 1, samples.length);
    }

    synchronized int size() {
        return size;
    }

    /**
     * Average of the samples in the window, or NaN when empty.
     */
    synchronized double average() {
        if (size == 0) {
            return Double.NaN;
        }
        double total = 0.0;
        int start = (writePos - size + samples.length) % samples.length;
        for (int i = 0; i < size; i++) {
            total += samples[(start + i) % samples.length];
        }
        return total / size;
    }

    synchronized void clear() {
        writePos = 0;
        size = 0;
    }
}
