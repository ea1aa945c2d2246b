package me.internalizable.craftkeeper.supervisor.process;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity buffer of console lines that evicts the oldest line when full.
 *
 * <p>Appends are O(1). Readers get copies and may call from any thread.</p>
 */
public class LogRingBuffer {

    private final String[] lines;
    private int head;
    private int size;

    /**
     * Create a ring buffer.
     *
     * @param capacity maximum number of retained lines
     * @throws IllegalArgumentException if capacity is not positive
     */
    public LogRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.lines = new String[capacity];
    }

    /**
     * Append a line, evicting the oldest line if the buffer is full.
     *
     * @param line console line
     */
    public synchronized void append(@Nonnull String line) {
        int tail = (head + size) % lines.length;
        lines[tail] = line;
        if (size < lines.length) {
            size++;
        } else {
            head = (head + 1) % lines.length;
        }
    }

    /**
     * Get the most recent lines.
     *
     * @param count number of lines to retrieve
     * @return up to {@code count} lines, oldest first
     */
    @Nonnull
    public synchronized List<String> tail(int count) {
        if (count <= 0 || size == 0) {
            return Collections.emptyList();
        }

        int n = Math.min(count, size);
        List<String> result = new ArrayList<>(n);
        int start = head + size - n;
        for (int i = 0; i < n; i++) {
            result.add(lines[(start + i) % lines.length]);
        }
        return result;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return lines.length;
    }

    public synchronized void clear() {
        Arrays.fill(lines, null);
        head = 0;
        size = 0;
    }
}
