package com.phillippitts.livetranslate.service.audio;

import java.util.Arrays;

/**
 * Per-session accumulator of not-yet-processed compressed audio bytes.
 *
 * <p>Append-only between drains. A snapshot can be handed to a processing job while new
 * chunks keep arriving; when the job completes, exactly the submitted prefix is discarded so
 * bytes appended meanwhile are kept for the next round.
 *
 * <p>Not thread-safe. Confined to the owning session's serial executor.
 */
public final class AudioBuffer {

    private static final int INITIAL_CAPACITY = 64 * 1024;

    private byte[] data = new byte[INITIAL_CAPACITY];
    private int size;

    public void append(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return;
        }
        ensureCapacity(size + chunk.length);
        System.arraycopy(chunk, 0, data, size, chunk.length);
        size += chunk.length;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Copy of the current contents; the buffer is unchanged. */
    public byte[] snapshot() {
        return Arrays.copyOf(data, size);
    }

    /**
     * Removes the first {@code n} bytes, keeping anything appended after them.
     *
     * @throws IllegalArgumentException if {@code n} is negative or larger than the buffer
     */
    public void discardPrefix(int n) {
        if (n < 0 || n > size) {
            throw new IllegalArgumentException("Cannot discard " + n + " of " + size + " bytes");
        }
        if (n == 0) {
            return;
        }
        System.arraycopy(data, n, data, 0, size - n);
        size -= n;
    }

    /** Returns the full contents and truncates to empty. */
    public byte[] drainAll() {
        byte[] out = snapshot();
        clear();
        return out;
    }

    public void clear() {
        size = 0;
        if (data.length > INITIAL_CAPACITY) {
            data = new byte[INITIAL_CAPACITY];
        }
    }

    private void ensureCapacity(int required) {
        if (required <= data.length) {
            return;
        }
        int newCap = Math.max(required, data.length * 2);
        data = Arrays.copyOf(data, newCap);
    }
}
