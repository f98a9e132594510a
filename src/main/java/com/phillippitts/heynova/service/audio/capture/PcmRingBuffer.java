package com.phillippitts.heynova.service.audio.capture;

import java.util.Arrays;

/**
 * Fixed-size ring buffer for PCM bytes. Holds the most recent audio while capture waits
 * for speech, so the first syllable of a phrase is not clipped. Only the capture thread uses it.
 */
final class PcmRingBuffer {

    private final byte[] buffer;
    private int writePos = 0;
    private int size = 0;

    PcmRingBuffer(int capacityBytes) {
        this.buffer = new byte[Math.max(0, capacityBytes)];
    }

    int capacity() {
        return buffer.length;
    }

    int size() {
        return size;
    }

    void write(byte[] src, int off, int len) {
        if (len <= 0 || buffer.length == 0) {
            return;
        }
        // Incoming chunk alone fills the buffer: keep its tail
        if (len >= buffer.length) {
            System.arraycopy(src, off + (len - buffer.length), buffer, 0, buffer.length);
            writePos = 0;
            size = buffer.length;
            return;
        }
        // toByteArray() starts at (writePos - size), so shrinking size drops the oldest bytes
        int space = buffer.length - size;
        if (len > space) {
            size -= len - space;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, off, buffer, writePos, first);
        int remaining = len - first;
        if (remaining > 0) {
            System.arraycopy(src, off + first, buffer, 0, remaining);
            writePos = remaining;
        } else {
            writePos = (writePos + first) % buffer.length;
        }
        size = Math.min(size + len, buffer.length);
    }

    byte[] toByteArray() {
        if (size == 0) {
            return new byte[0];
        }
        byte[] out = new byte[size];
        int start = (writePos - size + buffer.length) % buffer.length;
        int first = Math.min(size, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < size) {
            System.arraycopy(buffer, 0, out, first, size - first);
        }
        return out;
    }

    void clear() {
        Arrays.fill(buffer, (byte) 0);
        writePos = 0;
        size = 0;
    }
}
