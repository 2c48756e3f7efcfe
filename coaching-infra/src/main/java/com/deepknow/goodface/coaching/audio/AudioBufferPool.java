package com.deepknow.goodface.coaching.audio;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * 固定大小字节缓冲池。归还的缓冲会清零；尺寸不符或超过容量的缓冲直接丢弃。
 */
public class AudioBufferPool {
    public static final int DEFAULT_BUFFER_SIZE = 4096;
    public static final int DEFAULT_MAX_POOL_SIZE = 50;

    private final int bufferSize;
    private final int maxPoolSize;
    private final ArrayDeque<byte[]> pool = new ArrayDeque<>();

    public AudioBufferPool() {
        this(DEFAULT_BUFFER_SIZE, DEFAULT_MAX_POOL_SIZE);
    }

    public AudioBufferPool(int bufferSize, int maxPoolSize) {
        if (bufferSize <= 0) throw new IllegalArgumentException("bufferSize must be > 0");
        if (maxPoolSize < 0) throw new IllegalArgumentException("maxPoolSize must be >= 0");
        this.bufferSize = bufferSize;
        this.maxPoolSize = maxPoolSize;
    }

    public synchronized byte[] acquire() {
        byte[] buf = pool.pollFirst();
        return buf != null ? buf : new byte[bufferSize];
    }

    public synchronized void release(byte[] buf) {
        if (buf == null || buf.length != bufferSize || pool.size() >= maxPoolSize) {
            return;
        }
        Arrays.fill(buf, (byte) 0);
        pool.addFirst(buf);
    }

    public synchronized int pooledCount() {
        return pool.size();
    }

    public synchronized void clear() {
        pool.clear();
    }

    public int getBufferSize() { return bufferSize; }
    public int getMaxPoolSize() { return maxPoolSize; }
}
