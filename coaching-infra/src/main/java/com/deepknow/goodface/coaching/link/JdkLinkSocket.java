package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.audio.AudioBufferPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

/**
 * JDK WebSocket 同时只允许一个发送在途，因此所有发送挂在同一条尾部 future 上。
 * 音频帧先拷贝进缓冲池，调用方在 sendBinary 返回后即可复用自己的数组。
 */
class JdkLinkSocket implements LinkSocket {
    private static final Logger log = LoggerFactory.getLogger(JdkLinkSocket.class);

    private final WebSocket ws;
    private final AudioBufferPool bufferPool;
    private final Object sendLock = new Object();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    JdkLinkSocket(WebSocket ws, AudioBufferPool bufferPool) {
        this.ws = ws;
        this.bufferPool = bufferPool;
    }

    @Override
    public CompletableFuture<Void> sendText(String text) {
        synchronized (sendLock) {
            CompletableFuture<Void> sent = tail
                    .thenCompose(v -> ws.sendText(text, true))
                    .thenApply(w -> (Void) null);
            tail = settled(sent);
            return sent;
        }
    }

    @Override
    public boolean sendBinary(byte[] data) {
        synchronized (sendLock) {
            if (ws.isOutputClosed() || !tail.isDone()) {
                return false;
            }
            final byte[] pooled = data.length <= bufferPool.getBufferSize() ? bufferPool.acquire() : null;
            ByteBuffer payload;
            if (pooled != null) {
                System.arraycopy(data, 0, pooled, 0, data.length);
                payload = ByteBuffer.wrap(pooled, 0, data.length);
            } else {
                payload = ByteBuffer.wrap(data.clone());
            }
            CompletableFuture<Void> sent = ws.sendBinary(payload, true).thenApply(w -> (Void) null);
            sent.whenComplete((v, err) -> {
                if (pooled != null) bufferPool.release(pooled);
                if (err != null) log.debug("Binary send failed: {}", err.getMessage());
            });
            tail = settled(sent);
            return true;
        }
    }

    @Override
    public void close(int code, String reason) {
        synchronized (sendLock) {
            if (ws.isOutputClosed()) return;
            tail = settled(tail.thenCompose(v -> ws.sendClose(code, reason == null ? "" : reason))
                    .thenApply(w -> (Void) null)
                    .whenComplete((v, err) -> {
                        if (err != null) {
                            log.warn("Close handshake failed, aborting: {}", err.getMessage());
                            ws.abort();
                        }
                    }));
        }
    }

    @Override
    public boolean isOpen() {
        return !ws.isOutputClosed() && !ws.isInputClosed();
    }

    // 失败不阻断后续发送
    private static CompletableFuture<Void> settled(CompletableFuture<Void> f) {
        return f.handle((v, err) -> null);
    }
}
