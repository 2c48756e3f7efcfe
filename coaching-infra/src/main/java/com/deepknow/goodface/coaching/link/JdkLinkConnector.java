package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.audio.AudioBufferPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 基于 JDK HttpClient 的 WebSocket 连接器。
 */
public class JdkLinkConnector implements LinkConnector {
    private static final Logger log = LoggerFactory.getLogger(JdkLinkConnector.class);

    private final HttpClient httpClient;
    private final AudioBufferPool bufferPool;
    private final Duration connectTimeout;

    public JdkLinkConnector(AudioBufferPool bufferPool, Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        this.bufferPool = bufferPool;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<LinkSocket> connect(URI uri, Map<String, String> headers, LinkSocketListener listener) {
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        Adapter adapter = new Adapter(listener);
        log.debug("Connecting upstream: uri={}", uri.getHost() + uri.getPath());
        return builder.buildAsync(uri, adapter).thenApply(adapter::socketFor);
    }

    /**
     * 把 JDK 的分片回调聚合为完整消息。
     */
    private final class Adapter implements WebSocket.Listener {
        private final LinkSocketListener delegate;
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();
        private volatile JdkLinkSocket socket;

        Adapter(LinkSocketListener delegate) {
            this.delegate = delegate;
        }

        synchronized LinkSocket socketFor(WebSocket ws) {
            if (socket == null) {
                socket = new JdkLinkSocket(ws, bufferPool);
            }
            return socket;
        }

        @Override
        public void onOpen(WebSocket ws) {
            delegate.onOpen(socketFor(ws));
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String text = textBuffer.toString();
                textBuffer.setLength(0);
                delegate.onText(text);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binaryBuffer.write(chunk, 0, chunk.length);
            if (last) {
                byte[] message = binaryBuffer.toByteArray();
                binaryBuffer.reset();
                delegate.onBinary(message);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            delegate.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            delegate.onError(error);
        }
    }
}
