package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.audio.FrameValidator;
import com.deepknow.goodface.coaching.domain.event.ErrorEvent;
import com.deepknow.goodface.coaching.domain.event.LinkStateEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.link.LinkState;
import com.deepknow.goodface.coaching.domain.link.LinkStatus;
import com.deepknow.goodface.coaching.domain.link.UpstreamLink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 上游链路公共部分：连接、JSON 控制帧解析、状态迁移与线性退避重连。
 * 状态变更在对象锁内完成；音频发送只读 volatile 字段，不加锁。
 */
public abstract class AbstractUpstreamLink implements UpstreamLink {
    private static final Logger log = LoggerFactory.getLogger(AbstractUpstreamLink.class);
    protected static final int NORMAL_CLOSURE = 1000;
    private static final int ABNORMAL_CLOSURE = 1006;

    protected final String sessionId;
    protected final ObjectMapper objectMapper;
    protected final ScheduledExecutorService scheduler;
    protected final SessionEventPublisher publisher;

    private final String name;
    private final LinkConnector connector;
    private final int maxReconnectAttempts;
    private final long reconnectBaseDelayMs;

    private volatile LinkState state = LinkState.DISCONNECTED;
    private volatile LinkSocket socket;
    private int reconnectAttempts;
    private boolean closeRequested;
    private ScheduledFuture<?> reconnectTask;

    protected AbstractUpstreamLink(String name, String sessionId, LinkConnector connector,
                                   ScheduledExecutorService scheduler, SessionEventPublisher publisher,
                                   ObjectMapper objectMapper, int maxReconnectAttempts, long reconnectBaseDelayMs) {
        this.name = name;
        this.sessionId = sessionId;
        this.connector = connector;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    }

    protected abstract URI endpoint();

    protected abstract Map<String, String> headers();

    /** 连接打开后调用，子类决定进入 SETTINGS_PENDING 或直接 READY。 */
    protected abstract void onSocketOpen(LinkSocket socket);

    protected abstract void handleMessage(String type, JsonNode message);

    protected void handleAudio(byte[] audio) {
        log.trace("Ignore binary frame: link={}, sessionId={}, bytes={}", name, sessionId, audio.length);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized void connect() {
        if (closeRequested || state == LinkState.FAILED) {
            log.debug("Skip connect: link={}, sessionId={}, state={}, closeRequested={}", name, sessionId, state, closeRequested);
            return;
        }
        if (state != LinkState.DISCONNECTED) {
            return;
        }
        transition(LinkState.CONNECTING);
        log.info("Connecting link: link={}, sessionId={}, attempt={}", name, sessionId, reconnectAttempts);
        try {
            connector.connect(endpoint(), headers(), new Listener())
                    .whenComplete((s, err) -> {
                        if (err != null) handleConnectFailure(err);
                    });
        } catch (RuntimeException e) {
            handleConnectFailure(e);
        }
    }

    @Override
    public boolean sendAudio(byte[] audio) {
        LinkSocket s = socket;
        if (state != LinkState.READY || s == null || !FrameValidator.validate(audio)) {
            return false;
        }
        boolean sent = s.sendBinary(audio);
        if (!sent) {
            log.trace("Audio frame dropped by backpressure: link={}, sessionId={}", name, sessionId);
        }
        return sent;
    }

    @Override
    public boolean keepAlive() {
        return sendControl("KeepAlive");
    }

    @Override
    public LinkState getState() {
        return state;
    }

    @Override
    public synchronized LinkStatus status() {
        return new LinkStatus(name, state, reconnectAttempts);
    }

    @Override
    public void close() {
        LinkSocket toClose;
        synchronized (this) {
            if (closeRequested) return;
            closeRequested = true;
            cancelReconnect();
            toClose = socket;
            socket = null;
            if (state == LinkState.FAILED) return;
            if (toClose != null) transition(LinkState.CLOSING);
        }
        if (toClose != null) {
            toClose.close(NORMAL_CLOSURE, "client close");
        }
        synchronized (this) {
            transition(LinkState.DISCONNECTED);
        }
        log.info("Link closed: link={}, sessionId={}", name, sessionId);
    }

    protected synchronized boolean isCloseRequested() {
        return closeRequested;
    }

    protected LinkSocket currentSocket() {
        return socket;
    }

    /**
     * 发送控制消息，仅在 READY 时生效。
     */
    protected boolean sendControl(String type) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("type", type);
        return sendJson(msg);
    }

    protected boolean sendJson(ObjectNode message) {
        LinkSocket s = socket;
        if (state != LinkState.READY || s == null) {
            log.debug("Drop control message, link not ready: link={}, sessionId={}, type={}, state={}",
                    name, sessionId, message.path("type").asText(), state);
            return false;
        }
        return sendRaw(s, message);
    }

    /**
     * 不检查状态的发送，用于握手阶段（Settings）与优雅关闭。
     */
    protected boolean sendRaw(LinkSocket s, ObjectNode message) {
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("Serialize control message failed: link={}, sessionId={}", name, sessionId, e);
            return false;
        }
        String type = message.path("type").asText();
        s.sendText(json).whenComplete((v, err) -> {
            if (err != null) {
                log.warn("Send control message failed: link={}, sessionId={}, type={}, err={}", name, sessionId, type, err.getMessage());
            }
        });
        log.debug("Sent control message: link={}, sessionId={}, type={}", name, sessionId, type);
        return true;
    }

    /**
     * 进入 READY 并重置重连计数。
     */
    protected synchronized void markReady() {
        reconnectAttempts = 0;
        transition(LinkState.READY);
        log.info("Link ready: link={}, sessionId={}", name, sessionId);
    }

    protected synchronized void transition(LinkState next) {
        LinkState prev = state;
        if (prev == next) return;
        if (prev == LinkState.FAILED) {
            log.debug("Ignore transition out of FAILED: link={}, sessionId={}, next={}", name, sessionId, next);
            return;
        }
        state = next;
        log.debug("Link state: link={}, sessionId={}, {} -> {}", name, sessionId, prev, next);
        publisher.publish(new LinkStateEvent(name, prev, next, reconnectAttempts));
    }

    private synchronized void handleConnectFailure(Throwable err) {
        log.warn("Connect failed: link={}, sessionId={}, err={}", name, sessionId, err.getMessage());
        socket = null;
        scheduleReconnect("connect failed: " + err.getMessage());
    }

    private synchronized void handleUnexpectedClose(int code, String reason) {
        socket = null;
        if (closeRequested) {
            transition(LinkState.DISCONNECTED);
            return;
        }
        if (code == NORMAL_CLOSURE) {
            log.info("Link closed by remote: link={}, sessionId={}, reason={}", name, sessionId, reason);
            transition(LinkState.DISCONNECTED);
            return;
        }
        log.warn("Link dropped: link={}, sessionId={}, code={}, reason={}", name, sessionId, code, reason);
        scheduleReconnect("closed with code " + code);
    }

    private void scheduleReconnect(String cause) {
        if (closeRequested || state == LinkState.FAILED) return;
        if (reconnectAttempts >= maxReconnectAttempts) {
            fail(cause);
            return;
        }
        reconnectAttempts++;
        long delay = reconnectAttempts * reconnectBaseDelayMs;
        transition(LinkState.DISCONNECTED);
        log.info("Reconnect scheduled: link={}, sessionId={}, attempt={}/{}, delayMs={}",
                name, sessionId, reconnectAttempts, maxReconnectAttempts, delay);
        try {
            reconnectTask = scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Reconnect rejected, scheduler shut down: link={}, sessionId={}", name, sessionId);
            transition(LinkState.DISCONNECTED);
        }
    }

    private void fail(String cause) {
        transition(LinkState.FAILED);
        String message = name + " failed after " + maxReconnectAttempts + " reconnect attempts (" + cause + ")";
        log.error("Link failed: link={}, sessionId={}, cause={}", name, sessionId, cause);
        publisher.publish(new ErrorEvent(name, ErrorEvent.LINK_FAILED, message, true));
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private final class Listener implements LinkSocketListener {
        @Override
        public void onOpen(LinkSocket opened) {
            synchronized (AbstractUpstreamLink.this) {
                if (closeRequested) {
                    opened.close(NORMAL_CLOSURE, "client close");
                    return;
                }
                socket = opened;
                log.info("Link socket open: link={}, sessionId={}", name, sessionId);
                onSocketOpen(opened);
            }
        }

        @Override
        public void onText(String text) {
            JsonNode node;
            try {
                node = objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.warn("Malformed control message dropped: link={}, sessionId={}, err={}", name, sessionId, e.getOriginalMessage());
                return;
            }
            String type = node.path("type").asText("");
            try {
                handleMessage(type, node);
            } catch (RuntimeException e) {
                log.warn("Handle message failed: link={}, sessionId={}, type={}", name, sessionId, type, e);
            }
        }

        @Override
        public void onBinary(byte[] data) {
            handleAudio(data);
        }

        @Override
        public void onClosed(int code, String reason) {
            handleUnexpectedClose(code, reason);
        }

        @Override
        public void onError(Throwable error) {
            log.warn("Link socket error: link={}, sessionId={}, err={}", name, sessionId, error == null ? null : error.getMessage());
            publisher.publish(new ErrorEvent(name, "SOCKET_ERROR", error == null ? "unknown" : String.valueOf(error.getMessage()), false));
            handleUnexpectedClose(ABNORMAL_CLOSURE, "socket error");
        }
    }
}
