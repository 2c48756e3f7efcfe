package com.deepknow.goodface.coaching.feature;

import com.deepknow.goodface.coaching.domain.event.GuidanceEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventListener;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.event.SessionEventType;
import com.deepknow.goodface.coaching.domain.feature.GuidanceRecord;
import com.deepknow.goodface.coaching.domain.feature.GuidanceRejectedException;
import com.deepknow.goodface.coaching.domain.feature.GuidanceTimeoutException;
import com.deepknow.goodface.coaching.domain.link.ConversationalLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 教练指导：把教练文本拼到基础提示词后以 UpdatePrompt 静默下发，不会被朗读。
 * 每次发送都等待一次 PromptUpdated 确认（先发先确认），超时则显式失败。
 */
public class GuidanceChannel implements SessionEventListener {
    private static final Logger log = LoggerFactory.getLogger(GuidanceChannel.class);

    private final String sessionId;
    private final ConversationalLink link;
    private final ScheduledExecutorService scheduler;
    private final SessionEventPublisher publisher;
    private final String prefix;
    private final long confirmationTimeoutMs;

    private final ArrayDeque<Pending> pending = new ArrayDeque<>();
    private final List<GuidanceRecord> history = new ArrayList<>();
    private volatile String basePrompt;
    private boolean closed;

    public GuidanceChannel(String sessionId, ConversationalLink link, ScheduledExecutorService scheduler,
                           SessionEventPublisher publisher, String basePrompt, String prefix, long confirmationTimeoutMs) {
        this.sessionId = sessionId;
        this.link = link;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.basePrompt = basePrompt == null ? "" : basePrompt;
        this.prefix = prefix == null ? "" : prefix;
        this.confirmationTimeoutMs = confirmationTimeoutMs;
    }

    public CompletableFuture<Void> sendGuidance(String text, String coachId) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        if (text == null || text.isBlank()) {
            future.completeExceptionally(new GuidanceRejectedException("Guidance text is empty"));
            return future;
        }
        Pending p = new Pending(text, coachId, future);
        synchronized (this) {
            if (closed) {
                return reject(p, "Guidance channel closed");
            }
            pending.addLast(p);
            if (!link.updatePrompt(buildPrompt(text))) {
                pending.remove(p);
                return reject(p, "Conversational link not ready");
            }
            history.add(new GuidanceRecord(text, coachId, System.currentTimeMillis()));
            try {
                p.timeoutTask = scheduler.schedule(() -> onTimeout(p), confirmationTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                pending.remove(p);
                return reject(p, "Session scheduler unavailable");
            }
        }
        log.info("Guidance sent: sessionId={}, coachId={}, len={}", sessionId, coachId, text.length());
        publisher.publish(new GuidanceEvent(GuidanceEvent.Status.SENT, text, coachId, null));
        return future;
    }

    String buildPrompt(String text) {
        return basePrompt + "\n\n" + prefix + text;
    }

    @Override
    public void onEvent(SessionEvent event) {
        if (event.getType() == SessionEventType.PROMPT_UPDATED) {
            onPromptUpdated();
        }
    }

    void onPromptUpdated() {
        Pending p;
        synchronized (this) {
            p = pending.pollFirst();
            if (p != null && p.timeoutTask != null) {
                p.timeoutTask.cancel(false);
            }
        }
        if (p == null) {
            log.debug("PromptUpdated without pending guidance: sessionId={}", sessionId);
            return;
        }
        p.future.complete(null);
        log.info("Guidance confirmed: sessionId={}, coachId={}", sessionId, p.coachId);
        publisher.publish(new GuidanceEvent(GuidanceEvent.Status.CONFIRMED, p.text, p.coachId, null));
    }

    private void onTimeout(Pending p) {
        synchronized (this) {
            if (!pending.remove(p)) return;
        }
        log.warn("Guidance confirmation timeout: sessionId={}, coachId={}, timeoutMs={}", sessionId, p.coachId, confirmationTimeoutMs);
        p.future.completeExceptionally(new GuidanceTimeoutException(confirmationTimeoutMs));
        publisher.publish(new GuidanceEvent(GuidanceEvent.Status.FAILED, p.text, p.coachId, "timeout"));
    }

    private CompletableFuture<Void> reject(Pending p, String reason) {
        log.warn("Guidance rejected: sessionId={}, coachId={}, reason={}", sessionId, p.coachId, reason);
        p.future.completeExceptionally(new GuidanceRejectedException(reason));
        publisher.publish(new GuidanceEvent(GuidanceEvent.Status.FAILED, p.text, p.coachId, reason));
        return p.future;
    }

    public boolean injectUserMessage(String content) {
        return link.injectUserMessage(content);
    }

    public boolean injectAgentMessage(String content) {
        return link.injectAgentMessage(content);
    }

    public void setBasePrompt(String basePrompt) {
        this.basePrompt = basePrompt == null ? "" : basePrompt;
    }

    public String getBasePrompt() {
        return basePrompt;
    }

    public synchronized List<GuidanceRecord> history() {
        return List.copyOf(history);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * 关闭通道，未确认的指导以 GuidanceRejectedException 结束。
     */
    public void cleanup() {
        List<Pending> drained;
        synchronized (this) {
            closed = true;
            drained = new ArrayList<>(pending);
            pending.clear();
            history.clear();
        }
        for (Pending p : drained) {
            if (p.timeoutTask != null) p.timeoutTask.cancel(false);
            p.future.completeExceptionally(new GuidanceRejectedException("Session closed"));
        }
    }

    private static final class Pending {
        final String text;
        final String coachId;
        final CompletableFuture<Void> future;
        ScheduledFuture<?> timeoutTask;

        Pending(String text, String coachId, CompletableFuture<Void> future) {
            this.text = text;
            this.coachId = coachId;
            this.future = future;
        }
    }
}
