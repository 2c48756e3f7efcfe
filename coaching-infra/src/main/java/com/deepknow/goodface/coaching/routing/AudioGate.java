package com.deepknow.goodface.coaching.routing;

import com.deepknow.goodface.coaching.audio.FrameValidator;
import com.deepknow.goodface.coaching.domain.audio.AudioFrame;
import com.deepknow.goodface.coaching.domain.audio.GateDecision;
import com.deepknow.goodface.coaching.domain.audio.GateStatus;
import com.deepknow.goodface.coaching.domain.event.GateEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.link.ConversationalLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 对话链路前的静音闸门。
 * <p>
 * 被静音的参与者音频不会到达对话链路，但连接保持打开；客户音频走 forwardUngated，不受静音集合影响。
 * 静音期间若超过 2 倍间隔没有真实音频，按固定间隔发送 KeepAlive，避免远端因空闲断开；一旦有真实音频转发立即停止。
 * 静音集合、最近发送时间与定时器状态由同一把锁保护，定时器回调也持有这把锁。
 */
public class AudioGate {
    private static final Logger log = LoggerFactory.getLogger(AudioGate.class);

    private final String sessionId;
    private final ConversationalLink link;
    private final ScheduledExecutorService scheduler;
    private final SessionEventPublisher publisher;
    private final Clock clock;
    private final long keepAliveIntervalMs;

    private final Object lock = new Object();
    private final Set<String> muted = new LinkedHashSet<>();
    private long lastAudioSentAt;
    private boolean keepAliveActive;
    private ScheduledFuture<?> keepAliveTask;

    public AudioGate(String sessionId, ConversationalLink link, ScheduledExecutorService scheduler,
                     SessionEventPublisher publisher, Clock clock, long keepAliveIntervalMs) {
        this.sessionId = sessionId;
        this.link = link;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.clock = clock;
        this.keepAliveIntervalMs = keepAliveIntervalMs;
    }

    /**
     * @return 是否发生了状态变化；重复调用返回 false 且不产生事件
     */
    public boolean muteFromAgent(String participantId) {
        List<SessionEvent> events = new ArrayList<>();
        synchronized (lock) {
            if (!muted.add(participantId)) {
                log.debug("Participant already muted: sessionId={}, participantId={}", sessionId, participantId);
                return false;
            }
            log.info("Muted from agent: sessionId={}, participantId={}", sessionId, participantId);
            events.add(new GateEvent(GateEvent.Action.MUTED, participantId));
            reevaluateKeepAlive(events);
        }
        publishAll(events);
        return true;
    }

    public boolean unmuteFromAgent(String participantId) {
        List<SessionEvent> events = new ArrayList<>();
        synchronized (lock) {
            if (!muted.remove(participantId)) {
                log.debug("Participant not muted: sessionId={}, participantId={}", sessionId, participantId);
                return false;
            }
            log.info("Unmuted for agent: sessionId={}, participantId={}", sessionId, participantId);
            events.add(new GateEvent(GateEvent.Action.UNMUTED, participantId));
            reevaluateKeepAlive(events);
        }
        publishAll(events);
        return true;
    }

    public boolean isMuted(String participantId) {
        synchronized (lock) {
            return muted.contains(participantId);
        }
    }

    public GateDecision routeIfUnmuted(AudioFrame frame) {
        return forward(frame, true);
    }

    /**
     * 不检查静音集合直接转发，用于客户音频；成功时同样刷新最近发送时间并停止 KeepAlive。
     */
    public GateDecision forwardUngated(AudioFrame frame) {
        return forward(frame, false);
    }

    private GateDecision forward(AudioFrame frame, boolean applyMute) {
        List<SessionEvent> events = new ArrayList<>();
        GateDecision decision;
        synchronized (lock) {
            if (!FrameValidator.validate(frame)) {
                decision = GateDecision.INVALID;
            } else if (applyMute && muted.contains(frame.getParticipantId())) {
                log.trace("Blocked audio from muted participant: sessionId={}, participantId={}", sessionId, frame.getParticipantId());
                decision = GateDecision.BLOCKED_MUTED;
            } else if (!link.sendAudio(frame.getBytes())) {
                decision = GateDecision.LINK_UNAVAILABLE;
            } else {
                lastAudioSentAt = clock.millis();
                if (keepAliveActive) {
                    stopKeepAlive(events);
                }
                decision = GateDecision.FORWARDED;
            }
        }
        publishAll(events);
        return decision;
    }

    /**
     * 由外部静音检测触发，不等待谓词成立直接启动 KeepAlive。
     */
    public void forceKeepAlive() {
        List<SessionEvent> events = new ArrayList<>();
        synchronized (lock) {
            if (!keepAliveActive) {
                startKeepAlive(events);
            }
        }
        publishAll(events);
    }

    public GateStatus status() {
        synchronized (lock) {
            long since = lastAudioSentAt == 0 ? -1 : clock.millis() - lastAudioSentAt;
            return new GateStatus(new ArrayList<>(muted), keepAliveActive, since);
        }
    }

    public boolean isKeepAliveActive() {
        synchronized (lock) {
            return keepAliveActive;
        }
    }

    public void cleanup() {
        List<SessionEvent> events = new ArrayList<>();
        synchronized (lock) {
            stopKeepAlive(events);
            muted.clear();
        }
        publishAll(events);
        log.info("Gate cleaned up: sessionId={}", sessionId);
    }

    private boolean shouldKeepAlive() {
        return !muted.isEmpty() && clock.millis() - lastAudioSentAt > 2 * keepAliveIntervalMs;
    }

    private void reevaluateKeepAlive(List<SessionEvent> events) {
        boolean should = shouldKeepAlive();
        if (should && !keepAliveActive) {
            startKeepAlive(events);
        } else if (!should && keepAliveActive) {
            stopKeepAlive(events);
        }
    }

    private void startKeepAlive(List<SessionEvent> events) {
        try {
            keepAliveTask = scheduler.scheduleAtFixedRate(this::tick, keepAliveIntervalMs, keepAliveIntervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("KeepAlive not started, scheduler shut down: sessionId={}", sessionId);
            return;
        }
        keepAliveActive = true;
        log.info("KeepAlive started: sessionId={}, intervalMs={}", sessionId, keepAliveIntervalMs);
        events.add(new GateEvent(GateEvent.Action.KEEPALIVE_STARTED, null));
    }

    private void stopKeepAlive(List<SessionEvent> events) {
        if (keepAliveTask != null) {
            keepAliveTask.cancel(false);
            keepAliveTask = null;
        }
        if (keepAliveActive) {
            keepAliveActive = false;
            log.info("KeepAlive stopped: sessionId={}", sessionId);
            events.add(new GateEvent(GateEvent.Action.KEEPALIVE_STOPPED, null));
        }
    }

    private void tick() {
        synchronized (lock) {
            if (!keepAliveActive) return;
            boolean sent = link.keepAlive();
            log.debug("KeepAlive tick: sessionId={}, sent={}", sessionId, sent);
        }
    }

    private void publishAll(List<SessionEvent> events) {
        for (SessionEvent e : events) {
            publisher.publish(e);
        }
    }
}
