package com.deepknow.goodface.coaching.routing;

import com.deepknow.goodface.coaching.audio.FrameValidator;
import com.deepknow.goodface.coaching.domain.audio.AudioEncoding;
import com.deepknow.goodface.coaching.domain.audio.AudioFrame;
import com.deepknow.goodface.coaching.domain.audio.GateDecision;
import com.deepknow.goodface.coaching.domain.audio.GateStatus;
import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.audio.Participant;
import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.audio.RouterStats;
import com.deepknow.goodface.coaching.domain.event.PauseEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.link.TranscriptionLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 音频唯一入口。按登记角色逐帧决定去向：
 * <ul>
 *     <li>AI：不转发</li>
 *     <li>CLIENT（及未登记）：AI 未暂停时直接进入对话链路（不受静音影响），暂停时只进转写链路</li>
 *     <li>COACH：经闸门进入对话链路，同时总是进入转写链路</li>
 * </ul>
 * 每帧每条链路最多发送一次，失败计数后丢弃。
 */
public class AudioRouter {
    private static final Logger log = LoggerFactory.getLogger(AudioRouter.class);
    // 未登记 id 的分项统计上限，超出后只计入总数
    static final int MAX_TRACKED_PARTICIPANTS = 64;

    private final String sessionId;
    private final ParticipantRegistry registry;
    private final AudioGate gate;
    private final TranscriptionLink transcription;
    private final SessionEventPublisher publisher;
    private final AudioEncoding encoding;
    private final Clock clock;

    private final AtomicBoolean aiPaused = new AtomicBoolean(false);

    private final AtomicLong totalReceived = new AtomicLong();
    private final AtomicLong sentToConversational = new AtomicLong();
    private final AtomicLong sentToTranscription = new AtomicLong();
    private final AtomicLong blockedByGate = new AtomicLong();
    private final AtomicLong invalidDropped = new AtomicLong();
    private final AtomicLong linkUnavailableDropped = new AtomicLong();
    private final ConcurrentHashMap<String, Counters> perParticipant = new ConcurrentHashMap<>();

    public AudioRouter(String sessionId, ParticipantRegistry registry, AudioGate gate,
                       TranscriptionLink transcription, SessionEventPublisher publisher, AudioEncoding encoding,
                       Clock clock) {
        this.sessionId = sessionId;
        this.registry = registry;
        this.gate = gate;
        this.transcription = transcription;
        this.publisher = publisher;
        this.encoding = encoding;
        this.clock = clock;
    }

    public void routeAudio(byte[] audio, String participantId, String participantName) {
        totalReceived.incrementAndGet();
        Counters pc = countersForFrame(participantId);
        pc.received.incrementAndGet();

        if (!FrameValidator.validate(audio)) {
            invalidDropped.incrementAndGet();
            log.trace("Invalid frame dropped: sessionId={}, participantId={}", sessionId, participantId);
            return;
        }

        ParticipantRole role = registry.roleOf(participantId);
        switch (role) {
            case AI:
                return;
            case COACH:
                toConversational(audio, participantId, pc, true);
                toTranscription(audio, pc);
                return;
            case CLIENT:
            case UNKNOWN:
            default:
                if (role == ParticipantRole.UNKNOWN) {
                    log.trace("Unregistered participant routed as client: sessionId={}, participantId={}, name={}",
                            sessionId, participantId, participantName);
                }
                if (aiPaused.get()) {
                    toTranscription(audio, pc);
                } else {
                    toConversational(audio, participantId, pc, false);
                }
        }
    }

    private void toConversational(byte[] audio, String participantId, Counters pc, boolean gated) {
        AudioFrame frame = AudioFrame.of(audio, participantId, encoding, clock.millis());
        GateDecision decision = gated ? gate.routeIfUnmuted(frame) : gate.forwardUngated(frame);
        switch (decision) {
            case FORWARDED:
                sentToConversational.incrementAndGet();
                pc.toConversational.incrementAndGet();
                break;
            case BLOCKED_MUTED:
                blockedByGate.incrementAndGet();
                pc.blocked.incrementAndGet();
                break;
            case INVALID:
                invalidDropped.incrementAndGet();
                break;
            case LINK_UNAVAILABLE:
            default:
                linkUnavailableDropped.incrementAndGet();
        }
    }

    private void toTranscription(byte[] audio, Counters pc) {
        if (transcription.sendAudio(audio)) {
            sentToTranscription.incrementAndGet();
            pc.toTranscription.incrementAndGet();
        } else {
            linkUnavailableDropped.incrementAndGet();
        }
    }

    public Participant registerParticipant(String participantId, ParticipantRole role, String displayName) {
        Participant p = registry.register(participantId, role, displayName);
        perParticipant.computeIfAbsent(key(participantId), k -> new Counters());
        return p;
    }

    /**
     * 注销同时解除该参与者的静音并丢弃其分项统计。
     */
    public boolean unregisterParticipant(String participantId) {
        boolean removed = registry.unregister(participantId);
        gate.unmuteFromAgent(participantId);
        perParticipant.remove(key(participantId));
        return removed;
    }

    public MuteOutcome muteParticipant(String participantId) {
        if (registry.find(participantId).isEmpty()) {
            log.warn("Mute rejected, unknown participant: sessionId={}, participantId={}", sessionId, participantId);
            return MuteOutcome.UNKNOWN_PARTICIPANT;
        }
        return gate.muteFromAgent(participantId) ? MuteOutcome.MUTED : MuteOutcome.ALREADY_MUTED;
    }

    public MuteOutcome unmuteParticipant(String participantId) {
        if (registry.find(participantId).isEmpty()) {
            log.warn("Unmute rejected, unknown participant: sessionId={}, participantId={}", sessionId, participantId);
            return MuteOutcome.UNKNOWN_PARTICIPANT;
        }
        return gate.unmuteFromAgent(participantId) ? MuteOutcome.UNMUTED : MuteOutcome.NOT_MUTED;
    }

    /**
     * 处理 {type:'mute-from-ai', participantId, muted}。
     */
    public MuteOutcome handleMuteCommand(String participantId, boolean muted) {
        return muted ? muteParticipant(participantId) : unmuteParticipant(participantId);
    }

    public boolean isParticipantMuted(String participantId) {
        return gate.isMuted(participantId);
    }

    public boolean pauseAI() {
        if (!aiPaused.compareAndSet(false, true)) return false;
        log.info("AI paused: sessionId={}", sessionId);
        publisher.publish(new PauseEvent(true));
        return true;
    }

    public boolean resumeAI() {
        if (!aiPaused.compareAndSet(true, false)) return false;
        log.info("AI resumed: sessionId={}", sessionId);
        publisher.publish(new PauseEvent(false));
        return true;
    }

    public boolean isAIPaused() {
        return aiPaused.get();
    }

    public void forceKeepAlive() {
        gate.forceKeepAlive();
    }

    public RouterStats getStats() {
        Map<String, RouterStats.ParticipantStats> byParticipant = new HashMap<>();
        perParticipant.forEach((id, c) -> byParticipant.put(id, new RouterStats.ParticipantStats(
                id,
                registry.roleOf(id),
                c.received.get(),
                c.toConversational.get(),
                c.toTranscription.get(),
                c.blocked.get(),
                gate.isMuted(id))));
        return new RouterStats(
                totalReceived.get(),
                sentToConversational.get(),
                sentToTranscription.get(),
                blockedByGate.get(),
                invalidDropped.get(),
                linkUnavailableDropped.get(),
                byParticipant);
    }

    public GateStatus getGateStatus() {
        return gate.status();
    }

    public void cleanup() {
        gate.cleanup();
        registry.clear();
        log.info("Router cleaned up: sessionId={}, totalReceived={}, toConversational={}, toTranscription={}, blocked={}",
                sessionId, totalReceived.get(), sentToConversational.get(), sentToTranscription.get(), blockedByGate.get());
        totalReceived.set(0);
        sentToConversational.set(0);
        sentToTranscription.set(0);
        blockedByGate.set(0);
        invalidDropped.set(0);
        linkUnavailableDropped.set(0);
        perParticipant.clear();
    }

    private Counters countersForFrame(String participantId) {
        String key = key(participantId);
        Counters c = perParticipant.get(key);
        if (c != null) return c;
        if (perParticipant.size() >= MAX_TRACKED_PARTICIPANTS) {
            log.trace("Per-participant stats full, not tracking: sessionId={}, participantId={}", sessionId, participantId);
            return new Counters();
        }
        return perParticipant.computeIfAbsent(key, k -> new Counters());
    }

    private static String key(String participantId) {
        return participantId == null ? "" : participantId;
    }

    private static final class Counters {
        final AtomicLong received = new AtomicLong();
        final AtomicLong toConversational = new AtomicLong();
        final AtomicLong toTranscription = new AtomicLong();
        final AtomicLong blocked = new AtomicLong();
    }
}
