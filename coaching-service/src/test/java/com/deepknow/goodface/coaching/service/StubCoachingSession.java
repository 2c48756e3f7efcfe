package com.deepknow.goodface.coaching.service;

import com.deepknow.goodface.coaching.domain.audio.GateStatus;
import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.audio.RouterStats;
import com.deepknow.goodface.coaching.domain.event.SessionEventListener;
import com.deepknow.goodface.coaching.domain.event.Subscription;
import com.deepknow.goodface.coaching.domain.link.LinkStatus;
import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.SessionHealth;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 只保存状态的会话替身，guidanceResult 决定 sendGuidance 的返回。
 */
class StubCoachingSession implements CoachingSession {
    final String sessionId;
    final Map<String, ParticipantRole> participants = new HashMap<>();
    final Set<String> muted = new LinkedHashSet<>();
    CompletableFuture<Void> guidanceResult = CompletableFuture.completedFuture(null);
    String lastGuidance;
    boolean paused;
    boolean closed;

    StubCoachingSession(String sessionId) {
        this.sessionId = sessionId;
    }

    @Override public String getSessionId() { return sessionId; }
    @Override public void start() { }
    @Override public void routeAudio(byte[] audio, String participantId, String participantName) { }

    @Override
    public void registerParticipant(String participantId, ParticipantRole role, String displayName) {
        participants.put(participantId, role);
    }

    @Override
    public void unregisterParticipant(String participantId) {
        participants.remove(participantId);
        muted.remove(participantId);
    }

    @Override
    public MuteOutcome setMutedFromAi(String participantId, boolean mute) {
        if (!participants.containsKey(participantId)) return MuteOutcome.UNKNOWN_PARTICIPANT;
        if (mute) return muted.add(participantId) ? MuteOutcome.MUTED : MuteOutcome.ALREADY_MUTED;
        return muted.remove(participantId) ? MuteOutcome.UNMUTED : MuteOutcome.NOT_MUTED;
    }

    @Override
    public boolean pauseAI() {
        if (paused) return false;
        paused = true;
        return true;
    }

    @Override
    public boolean resumeAI() {
        if (!paused) return false;
        paused = false;
        return true;
    }

    @Override public boolean isAIPaused() { return paused; }

    @Override
    public CompletableFuture<Void> sendGuidance(String text, String coachId) {
        lastGuidance = text;
        return guidanceResult;
    }

    @Override
    public RouterStats getStats() {
        Map<String, RouterStats.ParticipantStats> byParticipant = new HashMap<>();
        byParticipant.put("c2", new RouterStats.ParticipantStats("c2", ParticipantRole.COACH, 4, 1, 4, 3, true));
        byParticipant.put("c1", new RouterStats.ParticipantStats("c1", ParticipantRole.CLIENT, 6, 6, 0, 0, false));
        return new RouterStats(10, 7, 4, 3, 0, 0, byParticipant);
    }

    @Override
    public GateStatus getGateStatus() {
        return new GateStatus(List.copyOf(muted), !muted.isEmpty(), 120);
    }

    @Override public List<LinkStatus> linkStatuses() { return List.of(); }
    @Override public SessionHealth health() { return SessionHealth.CONNECTED; }
    @Override public Subscription subscribe(SessionEventListener listener) { return () -> { }; }
    @Override public void cleanup() { closed = true; }
    @Override public boolean isClosed() { return closed; }
}
