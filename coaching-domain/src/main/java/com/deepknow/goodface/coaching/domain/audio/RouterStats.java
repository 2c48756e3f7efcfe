package com.deepknow.goodface.coaching.domain.audio;

import java.util.Collections;
import java.util.Map;

/**
 * 路由统计的不可变快照。计数器单调递增，仅随会话重置。
 */
public final class RouterStats {
    private final long totalReceived;
    private final long sentToConversational;
    private final long sentToTranscription;
    private final long blockedByGate;
    private final long invalidDropped;
    private final long linkUnavailableDropped;
    private final Map<String, ParticipantStats> byParticipant;

    public RouterStats(long totalReceived, long sentToConversational, long sentToTranscription,
                       long blockedByGate, long invalidDropped, long linkUnavailableDropped,
                       Map<String, ParticipantStats> byParticipant) {
        this.totalReceived = totalReceived;
        this.sentToConversational = sentToConversational;
        this.sentToTranscription = sentToTranscription;
        this.blockedByGate = blockedByGate;
        this.invalidDropped = invalidDropped;
        this.linkUnavailableDropped = linkUnavailableDropped;
        this.byParticipant = byParticipant == null ? Collections.emptyMap() : Map.copyOf(byParticipant);
    }

    public long getTotalReceived() { return totalReceived; }
    public long getSentToConversational() { return sentToConversational; }
    public long getSentToTranscription() { return sentToTranscription; }
    public long getBlockedByGate() { return blockedByGate; }
    public long getInvalidDropped() { return invalidDropped; }
    public long getLinkUnavailableDropped() { return linkUnavailableDropped; }
    public Map<String, ParticipantStats> getByParticipant() { return byParticipant; }

    public ParticipantStats participant(String participantId) {
        return byParticipant.get(participantId);
    }

    public static final class ParticipantStats {
        private final String participantId;
        private final ParticipantRole role;
        private final long received;
        private final long toConversational;
        private final long toTranscription;
        private final long blocked;
        private final boolean muted;

        public ParticipantStats(String participantId, ParticipantRole role, long received,
                                long toConversational, long toTranscription, long blocked, boolean muted) {
            this.participantId = participantId;
            this.role = role;
            this.received = received;
            this.toConversational = toConversational;
            this.toTranscription = toTranscription;
            this.blocked = blocked;
            this.muted = muted;
        }

        public String getParticipantId() { return participantId; }
        public ParticipantRole getRole() { return role; }
        public long getReceived() { return received; }
        public long getToConversational() { return toConversational; }
        public long getToTranscription() { return toTranscription; }
        public long getBlocked() { return blocked; }
        public boolean isMuted() { return muted; }
    }
}
