package com.deepknow.goodface.coaching.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class RoutingStatsInfo implements Serializable {
    private static final long serialVersionUID = 5001867409382215417L;
    private String sessionId;
    private long totalReceived;
    private long sentToConversational;
    private long sentToTranscription;
    private long blockedByGate;
    private long invalidDropped;
    private long linkUnavailableDropped;
    private boolean aiPaused;
    private boolean keepAliveActive;
    private List<String> mutedParticipants;
    private String health;
    private List<ParticipantStatsInfo> participants;
}
