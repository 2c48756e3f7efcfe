package com.deepknow.goodface.coaching.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class ParticipantStatsInfo implements Serializable {
    private static final long serialVersionUID = -8842716605123991584L;
    private String participantId;
    private String role;
    private long received;
    private long toConversational;
    private long toTranscription;
    private long blocked;
    private boolean muted;
}
