package com.deepknow.goodface.coaching.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class MuteFromAiRequest implements Serializable {
    private static final long serialVersionUID = 2690745581926305517L;
    private String sessionId;
    private String participantId;
    private boolean muted;
}
