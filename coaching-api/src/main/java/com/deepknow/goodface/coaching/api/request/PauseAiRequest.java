package com.deepknow.goodface.coaching.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class PauseAiRequest implements Serializable {
    private static final long serialVersionUID = -3320912745508417631L;
    private String sessionId;
    private boolean paused;
}
