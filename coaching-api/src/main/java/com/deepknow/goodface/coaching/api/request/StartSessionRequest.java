package com.deepknow.goodface.coaching.api.request;

import lombok.Data;

import java.io.Serializable;
import java.util.Map;

@Data
public class StartSessionRequest implements Serializable {
    private static final long serialVersionUID = 4117339028156214303L;
    private String sessionId;
    // 可选覆盖：prompt / greeting / llmModel / voiceModel
    private Map<String, Object> config;
}
