package com.deepknow.goodface.coaching.domain.event;

import com.fasterxml.jackson.databind.JsonNode;

public class FunctionCallRequestEvent extends AbstractSessionEvent {
    private final String functionName;
    private final String functionCallId;
    private final JsonNode input;

    public FunctionCallRequestEvent(String source, String functionName, String functionCallId, JsonNode input) {
        super(SessionEventType.FUNCTION_CALL_REQUEST, source);
        this.functionName = functionName;
        this.functionCallId = functionCallId;
        this.input = input;
    }

    public String getFunctionName() { return functionName; }
    public String getFunctionCallId() { return functionCallId; }
    public JsonNode getInput() { return input; }
}
