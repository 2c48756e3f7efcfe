package com.deepknow.goodface.coaching.domain.feature;

public final class FunctionCallRecord {
    private final String functionName;
    private final String functionCallId;
    private final boolean success;
    private final String response;
    private final long timestamp;

    public FunctionCallRecord(String functionName, String functionCallId, boolean success, String response, long timestamp) {
        this.functionName = functionName;
        this.functionCallId = functionCallId;
        this.success = success;
        this.response = response;
        this.timestamp = timestamp;
    }

    public String getFunctionName() { return functionName; }
    public String getFunctionCallId() { return functionCallId; }
    public boolean isSuccess() { return success; }
    public String getResponse() { return response; }
    public long getTimestamp() { return timestamp; }
}
