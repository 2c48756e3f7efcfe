package com.deepknow.goodface.coaching.domain.event;

/**
 * 函数调用已处理并回复。
 */
public class FunctionCallEvent extends AbstractSessionEvent {
    private final String functionName;
    private final String functionCallId;
    private final boolean success;
    private final String output;
    private final long durationMillis;

    public FunctionCallEvent(String functionName, String functionCallId, boolean success, String output, long durationMillis) {
        super(SessionEventType.FUNCTION_CALL, "functions");
        this.functionName = functionName;
        this.functionCallId = functionCallId;
        this.success = success;
        this.output = output;
        this.durationMillis = durationMillis;
    }

    public String getFunctionName() { return functionName; }
    public String getFunctionCallId() { return functionCallId; }
    public boolean isSuccess() { return success; }
    public String getOutput() { return output; }
    public long getDurationMillis() { return durationMillis; }
}
