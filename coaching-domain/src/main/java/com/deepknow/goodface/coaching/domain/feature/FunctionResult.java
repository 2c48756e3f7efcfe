package com.deepknow.goodface.coaching.domain.feature;

public final class FunctionResult {
    private final boolean success;
    // 成功时为 JSON 字符串
    private final String output;
    private final String error;

    private FunctionResult(boolean success, String output, String error) {
        this.success = success;
        this.output = output;
        this.error = error;
    }

    public static FunctionResult ok(String output) {
        return new FunctionResult(true, output, null);
    }

    public static FunctionResult fail(String error) {
        return new FunctionResult(false, null, error);
    }

    public boolean isSuccess() { return success; }
    public String getOutput() { return output; }
    public String getError() { return error; }
}
