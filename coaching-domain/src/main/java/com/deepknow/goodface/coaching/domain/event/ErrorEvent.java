package com.deepknow.goodface.coaching.domain.event;

public class ErrorEvent extends AbstractSessionEvent {
    public static final String LINK_FAILED = "LINK_FAILED";

    private final String code;
    private final String message;
    // 终态错误：链路不会再重试
    private final boolean terminal;

    public ErrorEvent(String source, String code, String message, boolean terminal) {
        super(SessionEventType.ERROR, source);
        this.code = code;
        this.message = message;
        this.terminal = terminal;
    }

    public String getCode() { return code; }
    public String getMessage() { return message; }
    public boolean isTerminal() { return terminal; }
}
