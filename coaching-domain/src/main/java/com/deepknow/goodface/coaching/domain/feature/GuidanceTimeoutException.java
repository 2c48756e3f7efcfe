package com.deepknow.goodface.coaching.domain.feature;

/**
 * 已发送但在超时时间内未收到 PromptUpdated 确认。
 */
public class GuidanceTimeoutException extends GuidanceException {
    private final long timeoutMillis;

    public GuidanceTimeoutException(long timeoutMillis) {
        super("Guidance not confirmed within " + timeoutMillis + "ms");
        this.timeoutMillis = timeoutMillis;
    }

    public long getTimeoutMillis() { return timeoutMillis; }
}
