package com.deepknow.goodface.coaching.domain.event;

/**
 * 无负载的信号类事件：说话状态、语音起止、打断、提示词已更新、设置已生效。
 */
public class SignalEvent extends AbstractSessionEvent {
    public SignalEvent(SessionEventType type, String source) {
        super(type, source);
    }
}
