package com.deepknow.goodface.coaching.domain.event;

/**
 * 会话内事件。所有实现均为不可变值对象。
 */
public interface SessionEvent {
    SessionEventType getType();

    long getTimestamp();

    /** 事件来源：链路名或组件名。 */
    String getSource();
}
