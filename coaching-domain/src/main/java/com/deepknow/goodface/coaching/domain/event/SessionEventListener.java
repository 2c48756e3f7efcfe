package com.deepknow.goodface.coaching.domain.event;

@FunctionalInterface
public interface SessionEventListener {
    void onEvent(SessionEvent event);
}
