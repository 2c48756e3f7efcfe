package com.deepknow.goodface.coaching.domain.event;

@FunctionalInterface
public interface SessionEventPublisher {
    void publish(SessionEvent event);
}
