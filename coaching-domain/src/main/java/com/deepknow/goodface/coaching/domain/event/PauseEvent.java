package com.deepknow.goodface.coaching.domain.event;

public class PauseEvent extends AbstractSessionEvent {
    private final boolean paused;

    public PauseEvent(boolean paused) {
        super(SessionEventType.AI_PAUSE, "router");
        this.paused = paused;
    }

    public boolean isPaused() { return paused; }
}
