package com.deepknow.goodface.coaching.domain.event;

public abstract class AbstractSessionEvent implements SessionEvent {
    private final SessionEventType type;
    private final String source;
    private final long timestamp;

    protected AbstractSessionEvent(SessionEventType type, String source) {
        this.type = type;
        this.source = source;
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public SessionEventType getType() { return type; }

    @Override
    public String getSource() { return source; }

    @Override
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + type + ", source=" + source + "}";
    }
}
