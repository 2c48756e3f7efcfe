package com.deepknow.goodface.coaching.domain.event;

import com.deepknow.goodface.coaching.domain.link.LinkState;

public class LinkStateEvent extends AbstractSessionEvent {
    private final LinkState from;
    private final LinkState to;
    private final int reconnectAttempts;

    public LinkStateEvent(String linkName, LinkState from, LinkState to, int reconnectAttempts) {
        super(SessionEventType.LINK_STATE, linkName);
        this.from = from;
        this.to = to;
        this.reconnectAttempts = reconnectAttempts;
    }

    public LinkState getFrom() { return from; }
    public LinkState getTo() { return to; }
    public int getReconnectAttempts() { return reconnectAttempts; }
}
