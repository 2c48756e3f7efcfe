package com.deepknow.goodface.coaching.domain.link;

public final class LinkStatus {
    private final String name;
    private final LinkState state;
    private final int reconnectAttempts;

    public LinkStatus(String name, LinkState state, int reconnectAttempts) {
        this.name = name;
        this.state = state;
        this.reconnectAttempts = reconnectAttempts;
    }

    public String getName() { return name; }
    public LinkState getState() { return state; }
    public int getReconnectAttempts() { return reconnectAttempts; }

    @Override
    public String toString() {
        return name + "[" + state + ", attempts=" + reconnectAttempts + "]";
    }
}
