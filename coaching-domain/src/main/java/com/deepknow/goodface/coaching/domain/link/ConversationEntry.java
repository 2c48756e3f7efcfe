package com.deepknow.goodface.coaching.domain.link;

public final class ConversationEntry {
    private final String role;
    private final String content;
    private final long timestamp;

    public ConversationEntry(String role, String content, long timestamp) {
        this.role = role;
        this.content = content;
        this.timestamp = timestamp;
    }

    public String getRole() { return role; }
    public String getContent() { return content; }
    public long getTimestamp() { return timestamp; }
}
