package com.deepknow.goodface.coaching.domain.event;

public class ConversationTextEvent extends AbstractSessionEvent {
    private final String role;
    private final String content;

    public ConversationTextEvent(String source, String role, String content) {
        super(SessionEventType.CONVERSATION_TEXT, source);
        this.role = role;
        this.content = content;
    }

    public String getRole() { return role; }
    public String getContent() { return content; }
}
