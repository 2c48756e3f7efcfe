package com.deepknow.goodface.coaching.domain.event;

public class GuidanceEvent extends AbstractSessionEvent {
    public enum Status { SENT, CONFIRMED, FAILED }

    private final Status status;
    private final String text;
    private final String coachId;
    private final String reason;

    public GuidanceEvent(Status status, String text, String coachId, String reason) {
        super(SessionEventType.GUIDANCE, "guidance");
        this.status = status;
        this.text = text;
        this.coachId = coachId;
        this.reason = reason;
    }

    public Status getStatus() { return status; }
    public String getText() { return text; }
    public String getCoachId() { return coachId; }
    public String getReason() { return reason; }
}
