package com.deepknow.goodface.coaching.domain.feature;

public final class GuidanceRecord {
    private final String text;
    private final String coachId;
    private final long sentAt;

    public GuidanceRecord(String text, String coachId, long sentAt) {
        this.text = text;
        this.coachId = coachId;
        this.sentAt = sentAt;
    }

    public String getText() { return text; }
    public String getCoachId() { return coachId; }
    public long getSentAt() { return sentAt; }
}
