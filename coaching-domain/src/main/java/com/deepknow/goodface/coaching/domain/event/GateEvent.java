package com.deepknow.goodface.coaching.domain.event;

public class GateEvent extends AbstractSessionEvent {
    public enum Action { MUTED, UNMUTED, KEEPALIVE_STARTED, KEEPALIVE_STOPPED }

    private final Action action;
    // KEEPALIVE_* 时为 null
    private final String participantId;

    public GateEvent(Action action, String participantId) {
        super(SessionEventType.GATE, "gate");
        this.action = action;
        this.participantId = participantId;
    }

    public Action getAction() { return action; }
    public String getParticipantId() { return participantId; }
}
