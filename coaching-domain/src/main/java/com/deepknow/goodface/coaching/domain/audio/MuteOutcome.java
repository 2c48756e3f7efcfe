package com.deepknow.goodface.coaching.domain.audio;

public enum MuteOutcome {
    MUTED,
    ALREADY_MUTED,
    UNMUTED,
    NOT_MUTED,
    UNKNOWN_PARTICIPANT;

    public boolean isChanged() {
        return this == MUTED || this == UNMUTED;
    }
}
