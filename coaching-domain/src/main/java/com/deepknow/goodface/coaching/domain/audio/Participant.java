package com.deepknow.goodface.coaching.domain.audio;

import java.util.Objects;

/**
 * 会话参与者。角色在其生命周期内不变。
 */
public final class Participant {
    private final String id;
    private final String displayName;
    private final ParticipantRole role;

    public Participant(String id, String displayName, ParticipantRole role) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = displayName;
        this.role = role == null ? ParticipantRole.UNKNOWN : role;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public ParticipantRole getRole() { return role; }

    @Override
    public String toString() {
        return "Participant{id=" + id + ", name=" + displayName + ", role=" + role + "}";
    }
}
