package com.deepknow.goodface.coaching.domain.audio;

import java.util.Collections;
import java.util.List;

/**
 * 闸门状态快照。
 */
public final class GateStatus {
    private final List<String> mutedParticipants;
    private final boolean keepAliveActive;
    // 从未发送过音频时为 -1
    private final long millisSinceLastAudio;

    public GateStatus(List<String> mutedParticipants, boolean keepAliveActive, long millisSinceLastAudio) {
        this.mutedParticipants = mutedParticipants == null ? Collections.emptyList() : List.copyOf(mutedParticipants);
        this.keepAliveActive = keepAliveActive;
        this.millisSinceLastAudio = millisSinceLastAudio;
    }

    public List<String> getMutedParticipants() { return mutedParticipants; }
    public boolean isKeepAliveActive() { return keepAliveActive; }
    public long getMillisSinceLastAudio() { return millisSinceLastAudio; }
}
