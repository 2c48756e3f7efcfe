package com.deepknow.goodface.coaching.domain.audio;

/**
 * 闸门对单帧的处理结果。
 */
public enum GateDecision {
    FORWARDED,
    BLOCKED_MUTED,
    INVALID,
    LINK_UNAVAILABLE
}
