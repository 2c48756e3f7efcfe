package com.deepknow.goodface.coaching.domain.audio;

/**
 * 参与者角色。UNKNOWN 表示未登记，路由策略按 CLIENT 处理。
 */
public enum ParticipantRole {
    CLIENT,
    COACH,
    AI,
    UNKNOWN;

    public static ParticipantRole parse(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return ParticipantRole.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
