package com.deepknow.goodface.coaching.domain.link;

/**
 * 上游连接状态机：
 * DISCONNECTED -> CONNECTING -> SETTINGS_PENDING -> READY -> (CLOSING | DISCONNECTED)，FAILED 为终态。
 */
public enum LinkState {
    DISCONNECTED,
    CONNECTING,
    SETTINGS_PENDING,
    READY,
    CLOSING,
    FAILED;

    public boolean isTerminal() {
        return this == FAILED;
    }
}
