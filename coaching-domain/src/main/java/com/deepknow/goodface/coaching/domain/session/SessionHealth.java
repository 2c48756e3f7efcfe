package com.deepknow.goodface.coaching.domain.session;

/**
 * CONNECTED：两条链路均就绪；DEGRADED：仅一条可用或正在重连；DISCONNECTED：均不可用。
 */
public enum SessionHealth {
    CONNECTED,
    DEGRADED,
    DISCONNECTED
}
