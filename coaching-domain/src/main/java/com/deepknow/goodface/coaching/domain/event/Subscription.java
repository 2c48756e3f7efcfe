package com.deepknow.goodface.coaching.domain.event;

/**
 * 取消订阅句柄，可重复关闭。
 */
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
