package com.deepknow.goodface.coaching.domain.link;

/**
 * 到远端语音服务的长连接。发送方法不阻塞、不排队，未就绪时返回 false。
 */
public interface UpstreamLink extends AutoCloseable {
    String name();

    void connect();

    boolean sendAudio(byte[] audio);

    boolean keepAlive();

    LinkState getState();

    LinkStatus status();

    default boolean isReady() {
        return getState() == LinkState.READY;
    }

    /**
     * 主动关闭，不触发重连。
     */
    @Override
    void close();
}
