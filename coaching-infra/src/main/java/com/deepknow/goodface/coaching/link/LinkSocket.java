package com.deepknow.goodface.coaching.link;

import java.util.concurrent.CompletableFuture;

/**
 * 已打开的上游 WebSocket。同一时刻只允许一个发送在途：文本串行排队，音频在忙时直接丢弃。
 */
public interface LinkSocket {
    CompletableFuture<Void> sendText(String text);

    /**
     * @return false 表示连接已关闭或上一帧尚未发完（背压丢帧）
     */
    boolean sendBinary(byte[] data);

    void close(int code, String reason);

    boolean isOpen();
}
