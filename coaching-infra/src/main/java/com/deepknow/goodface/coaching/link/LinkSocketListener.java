package com.deepknow.goodface.coaching.link;

/**
 * 上游连接回调。文本与二进制回调只在完整消息到达后触发。
 */
public interface LinkSocketListener {
    void onOpen(LinkSocket socket);

    void onText(String text);

    void onBinary(byte[] data);

    void onClosed(int code, String reason);

    void onError(Throwable error);
}
