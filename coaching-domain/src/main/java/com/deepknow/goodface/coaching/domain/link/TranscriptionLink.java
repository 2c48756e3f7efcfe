package com.deepknow.goodface.coaching.domain.link;

import java.util.List;

/**
 * 转写链路：只做语音识别，不参与对话。
 */
public interface TranscriptionLink extends UpstreamLink {
    /**
     * 发送 CloseStream，等待短暂宽限期后以 1000 关闭连接。
     */
    void closeStream();

    List<TranscriptResult> finalTranscripts();
}
