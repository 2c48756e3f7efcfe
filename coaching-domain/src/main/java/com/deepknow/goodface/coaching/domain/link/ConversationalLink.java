package com.deepknow.goodface.coaching.domain.link;

import java.util.List;

/**
 * 对话链路：AI 语音代理（识别 + 推理 + 合成）。
 */
public interface ConversationalLink extends UpstreamLink {
    boolean updatePrompt(String prompt);

    boolean injectUserMessage(String content);

    boolean injectAgentMessage(String content);

    /**
     * @param output 函数执行结果的 JSON 字符串
     */
    boolean functionCallResponse(String functionCallId, String output);

    boolean clear();

    boolean closeStream();

    boolean isAgentSpeaking();

    /** Welcome 消息中的远端会话 id，未收到时为 null。 */
    String remoteSessionId();

    List<ConversationEntry> transcriptLog();
}
