package com.deepknow.goodface.coaching.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * AI 合成音频（linear16）。推送端以二进制发送，不参与 JSON 序列化。
 */
public class AgentAudioEvent extends AbstractSessionEvent {
    private final byte[] audio;

    public AgentAudioEvent(String source, byte[] audio) {
        super(SessionEventType.AGENT_AUDIO, source);
        this.audio = audio;
    }

    @JsonIgnore
    public byte[] getAudio() { return audio; }

    public int getLength() { return audio == null ? 0 : audio.length; }
}
