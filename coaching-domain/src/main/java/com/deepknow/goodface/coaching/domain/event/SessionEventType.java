package com.deepknow.goodface.coaching.domain.event;

public enum SessionEventType {
    LINK_STATE,
    SETTINGS_APPLIED,
    CONVERSATION_TEXT,
    TRANSCRIPT,
    USER_STARTED_SPEAKING,
    USER_STOPPED_SPEAKING,
    AGENT_STARTED_SPEAKING,
    AGENT_AUDIO_DONE,
    SPEECH_STARTED,
    UTTERANCE_END,
    BARGE_IN,
    PROMPT_UPDATED,
    GATE,
    GUIDANCE,
    FUNCTION_CALL_REQUEST,
    FUNCTION_CALL,
    ERROR,
    AGENT_AUDIO,
    AI_PAUSE
}
