package com.deepknow.goodface.coaching.domain.event;

import com.deepknow.goodface.coaching.domain.link.TranscriptResult;

public class TranscriptEvent extends AbstractSessionEvent {
    private final TranscriptResult result;

    public TranscriptEvent(String source, TranscriptResult result) {
        super(SessionEventType.TRANSCRIPT, source);
        this.result = result;
    }

    public TranscriptResult getResult() { return result; }
}
