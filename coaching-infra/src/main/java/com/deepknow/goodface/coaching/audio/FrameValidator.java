package com.deepknow.goodface.coaching.audio;

import com.deepknow.goodface.coaching.domain.audio.AudioFrame;

/**
 * 音频帧有效性检查：非 null 且非空。
 */
public final class FrameValidator {
    private FrameValidator() {}

    public static boolean validate(byte[] payload) {
        return payload != null && payload.length > 0;
    }

    public static boolean validate(AudioFrame frame) {
        return frame != null && validate(frame.getBytes());
    }
}
