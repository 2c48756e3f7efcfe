package com.deepknow.goodface.coaching.audio;

import com.deepknow.goodface.coaching.domain.audio.AudioEncoding;
import com.deepknow.goodface.coaching.domain.audio.AudioFrame;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrameValidatorTest {

    @Test
    void rejectsNullAndEmptyPayloads() {
        assertThat(FrameValidator.validate((byte[]) null)).isFalse();
        assertThat(FrameValidator.validate(new byte[0])).isFalse();
        assertThat(FrameValidator.validate((AudioFrame) null)).isFalse();
        assertThat(FrameValidator.validate(AudioFrame.of(new byte[0], "c1", AudioEncoding.LINEAR16, 0L))).isFalse();
    }

    @Test
    void acceptsNonEmptyPayload() {
        assertThat(FrameValidator.validate(new byte[]{1})).isTrue();
        assertThat(FrameValidator.validate(AudioFrame.of(new byte[320], "c1", AudioEncoding.LINEAR16, 0L))).isTrue();
    }
}
