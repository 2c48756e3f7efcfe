package com.deepknow.goodface.coaching.domain.audio;

/**
 * 单个音频帧，仅在一次路由调用内存在，不做排队。
 */
public final class AudioFrame {
    private final byte[] bytes;
    private final String participantId;
    private final long capturedAt;
    private final AudioEncoding encoding;
    private final int sampleRate;

    public AudioFrame(byte[] bytes, String participantId, long capturedAt, AudioEncoding encoding, int sampleRate) {
        this.bytes = bytes;
        this.participantId = participantId;
        this.capturedAt = capturedAt;
        this.encoding = encoding;
        this.sampleRate = sampleRate;
    }

    public static AudioFrame of(byte[] bytes, String participantId, AudioEncoding encoding, long capturedAt) {
        AudioEncoding enc = encoding == null ? AudioEncoding.OPUS : encoding;
        return new AudioFrame(bytes, participantId, capturedAt, enc, enc.getSampleRate());
    }

    public byte[] getBytes() { return bytes; }
    public String getParticipantId() { return participantId; }
    public long getCapturedAt() { return capturedAt; }
    public AudioEncoding getEncoding() { return encoding; }
    public int getSampleRate() { return sampleRate; }
    public int length() { return bytes == null ? 0 : bytes.length; }
}
