package com.deepknow.goodface.coaching.domain.audio;

public enum AudioEncoding {
    OPUS("opus", 48000),
    LINEAR16("linear16", 24000);

    private final String wireName;
    private final int sampleRate;

    AudioEncoding(String wireName, int sampleRate) {
        this.wireName = wireName;
        this.sampleRate = sampleRate;
    }

    public static AudioEncoding fromWireName(String name) {
        for (AudioEncoding e : values()) {
            if (e.wireName.equalsIgnoreCase(name)) return e;
        }
        return LINEAR16;
    }

    public String getWireName() { return wireName; }
    public int getSampleRate() { return sampleRate; }
}
