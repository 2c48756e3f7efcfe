package com.deepknow.goodface.coaching.domain.link;

import java.util.Collections;
import java.util.List;

/**
 * 一次转写结果（临时或最终）。
 */
public final class TranscriptResult {
    private final String transcript;
    private final double confidence;
    private final boolean isFinal;
    private final List<Word> words;
    private final double start;
    private final double duration;

    public TranscriptResult(String transcript, double confidence, boolean isFinal,
                            List<Word> words, double start, double duration) {
        this.transcript = transcript;
        this.confidence = confidence;
        this.isFinal = isFinal;
        this.words = words == null ? Collections.emptyList() : List.copyOf(words);
        this.start = start;
        this.duration = duration;
    }

    public String getTranscript() { return transcript; }
    public double getConfidence() { return confidence; }
    public boolean isFinal() { return isFinal; }
    public List<Word> getWords() { return words; }
    public double getStart() { return start; }
    public double getDuration() { return duration; }

    public static final class Word {
        private final String word;
        private final double start;
        private final double end;
        private final double confidence;

        public Word(String word, double start, double end, double confidence) {
            this.word = word;
            this.start = start;
            this.end = end;
            this.confidence = confidence;
        }

        public String getWord() { return word; }
        public double getStart() { return start; }
        public double getEnd() { return end; }
        public double getConfidence() { return confidence; }
    }
}
