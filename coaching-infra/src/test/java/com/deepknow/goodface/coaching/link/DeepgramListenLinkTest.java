package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.domain.event.SessionEventType;
import com.deepknow.goodface.coaching.domain.event.TranscriptEvent;
import com.deepknow.goodface.coaching.domain.link.LinkState;
import com.deepknow.goodface.coaching.domain.link.TranscriptResult;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.support.Await;
import com.deepknow.goodface.coaching.support.FakeLinkConnector;
import com.deepknow.goodface.coaching.support.RecordingPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class DeepgramListenLinkTest {
    private static final String FINAL_RESULT = "{\"type\":\"Results\",\"is_final\":true,\"start\":1.5,\"duration\":0.8,"
            + "\"channel\":{\"alternatives\":[{\"transcript\":\"hello there\",\"confidence\":0.92,"
            + "\"words\":[{\"word\":\"hello\",\"punctuated_word\":\"Hello\",\"start\":1.5,\"end\":1.8,\"confidence\":0.95},"
            + "{\"word\":\"there\",\"start\":1.9,\"end\":2.2,\"confidence\":0.9}]}]}}";

    private ScheduledExecutorService scheduler;
    private FakeLinkConnector connector;
    private RecordingPublisher publisher;
    private DeepgramListenLink link;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        connector = new FakeLinkConnector();
        publisher = new RecordingPublisher();
        CoachingSessionConfig config = CoachingSessionConfig.builder()
                .apiKey("test-key")
                .reconnectBaseDelayMs(10)
                .closeGraceMs(20)
                .build();
        link = new DeepgramListenLink("s1", config, connector, scheduler, publisher, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        link.close();
        scheduler.shutdownNow();
    }

    @Test
    void readyImmediatelyOnOpen() {
        link.connect();
        String uri = connector.last().uri.toString();
        assertThat(uri).startsWith("wss://api.deepgram.com/v1/listen?");
        assertThat(uri).contains("encoding=linear16", "sample_rate=24000", "model=nova-3", "interim_results=true");

        FakeLinkConnector.FakeSocket socket = connector.last().open();
        assertThat(link.getState()).isEqualTo(LinkState.READY);
        assertThat(link.sendAudio(new byte[]{1, 2})).isTrue();
        assertThat(link.sendAudio(new byte[0])).isFalse();
        assertThat(socket.binaries).hasSize(1);
    }

    @Test
    void finalResultIsParsedAndBuffered() {
        link.connect();
        connector.last().open();
        connector.last().receive(FINAL_RESULT);

        List<TranscriptEvent> events = publisher.ofType(TranscriptEvent.class);
        assertThat(events).hasSize(1);
        TranscriptResult result = events.get(0).getResult();
        assertThat(result.getTranscript()).isEqualTo("hello there");
        assertThat(result.getConfidence()).isEqualTo(0.92);
        assertThat(result.isFinal()).isTrue();
        assertThat(result.getStart()).isEqualTo(1.5);
        assertThat(result.getDuration()).isEqualTo(0.8);
        assertThat(result.getWords()).extracting(TranscriptResult.Word::getWord).containsExactly("Hello", "there");
        assertThat(link.finalTranscripts()).hasSize(1);
    }

    @Test
    void interimAndBlankResults() {
        link.connect();
        connector.last().open();
        connector.last().receive("{\"type\":\"Results\",\"is_final\":false,\"channel\":{\"alternatives\":[{\"transcript\":\"hel\"}]}}");
        connector.last().receive("{\"type\":\"Results\",\"is_final\":true,\"channel\":{\"alternatives\":[{\"transcript\":\"  \"}]}}");
        connector.last().receive("{\"type\":\"UtteranceEnd\"}");

        assertThat(publisher.ofType(TranscriptEvent.class)).hasSize(1);
        assertThat(link.finalTranscripts()).isEmpty();
        assertThat(publisher.events()).anyMatch(e -> e.getType() == SessionEventType.UTTERANCE_END);
    }

    @Test
    void closeStreamSendsCloseThenClosesAfterGrace() {
        link.connect();
        FakeLinkConnector.FakeSocket socket = connector.last().open();

        link.closeStream();
        assertThat(socket.sentType("CloseStream")).isTrue();

        Await.until(() -> link.getState() == LinkState.DISCONNECTED, 2000);
        assertThat(socket.closeCode).isEqualTo(1000);
    }

    @Test
    void closeStreamWhenNotReadyClosesImmediately() {
        link.connect();
        link.closeStream();

        assertThat(link.getState()).isEqualTo(LinkState.DISCONNECTED);
        connector.last().open();
        assertThat(link.getState()).isEqualTo(LinkState.DISCONNECTED);
    }
}
