package com.deepknow.goodface.coaching.session;

import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.event.AgentAudioEvent;
import com.deepknow.goodface.coaching.domain.event.ErrorEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEvent;
import com.deepknow.goodface.coaching.domain.link.LinkState;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.domain.session.SessionHealth;
import com.deepknow.goodface.coaching.support.Await;
import com.deepknow.goodface.coaching.support.FakeLinkConnector;
import com.deepknow.goodface.coaching.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultCoachingSessionTest {
    private static final byte[] FRAME = {1, 2, 3, 4};

    private FakeLinkConnector connector;
    private CoachingSessionConfig config;
    private DefaultCoachingSession session;

    @BeforeEach
    void setUp() {
        connector = new FakeLinkConnector();
        config = CoachingSessionConfig.builder()
                .apiKey("test-key")
                .keepAliveIntervalMs(20)
                .reconnectBaseDelayMs(10)
                .closeGraceMs(10)
                .build();
        session = new DefaultCoachingSession("s1", config, connector, new ObjectMapper(), new MutableClock(1_000_000));
        session.registerParticipant("c1", ParticipantRole.CLIENT, "Client");
        session.registerParticipant("c2", ParticipantRole.COACH, "Coach");
    }

    @AfterEach
    void tearDown() {
        session.cleanup();
    }

    private FakeLinkConnector.Attempt agent() {
        return connector.attempts.stream().filter(a -> a.uri.toString().startsWith(config.getAgentUrl()))
                .reduce((first, second) -> second).orElseThrow();
    }

    private FakeLinkConnector.Attempt listen() {
        return connector.attempts.stream().filter(a -> a.uri.toString().startsWith(config.getListenUrl()))
                .reduce((first, second) -> second).orElseThrow();
    }

    private void startConnected() {
        session.start();
        agent().open();
        agent().receive("{\"type\":\"SettingsApplied\"}");
        listen().open();
    }

    @Test
    void startConnectsBothLinksOnce() {
        session.start();
        session.start();
        assertThat(connector.attempts).hasSize(2);

        agent().open();
        assertThat(session.health()).isEqualTo(SessionHealth.DEGRADED);
        assertThat(agent().socket.texts.get(0)).contains("log_session_insight", "get_vagus_exercises");

        agent().receive("{\"type\":\"SettingsApplied\"}");
        listen().open();
        assertThat(session.health()).isEqualTo(SessionHealth.CONNECTED);
    }

    @Test
    void clientAudioFollowsPauseState() {
        startConnected();

        session.routeAudio(FRAME, "c1", "Client");
        assertThat(agent().socket.binaries).hasSize(1);
        assertThat(listen().socket.binaries).isEmpty();

        session.pauseAI();
        session.routeAudio(FRAME, "c1", "Client");
        assertThat(agent().socket.binaries).hasSize(1);
        assertThat(listen().socket.binaries).hasSize(1);
    }

    @Test
    void agentAudioIsSuppressedWhilePaused() {
        startConnected();
        List<SessionEvent> received = new CopyOnWriteArrayList<>();
        session.subscribe(received::add);

        session.pauseAI();
        agent().receiveBinary(new byte[]{5, 5});
        assertThat(received).noneMatch(e -> e instanceof AgentAudioEvent);
        assertThat(session.getSuppressedAgentAudio()).isEqualTo(1);

        session.resumeAI();
        agent().receiveBinary(new byte[]{5, 5});
        assertThat(received).anyMatch(e -> e instanceof AgentAudioEvent);
    }

    @Test
    void functionCallIsAnswered() {
        startConnected();
        agent().receive("{\"type\":\"FunctionCallRequest\",\"function_name\":\"log_session_insight\",\"function_call_id\":\"f1\","
                + "\"input\":{\"insight\":\"Wants to sleep earlier\",\"category\":\"goal\"}}");

        Await.until(() -> session.functionBridge().callLog().size() == 1, 2000);
        assertThat(agent().socket.sentType("FunctionCallResponse")).isTrue();
        assertThat(session.sessionInsights()).containsExactly("[goal] Wants to sleep earlier");
    }

    @Test
    void guidanceIsConfirmedByPromptUpdated() throws Exception {
        startConnected();
        CompletableFuture<Void> future = session.sendGuidance("Ask about sleep", "c2");
        assertThat(agent().socket.sentType("UpdatePrompt")).isTrue();

        agent().receive("{\"type\":\"PromptUpdated\"}");

        future.get(1, TimeUnit.SECONDS);
        assertThat(session.guidanceChannel().history()).hasSize(1);
    }

    @Test
    void exhaustedTranscriptionLinkDegradesSession() {
        startConnected();
        List<ErrorEvent> errors = new CopyOnWriteArrayList<>();
        session.subscribe(e -> {
            if (e instanceof ErrorEvent) errors.add((ErrorEvent) e);
        });

        connector.failConnects = true;
        listen().drop(1011, "server error");

        Await.until(() -> errors.stream().anyMatch(ErrorEvent::isTerminal), 3000);
        assertThat(session.transcriptionLink().getState()).isEqualTo(LinkState.FAILED);
        assertThat(session.conversationalLink().getState()).isEqualTo(LinkState.READY);
        assertThat(session.health()).isEqualTo(SessionHealth.DEGRADED);
    }

    @Test
    void cleanupIsIdempotentAndLeavesNoKeepAlive() {
        startConnected();
        session.setMutedFromAi("c2", true);
        assertThat(session.getGateStatus().isKeepAliveActive()).isTrue();
        FakeLinkConnector.FakeSocket agentSocket = agent().socket;
        FakeLinkConnector.FakeSocket listenSocket = listen().socket;
        session.routeAudio(FRAME, "c2", "Coach");
        session.routeAudio(FRAME, "c2", "Coach");
        assertThat(session.getStats().getTotalReceived()).isEqualTo(2);
        assertThat(session.getStats().getBlockedByGate()).isEqualTo(2);
        assertThat(session.getGateStatus().isKeepAliveActive()).isTrue();

        session.cleanup();
        session.cleanup();

        assertThat(session.isClosed()).isTrue();
        assertThat(session.getGateStatus().isKeepAliveActive()).isFalse();
        assertThat(session.getGateStatus().getMutedParticipants()).isEmpty();
        assertThat(agentSocket.closeCode).isEqualTo(1000);
        assertThat(listenSocket.sentType("CloseStream")).isTrue();
        Await.until(() -> listenSocket.closeCode == 1000, 2000);
        assertThat(session.health()).isEqualTo(SessionHealth.DISCONNECTED);

        assertThat(session.getStats().getTotalReceived()).isZero();
        assertThat(session.getStats().getByParticipant()).isEmpty();

        session.routeAudio(FRAME, "c1", "Client");
        assertThat(session.getStats().getTotalReceived()).isZero();
    }
}
