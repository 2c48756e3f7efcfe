package com.deepknow.goodface.coaching.session;

import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.support.FakeLinkConnector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoachingSessionServiceImplTest {
    private FakeLinkConnector connector;
    private CoachingSessionServiceImpl service;

    @BeforeEach
    void setUp() {
        connector = new FakeLinkConnector();
        CoachingSessionConfig defaults = CoachingSessionConfig.builder().apiKey("test-key").build();
        service = new CoachingSessionServiceImpl(new CoachingSessionFactory(defaults, connector, new ObjectMapper(), Clock.systemUTC()));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void startAppliesOverridesAndConnects() {
        Optional<CoachingSession> session = service.start("s1", Map.of("llmModel", "gpt-4o", "greeting", ""));

        assertThat(session).isPresent();
        assertThat(connector.attempts).hasSize(2);
        CoachingSessionConfig config = ((DefaultCoachingSession) session.get()).getConfig();
        assertThat(config.getLlmModel()).isEqualTo("gpt-4o");
        assertThat(config.hasGreeting()).isFalse();
        assertThat(config.getApiKey()).isEqualTo("test-key");
    }

    @Test
    void duplicateSessionIdIsRejected() {
        CoachingSession first = service.start("s1", null).orElseThrow();

        assertThat(service.start("s1", Map.of())).isEmpty();
        assertThat(connector.attempts).hasSize(2);
        assertThat(service.find("s1")).containsSame(first);
    }

    @Test
    void blankSessionIdIsInvalid() {
        assertThatThrownBy(() -> service.start(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void endCleansUpOnce() {
        CoachingSession session = service.start("s1", null).orElseThrow();

        assertThat(service.end("s1")).isTrue();
        assertThat(service.end("s1")).isFalse();
        assertThat(session.isClosed()).isTrue();
        assertThat(service.activeSessionIds()).isEmpty();
    }

    @Test
    void audioForUnknownSessionIsDropped() {
        service.onAudio("missing", "c1", new byte[]{1});
        service.onAudio(null, "c1", new byte[]{1});
        assertThat(service.activeSessionIds()).isEmpty();
    }

    @Test
    void audioIsForwardedToSession() {
        CoachingSession session = service.start("s1", null).orElseThrow();
        service.onAudio("s1", "c1", new byte[]{1});

        assertThat(session.getStats().getTotalReceived()).isEqualTo(1);
    }

    @Test
    void shutdownEndsAllSessions() {
        CoachingSession a = service.start("a", null).orElseThrow();
        CoachingSession b = service.start("b", null).orElseThrow();

        service.shutdown();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(service.activeSessionIds()).isEmpty();
    }
}
