package com.deepknow.goodface.coaching.routing;

import com.deepknow.goodface.coaching.domain.audio.AudioEncoding;
import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.audio.RouterStats;
import com.deepknow.goodface.coaching.domain.event.GateEvent;
import com.deepknow.goodface.coaching.domain.event.PauseEvent;
import com.deepknow.goodface.coaching.support.MutableClock;
import com.deepknow.goodface.coaching.support.RecordingConversationalLink;
import com.deepknow.goodface.coaching.support.RecordingPublisher;
import com.deepknow.goodface.coaching.support.RecordingTranscriptionLink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class AudioRouterTest {
    private static final byte[] FRAME = {1, 2, 3, 4};

    private ScheduledExecutorService scheduler;
    private RecordingConversationalLink conversational;
    private RecordingTranscriptionLink transcription;
    private RecordingPublisher publisher;
    private MutableClock clock;
    private AudioGate gate;
    private AudioRouter router;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        conversational = new RecordingConversationalLink();
        transcription = new RecordingTranscriptionLink();
        publisher = new RecordingPublisher();
        clock = new MutableClock(1_000_000);
        gate = new AudioGate("s1", conversational, scheduler, publisher, clock, 60_000);
        router = new AudioRouter("s1", new ParticipantRegistry("s1"), gate, transcription, publisher,
                AudioEncoding.LINEAR16, clock);
        router.registerParticipant("c1", ParticipantRole.CLIENT, "Client");
        router.registerParticipant("c2", ParticipantRole.COACH, "Coach");
    }

    @AfterEach
    void tearDown() {
        router.cleanup();
        scheduler.shutdownNow();
    }

    @Test
    void clientGoesToConversationalOnlyAndMutedCoachToTranscriptionOnly() {
        router.muteParticipant("c2");

        router.routeAudio(FRAME, "c1", "Client");
        assertThat(conversational.audio).hasSize(1);
        assertThat(transcription.audio).isEmpty();

        long blockedBefore = router.getStats().getBlockedByGate();
        router.routeAudio(FRAME, "c2", "Coach");
        assertThat(transcription.audio).hasSize(1);
        assertThat(conversational.audio).hasSize(1);
        assertThat(router.getStats().getBlockedByGate()).isEqualTo(blockedBefore + 1);
    }

    @Test
    void unmutedCoachReachesBothLinks() {
        router.muteParticipant("c2");
        router.unmuteParticipant("c2");

        router.routeAudio(FRAME, "c2", "Coach");

        assertThat(conversational.audio).hasSize(1);
        assertThat(transcription.audio).hasSize(1);
        assertThat(router.isParticipantMuted("c2")).isFalse();
    }

    @Test
    void pauseMovesClientToTranscriptionAndResumeRestores() {
        router.muteParticipant("c2");

        assertThat(router.pauseAI()).isTrue();
        assertThat(router.pauseAI()).isFalse();
        router.routeAudio(FRAME, "c1", null);
        assertThat(conversational.audio).isEmpty();
        assertThat(transcription.audio).hasSize(1);

        assertThat(router.resumeAI()).isTrue();
        router.routeAudio(FRAME, "c1", null);
        assertThat(conversational.audio).hasSize(1);
        assertThat(transcription.audio).hasSize(1);

        assertThat(router.isParticipantMuted("c2")).isTrue();
        assertThat(publisher.ofType(PauseEvent.class)).hasSize(2);
    }

    @Test
    void coachGatingUnaffectedByPause() {
        router.pauseAI();
        router.routeAudio(FRAME, "c2", null);

        assertThat(conversational.audio).hasSize(1);
        assertThat(transcription.audio).hasSize(1);
    }

    @Test
    void aiAudioIsNeverForwarded() {
        router.registerParticipant("bot", ParticipantRole.AI, "Agent");
        router.routeAudio(FRAME, "bot", null);

        assertThat(conversational.audio).isEmpty();
        assertThat(transcription.audio).isEmpty();
        assertThat(router.getStats().getTotalReceived()).isEqualTo(1);
    }

    @Test
    void unknownParticipantIsTreatedAsClient() {
        router.routeAudio(FRAME, "stranger", null);
        assertThat(conversational.audio).hasSize(1);
        assertThat(transcription.audio).isEmpty();
    }

    @Test
    void emptyFrameIsDroppedAndCounted() {
        router.routeAudio(new byte[0], "c1", null);
        router.routeAudio(null, "c2", null);

        RouterStats stats = router.getStats();
        assertThat(stats.getInvalidDropped()).isEqualTo(2);
        assertThat(conversational.audio).isEmpty();
        assertThat(transcription.audio).isEmpty();
    }

    @Test
    void unavailableLinkDropsAndCounts() {
        conversational.ready = false;
        router.routeAudio(FRAME, "c1", null);

        assertThat(router.getStats().getLinkUnavailableDropped()).isEqualTo(1);
        assertThat(router.getStats().getSentToConversational()).isZero();
    }

    @Test
    void muteUnknownParticipantIsTypedError() {
        assertThat(router.handleMuteCommand("ghost", true)).isEqualTo(MuteOutcome.UNKNOWN_PARTICIPANT);
        assertThat(router.handleMuteCommand("c2", true)).isEqualTo(MuteOutcome.MUTED);
        assertThat(router.handleMuteCommand("c2", true)).isEqualTo(MuteOutcome.ALREADY_MUTED);
        assertThat(router.handleMuteCommand("c2", false)).isEqualTo(MuteOutcome.UNMUTED);
        assertThat(router.handleMuteCommand("c2", false)).isEqualTo(MuteOutcome.NOT_MUTED);
    }

    @Test
    void unregisterClearsMute() {
        router.muteParticipant("c2");
        router.unregisterParticipant("c2");
        assertThat(router.isParticipantMuted("c2")).isFalse();
    }

    @Test
    void statsAreTrackedPerParticipant() {
        router.muteParticipant("c2");
        router.routeAudio(FRAME, "c1", null);
        router.routeAudio(FRAME, "c2", null);

        RouterStats stats = router.getStats();
        assertThat(stats.participant("c1").getToConversational()).isEqualTo(1);
        assertThat(stats.participant("c2").getBlocked()).isEqualTo(1);
        assertThat(stats.participant("c2").getToTranscription()).isEqualTo(1);
        assertThat(stats.participant("c2").isMuted()).isTrue();
        assertThat(stats.participant("c2").getRole()).isEqualTo(ParticipantRole.COACH);
    }

    @Test
    void mutedClientStillReachesConversational() {
        assertThat(router.muteParticipant("c1")).isEqualTo(MuteOutcome.MUTED);

        router.routeAudio(FRAME, "c1", "Client");

        RouterStats stats = router.getStats();
        assertThat(conversational.audio).hasSize(1);
        assertThat(transcription.audio).isEmpty();
        assertThat(stats.getSentToConversational()).isEqualTo(1);
        assertThat(stats.getBlockedByGate()).isZero();
        assertThat(stats.participant("c1").getBlocked()).isZero();
    }

    @Test
    void clientFrameStopsKeepAliveWhileCoachMuted() {
        router.muteParticipant("c2");
        gate.forceKeepAlive();
        assertThat(gate.isKeepAliveActive()).isTrue();

        clock.advance(100);
        router.routeAudio(FRAME, "c1", null);

        assertThat(gate.isKeepAliveActive()).isFalse();
        assertThat(gate.status().getMillisSinceLastAudio()).isZero();
        assertThat(publisher.ofType(GateEvent.class)).extracting(GateEvent::getAction)
                .contains(GateEvent.Action.KEEPALIVE_STOPPED);
    }

    @Test
    void cleanupResetsStats() {
        router.muteParticipant("c2");
        router.routeAudio(FRAME, "c1", null);
        router.routeAudio(FRAME, "c2", null);
        router.routeAudio(new byte[0], "c1", null);

        router.cleanup();

        RouterStats stats = router.getStats();
        assertThat(stats.getTotalReceived()).isZero();
        assertThat(stats.getSentToConversational()).isZero();
        assertThat(stats.getSentToTranscription()).isZero();
        assertThat(stats.getBlockedByGate()).isZero();
        assertThat(stats.getInvalidDropped()).isZero();
        assertThat(stats.getByParticipant()).isEmpty();
    }

    @Test
    void unregisterDropsParticipantStats() {
        router.routeAudio(FRAME, "c1", null);
        router.unregisterParticipant("c1");

        RouterStats stats = router.getStats();
        assertThat(stats.getByParticipant()).doesNotContainKey("c1");
        assertThat(stats.getTotalReceived()).isEqualTo(1);
    }

    @Test
    void unregisteredSendersAreTrackedUpToLimit() {
        for (int i = 0; i < AudioRouter.MAX_TRACKED_PARTICIPANTS + 10; i++) {
            router.routeAudio(FRAME, "anon-" + i, null);
        }

        RouterStats stats = router.getStats();
        assertThat(stats.getByParticipant()).hasSize(AudioRouter.MAX_TRACKED_PARTICIPANTS);
        assertThat(stats.getTotalReceived()).isEqualTo(AudioRouter.MAX_TRACKED_PARTICIPANTS + 10);
        assertThat(conversational.audio).hasSize(AudioRouter.MAX_TRACKED_PARTICIPANTS + 10);
    }
}
