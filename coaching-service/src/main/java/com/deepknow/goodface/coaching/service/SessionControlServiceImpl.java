package com.deepknow.goodface.coaching.service;

import com.deepknow.goodface.coaching.api.SessionControlService;
import com.deepknow.goodface.coaching.api.model.ControlResult;
import com.deepknow.goodface.coaching.api.model.ParticipantStatsInfo;
import com.deepknow.goodface.coaching.api.model.RoutingStatsInfo;
import com.deepknow.goodface.coaching.api.request.EndSessionRequest;
import com.deepknow.goodface.coaching.api.request.GuidanceRequest;
import com.deepknow.goodface.coaching.api.request.MuteFromAiRequest;
import com.deepknow.goodface.coaching.api.request.PauseAiRequest;
import com.deepknow.goodface.coaching.api.request.StartSessionRequest;
import com.deepknow.goodface.coaching.domain.audio.GateStatus;
import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.audio.RouterStats;
import com.deepknow.goodface.coaching.domain.feature.GuidanceTimeoutException;
import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionService;
import org.apache.dubbo.config.annotation.DubboService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@DubboService
@Service
public class SessionControlServiceImpl implements SessionControlService {
    private static final Logger log = LoggerFactory.getLogger(SessionControlServiceImpl.class);
    // 在会话自身的确认超时之外多等一会，让 GuidanceTimeoutException 先到
    private static final long GUIDANCE_WAIT_MARGIN_MS = 1000;

    private final CoachingSessionService coachingSessionService;
    private final long guidanceTimeoutMs;

    public SessionControlServiceImpl(CoachingSessionService coachingSessionService, CoachingSessionConfig coachingSessionConfig) {
        this.coachingSessionService = coachingSessionService;
        this.guidanceTimeoutMs = coachingSessionConfig.getGuidanceTimeoutMs();
    }

    @Override
    public ControlResult startSession(StartSessionRequest request) {
        if (request == null || isBlank(request.getSessionId())) {
            return ControlResult.fail(ControlResult.INVALID_REQUEST, "sessionId is required");
        }
        Optional<CoachingSession> started = coachingSessionService.start(request.getSessionId(),
                request.getConfig() == null ? Collections.emptyMap() : request.getConfig());
        if (started.isEmpty()) {
            return ControlResult.fail(ControlResult.SESSION_EXISTS, "Session already active: " + request.getSessionId());
        }
        return ControlResult.ok(true);
    }

    @Override
    public ControlResult endSession(EndSessionRequest request) {
        if (request == null || isBlank(request.getSessionId())) {
            return ControlResult.fail(ControlResult.INVALID_REQUEST, "sessionId is required");
        }
        if (!coachingSessionService.end(request.getSessionId())) {
            return notFound(request.getSessionId());
        }
        return ControlResult.ok(true);
    }

    @Override
    public ControlResult muteFromAi(MuteFromAiRequest request) {
        if (request == null || isBlank(request.getSessionId()) || isBlank(request.getParticipantId())) {
            return ControlResult.fail(ControlResult.INVALID_REQUEST, "sessionId and participantId are required");
        }
        Optional<CoachingSession> session = coachingSessionService.find(request.getSessionId());
        if (session.isEmpty()) return notFound(request.getSessionId());
        MuteOutcome outcome = session.get().setMutedFromAi(request.getParticipantId(), request.isMuted());
        if (outcome == MuteOutcome.UNKNOWN_PARTICIPANT) {
            return ControlResult.fail(ControlResult.UNKNOWN_PARTICIPANT, "Unknown participant: " + request.getParticipantId());
        }
        return ControlResult.ok(outcome.isChanged());
    }

    @Override
    public ControlResult setAiPaused(PauseAiRequest request) {
        if (request == null || isBlank(request.getSessionId())) {
            return ControlResult.fail(ControlResult.INVALID_REQUEST, "sessionId is required");
        }
        Optional<CoachingSession> session = coachingSessionService.find(request.getSessionId());
        if (session.isEmpty()) return notFound(request.getSessionId());
        boolean changed = request.isPaused() ? session.get().pauseAI() : session.get().resumeAI();
        return ControlResult.ok(changed);
    }

    @Override
    public ControlResult sendGuidance(GuidanceRequest request) {
        if (request == null || isBlank(request.getSessionId()) || isBlank(request.getText())) {
            return ControlResult.fail(ControlResult.INVALID_REQUEST, "sessionId and text are required");
        }
        Optional<CoachingSession> session = coachingSessionService.find(request.getSessionId());
        if (session.isEmpty()) return notFound(request.getSessionId());
        try {
            session.get().sendGuidance(request.getText(), request.getCoachId())
                    .get(guidanceTimeoutMs + GUIDANCE_WAIT_MARGIN_MS, TimeUnit.MILLISECONDS);
            return ControlResult.ok(true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof GuidanceTimeoutException) {
                return ControlResult.fail(ControlResult.GUIDANCE_TIMEOUT, cause.getMessage());
            }
            return ControlResult.fail(ControlResult.GUIDANCE_REJECTED, cause.getMessage());
        } catch (TimeoutException e) {
            return ControlResult.fail(ControlResult.GUIDANCE_TIMEOUT, "Guidance not confirmed within " + guidanceTimeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for guidance: sessionId={}", request.getSessionId());
            return ControlResult.fail(ControlResult.INTERNAL_ERROR, "Interrupted");
        }
    }

    /**
     * @return 路由统计；会话不存在时为 null
     */
    @Override
    public RoutingStatsInfo getStats(String sessionId) {
        if (isBlank(sessionId)) return null;
        return coachingSessionService.find(sessionId).map(this::toInfo).orElse(null);
    }

    RoutingStatsInfo toInfo(CoachingSession session) {
        RouterStats stats = session.getStats();
        GateStatus gate = session.getGateStatus();
        RoutingStatsInfo info = new RoutingStatsInfo();
        info.setSessionId(session.getSessionId());
        info.setTotalReceived(stats.getTotalReceived());
        info.setSentToConversational(stats.getSentToConversational());
        info.setSentToTranscription(stats.getSentToTranscription());
        info.setBlockedByGate(stats.getBlockedByGate());
        info.setInvalidDropped(stats.getInvalidDropped());
        info.setLinkUnavailableDropped(stats.getLinkUnavailableDropped());
        info.setAiPaused(session.isAIPaused());
        info.setKeepAliveActive(gate.isKeepAliveActive());
        info.setMutedParticipants(gate.getMutedParticipants());
        info.setHealth(session.health().name());
        info.setParticipants(stats.getByParticipant().values().stream()
                .sorted(Comparator.comparing(RouterStats.ParticipantStats::getParticipantId))
                .map(p -> {
                    ParticipantStatsInfo pi = new ParticipantStatsInfo();
                    pi.setParticipantId(p.getParticipantId());
                    pi.setRole(p.getRole().name());
                    pi.setReceived(p.getReceived());
                    pi.setToConversational(p.getToConversational());
                    pi.setToTranscription(p.getToTranscription());
                    pi.setBlocked(p.getBlocked());
                    pi.setMuted(p.isMuted());
                    return pi;
                }).collect(Collectors.toList()));
        return info;
    }

    private static ControlResult notFound(String sessionId) {
        return ControlResult.fail(ControlResult.SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
