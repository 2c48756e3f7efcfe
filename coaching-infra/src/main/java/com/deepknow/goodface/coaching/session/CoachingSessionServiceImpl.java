package com.deepknow.goodface.coaching.session;

import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class CoachingSessionServiceImpl implements CoachingSessionService {
    private static final Logger logger = LoggerFactory.getLogger(CoachingSessionServiceImpl.class);

    private final CoachingSessionFactory sessionFactory;
    private final ConcurrentHashMap<String, CoachingSession> activeSessions = new ConcurrentHashMap<>();

    public CoachingSessionServiceImpl(CoachingSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Optional<CoachingSession> start(String sessionId, Map<String, Object> overrides) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (activeSessions.containsKey(sessionId)) {
            logger.warn("Session already active: sessionId={}", sessionId);
            return Optional.empty();
        }
        CoachingSession session = sessionFactory.create(sessionId, overrides);
        CoachingSession previous = activeSessions.putIfAbsent(sessionId, session);
        if (previous != null) {
            logger.warn("Session already active: sessionId={}", sessionId);
            session.cleanup();
            return Optional.empty();
        }
        logger.info("Open session: sessionId={}, overrides={}", sessionId, overrides == null ? 0 : overrides.size());
        session.start();
        return Optional.of(session);
    }

    @Override
    public Optional<CoachingSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(activeSessions.get(sessionId));
    }

    @Override
    public void onAudio(String sessionId, String participantId, byte[] audio) {
        CoachingSession session = sessionId == null ? null : activeSessions.get(sessionId);
        if (session != null) {
            logger.trace("Forward audio: sessionId={}, participantId={}, bytes={}", sessionId, participantId, audio == null ? 0 : audio.length);
            session.routeAudio(audio, participantId, null);
        } else {
            logger.debug("Audio arrived for unknown session: sessionId={}, participantId={}", sessionId, participantId);
        }
    }

    @Override
    public boolean end(String sessionId) {
        CoachingSession session = sessionId == null ? null : activeSessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        try {
            session.cleanup();
        } catch (RuntimeException e) {
            logger.warn("Session cleanup error: sessionId={}", sessionId, e);
        }
        logger.info("Closed session: sessionId={}", sessionId);
        return true;
    }

    @Override
    public Collection<String> activeSessionIds() {
        return List.copyOf(activeSessions.keySet());
    }

    @PreDestroy
    public void shutdown() {
        for (String sessionId : activeSessionIds()) {
            end(sessionId);
        }
    }
}
