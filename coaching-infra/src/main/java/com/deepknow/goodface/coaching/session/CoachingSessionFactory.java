package com.deepknow.goodface.coaching.session;

import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.link.LinkConnector;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.Map;

/**
 * 按默认配置与会话级覆盖创建会话。
 */
public class CoachingSessionFactory {
    private final CoachingSessionConfig defaults;
    private final LinkConnector connector;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CoachingSessionFactory(CoachingSessionConfig defaults, LinkConnector connector,
                                  ObjectMapper objectMapper, Clock clock) {
        this.defaults = defaults;
        this.connector = connector;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public CoachingSession create(String sessionId, Map<String, Object> overrides) {
        return new DefaultCoachingSession(sessionId, defaults.withOverrides(overrides), connector, objectMapper, clock);
    }

    public CoachingSessionConfig getDefaults() { return defaults; }
}
