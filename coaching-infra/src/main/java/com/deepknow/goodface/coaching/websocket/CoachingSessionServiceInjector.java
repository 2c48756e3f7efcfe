package com.deepknow.goodface.coaching.websocket;

import com.deepknow.goodface.coaching.domain.session.CoachingSessionService;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

/**
 * 端点实例由 WebSocket 容器创建，不经过 Spring，这里把服务注入到静态字段。
 */
@Component
public class CoachingSessionServiceInjector {

    private final CoachingSessionService coachingSessionService;

    public CoachingSessionServiceInjector(CoachingSessionService coachingSessionService) {
        this.coachingSessionService = coachingSessionService;
    }

    @PostConstruct
    public void inject() {
        CoachingStreamEndpoint.setCoachingSessionService(coachingSessionService);
    }
}
