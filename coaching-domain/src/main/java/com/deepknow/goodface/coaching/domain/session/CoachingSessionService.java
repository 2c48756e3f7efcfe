package com.deepknow.goodface.coaching.domain.session;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface CoachingSessionService {
    /**
     * @return 新建的会话；同 id 会话已存在时为 empty
     */
    Optional<CoachingSession> start(String sessionId, Map<String, Object> overrides);

    Optional<CoachingSession> find(String sessionId);

    void onAudio(String sessionId, String participantId, byte[] audio);

    boolean end(String sessionId);

    Collection<String> activeSessionIds();
}
