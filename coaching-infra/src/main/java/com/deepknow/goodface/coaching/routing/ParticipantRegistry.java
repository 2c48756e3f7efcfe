package com.deepknow.goodface.coaching.routing;

import com.deepknow.goodface.coaching.domain.audio.Participant;
import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单会话的参与者登记表，不在会话之间共享。
 */
public class ParticipantRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParticipantRegistry.class);

    private final String sessionId;
    private final ConcurrentHashMap<String, Participant> participants = new ConcurrentHashMap<>();

    public ParticipantRegistry(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * 登记参与者。已登记的 id 保留原角色。
     */
    public Participant register(String id, ParticipantRole role, String displayName) {
        Participant candidate = new Participant(id, displayName, role);
        Participant existing = participants.putIfAbsent(id, candidate);
        if (existing != null) {
            if (existing.getRole() != candidate.getRole()) {
                log.warn("Participant already registered with another role: sessionId={}, participantId={}, role={}, requested={}",
                        sessionId, id, existing.getRole(), candidate.getRole());
            }
            return existing;
        }
        log.info("Participant registered: sessionId={}, participantId={}, role={}, name={}", sessionId, id, candidate.getRole(), displayName);
        return candidate;
    }

    public boolean unregister(String id) {
        if (id == null) return false;
        Participant removed = participants.remove(id);
        if (removed != null) {
            log.info("Participant unregistered: sessionId={}, participantId={}", sessionId, id);
        }
        return removed != null;
    }

    public ParticipantRole roleOf(String id) {
        Participant p = id == null ? null : participants.get(id);
        return p == null ? ParticipantRole.UNKNOWN : p.getRole();
    }

    public Optional<Participant> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(participants.get(id));
    }

    public List<Participant> participants() {
        return List.copyOf(participants.values());
    }

    public void clear() {
        participants.clear();
    }
}
