package com.deepknow.goodface.coaching.websocket;

import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.feature.GuidanceTimeoutException;
import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * 解析流端点上的文本控制帧并作用到会话，回复通过 reply 回调异步送出。
 * 支持：mute-from-ai、pause_ai、resume_ai、guidance、stats。
 */
public class StreamCommandHandler {
    private static final Logger log = LoggerFactory.getLogger(StreamCommandHandler.class);

    private final ObjectMapper objectMapper;

    public StreamCommandHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void handle(CoachingSession session, String senderId, String text, Consumer<Map<String, Object>> reply) {
        JsonNode cmd;
        try {
            cmd = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Malformed stream command: sessionId={}, senderId={}", session.getSessionId(), senderId);
            reply.accept(error("INVALID_COMMAND", "Invalid message format"));
            return;
        }
        String type = cmd.path("type").asText("");
        switch (type) {
            case "mute-from-ai":
                handleMute(session, cmd, reply);
                break;
            case "pause_ai":
                handlePause(session, cmd.path("paused").asBoolean(true), reply);
                break;
            case "resume_ai":
                handlePause(session, false, reply);
                break;
            case "guidance":
                handleGuidance(session, senderId, cmd.path("text").asText(""), reply);
                break;
            case "stats":
                reply.accept(stats(session));
                break;
            default:
                log.debug("Unknown stream command: sessionId={}, type={}", session.getSessionId(), type);
                reply.accept(error("INVALID_COMMAND", "Unknown command type: " + type));
        }
    }

    private void handleMute(CoachingSession session, JsonNode cmd, Consumer<Map<String, Object>> reply) {
        String participantId = cmd.path("participantId").asText("");
        if (participantId.isEmpty() || !cmd.has("muted")) {
            reply.accept(error("INVALID_COMMAND", "participantId and muted are required"));
            return;
        }
        boolean muted = cmd.path("muted").asBoolean();
        MuteOutcome outcome = session.setMutedFromAi(participantId, muted);
        if (outcome == MuteOutcome.UNKNOWN_PARTICIPANT) {
            reply.accept(error("UNKNOWN_PARTICIPANT", "Unknown participant: " + participantId));
            return;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "mute-from-ai");
        out.put("participantId", participantId);
        out.put("muted", muted);
        out.put("changed", outcome.isChanged());
        reply.accept(out);
    }

    private void handlePause(CoachingSession session, boolean paused, Consumer<Map<String, Object>> reply) {
        boolean changed = paused ? session.pauseAI() : session.resumeAI();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "pause_ai");
        out.put("paused", session.isAIPaused());
        out.put("changed", changed);
        reply.accept(out);
    }

    private void handleGuidance(CoachingSession session, String senderId, String text, Consumer<Map<String, Object>> reply) {
        if (text.trim().isEmpty()) {
            reply.accept(error("INVALID_COMMAND", "text is required"));
            return;
        }
        session.sendGuidance(text, senderId).whenComplete((v, err) -> {
            if (err == null) {
                reply.accept(Map.of("type", "guidance", "status", "confirmed"));
                return;
            }
            Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
            String code = cause instanceof GuidanceTimeoutException ? "GUIDANCE_TIMEOUT" : "GUIDANCE_REJECTED";
            reply.accept(error(code, String.valueOf(cause.getMessage())));
        });
    }

    Map<String, Object> stats(CoachingSession session) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "stats");
        out.put("sessionId", session.getSessionId());
        out.put("health", session.health().name());
        out.put("aiPaused", session.isAIPaused());
        out.put("router", session.getStats());
        out.put("gate", session.getGateStatus());
        out.put("links", session.linkStatuses());
        return out;
    }

    static Map<String, Object> error(String code, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "error");
        out.put("code", code);
        out.put("message", message);
        return out;
    }
}
