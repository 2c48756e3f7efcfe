package com.deepknow.goodface.coaching.websocket;

import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.event.AgentAudioEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventType;
import com.deepknow.goodface.coaching.domain.event.Subscription;
import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * 参会方音频流入口：/coaching/stream?sessionId=&participantId=&role=&name=
 * 二进制帧为该参与者的音频；文本帧为 JSON 控制命令。
 * 会话事件以 JSON 推送，AI 合成音频以二进制推送。
 */
@Component
@ServerEndpoint(value = "/coaching/stream")
public class CoachingStreamEndpoint {
    private static final Logger log = LoggerFactory.getLogger(CoachingStreamEndpoint.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final StreamCommandHandler commandHandler = new StreamCommandHandler(objectMapper);

    // 由 CoachingSessionServiceInjector 在容器启动时注入
    private static volatile CoachingSessionService coachingSessionService;
    public static void setCoachingSessionService(CoachingSessionService service) { coachingSessionService = service; }

    // 每个连接一个端点实例
    private String sessionId;
    private String participantId;
    private Subscription subscription;

    @OnOpen
    public void onOpen(Session ws) {
        String wsId = ws.getId();
        CoachingSessionService service = coachingSessionService;
        if (service == null) {
            log.warn("CoachingSessionService not injected; refuse open for ws {}", wsId);
            closeQuietly(ws, CloseReason.CloseCodes.UNEXPECTED_CONDITION, "SERVICE_NOT_READY");
            return;
        }
        String sid = parseQueryParam(ws, "sessionId");
        String pid = parseQueryParam(ws, "participantId");
        if (sid == null || sid.isEmpty() || pid == null || pid.isEmpty()) {
            log.warn("WS open rejected, missing sessionId or participantId: ws={}", wsId);
            closeQuietly(ws, CloseReason.CloseCodes.CANNOT_ACCEPT, "MISSING_PARAMS");
            return;
        }
        Optional<CoachingSession> found = service.find(sid);
        if (found.isEmpty()) {
            log.warn("WS open rejected, session not found: ws={}, sessionId={}", wsId, sid);
            closeQuietly(ws, CloseReason.CloseCodes.CANNOT_ACCEPT, "SESSION_NOT_FOUND");
            return;
        }
        CoachingSession session = found.get();
        this.sessionId = sid;
        this.participantId = pid;
        ParticipantRole role = ParticipantRole.parse(parseQueryParam(ws, "role"));
        String name = parseQueryParam(ws, "name");
        session.registerParticipant(pid, role, name == null ? pid : name);
        this.subscription = session.subscribe(event -> push(ws, event));
        log.info("WS connected: ws={}, sessionId={}, participantId={}, role={}", wsId, sid, pid, role);
        sendJson(ws, Map.of("type", "connection_established", "sessionId", sid, "participantId", pid,
                "timestamp", System.currentTimeMillis()));
    }

    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session ws) {
        CoachingSessionService service = coachingSessionService;
        if (sessionId == null || service == null) {
            log.debug("Drop audio chunk on unbound ws {}", ws.getId());
            return;
        }
        byte[] bytes = new byte[message.remaining()];
        message.get(bytes);
        service.onAudio(sessionId, participantId, bytes);
    }

    @OnMessage
    public void onTextMessage(String text, Session ws) {
        CoachingSessionService service = coachingSessionService;
        if (sessionId == null || service == null) {
            return;
        }
        log.trace("Received command: sessionId={}, participantId={}, text={}", sessionId, participantId, text);
        Optional<CoachingSession> session = service.find(sessionId);
        if (session.isEmpty()) {
            sendJson(ws, StreamCommandHandler.error("SESSION_NOT_FOUND", "Session ended: " + sessionId));
            return;
        }
        commandHandler.handle(session.get(), participantId, text, reply -> sendJson(ws, reply));
    }

    @OnClose
    public void onClose(Session ws, CloseReason reason) {
        log.info("WS closed: ws={}, sessionId={}, participantId={}, status={}", ws.getId(), sessionId, participantId, reason);
        release();
    }

    @OnError
    public void onError(Session ws, Throwable throwable) {
        String msg = throwable != null ? throwable.getMessage() : "unknown";
        log.warn("WS error: ws={}, sessionId={}, err={}", ws == null ? null : ws.getId(), sessionId, msg, throwable);
        release();
    }

    private synchronized void release() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        CoachingSessionService service = coachingSessionService;
        if (sessionId != null && service != null) {
            service.find(sessionId).ifPresent(s -> s.unregisterParticipant(participantId));
        }
        sessionId = null;
    }

    private void push(Session ws, SessionEvent event) {
        if (event.getType() == SessionEventType.AGENT_AUDIO) {
            sendBinary(ws, ((AgentAudioEvent) event).getAudio());
            return;
        }
        ObjectNode node = objectMapper.valueToTree(event);
        node.put("type", "event");
        node.put("event", event.getType().name());
        sendJson(ws, node);
    }

    private void sendJson(Session ws, Object obj) {
        if (ws == null || !ws.isOpen()) return;
        try {
            String json = objectMapper.writeValueAsString(obj);
            // BasicRemote 不允许并发发送，事件线程与命令回复可能交错
            synchronized (ws) {
                ws.getBasicRemote().sendText(json);
            }
        } catch (IOException e) {
            log.warn("WS send failed: sessionId={}, participantId={}, err={}", sessionId, participantId, e.getMessage());
        }
    }

    private void sendBinary(Session ws, byte[] audio) {
        if (ws == null || !ws.isOpen() || audio == null) return;
        try {
            synchronized (ws) {
                ws.getBasicRemote().sendBinary(ByteBuffer.wrap(audio));
            }
        } catch (IOException e) {
            log.warn("WS audio send failed: sessionId={}, participantId={}, err={}", sessionId, participantId, e.getMessage());
        }
    }

    private void closeQuietly(Session ws, CloseReason.CloseCode code, String reason) {
        try {
            ws.close(new CloseReason(code, reason));
        } catch (IOException e) {
            log.debug("WS close failed: ws={}, err={}", ws.getId(), e.getMessage());
        }
    }

    private String parseQueryParam(Session ws, String key) {
        URI uri = ws.getRequestURI();
        String query = uri == null ? null : uri.getRawQuery();
        if (query == null || query.isEmpty()) return null;
        for (String p : query.split("&")) {
            int i = p.indexOf('=');
            if (i > 0 && key.equals(p.substring(0, i))) {
                return URLDecoder.decode(p.substring(i + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
