package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.domain.event.AgentAudioEvent;
import com.deepknow.goodface.coaching.domain.event.ConversationTextEvent;
import com.deepknow.goodface.coaching.domain.event.ErrorEvent;
import com.deepknow.goodface.coaching.domain.event.FunctionCallRequestEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.event.SessionEventType;
import com.deepknow.goodface.coaching.domain.event.SignalEvent;
import com.deepknow.goodface.coaching.domain.feature.FunctionDefinition;
import com.deepknow.goodface.coaching.domain.link.ConversationEntry;
import com.deepknow.goodface.coaching.domain.link.ConversationalLink;
import com.deepknow.goodface.coaching.domain.link.LinkState;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * 对话链路：Deepgram Voice Agent。打开后先下发 Settings，收到 SettingsApplied 才算就绪。
 */
public class DeepgramAgentLink extends AbstractUpstreamLink implements ConversationalLink {
    private static final Logger log = LoggerFactory.getLogger(DeepgramAgentLink.class);
    public static final String NAME = "conversational";

    private final CoachingSessionConfig config;
    private final Supplier<List<FunctionDefinition>> functions;
    private final Clock clock;
    private final List<ConversationEntry> transcriptLog = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean agentSpeaking;
    private volatile String remoteSessionId;

    public DeepgramAgentLink(String sessionId, CoachingSessionConfig config, LinkConnector connector,
                             ScheduledExecutorService scheduler, SessionEventPublisher publisher,
                             ObjectMapper objectMapper, Supplier<List<FunctionDefinition>> functions, Clock clock) {
        super(NAME, sessionId, connector, scheduler, publisher, objectMapper,
                config.getMaxReconnectAttempts(), config.getReconnectBaseDelayMs());
        this.config = config;
        this.functions = functions == null ? Collections::emptyList : functions;
        this.clock = clock;
    }

    @Override
    protected URI endpoint() {
        return URI.create(config.getAgentUrl());
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Authorization", "Token " + config.getApiKey());
    }

    @Override
    protected void onSocketOpen(LinkSocket socket) {
        transition(LinkState.SETTINGS_PENDING);
        ObjectNode settings = AgentSettings.build(objectMapper, config, functions.get());
        sendRaw(socket, settings);
        log.info("Settings sent: sessionId={}, stt={}, llm={}, voice={}, keyterms={}",
                sessionId, config.getSttModel(), config.getLlmModel(), config.getVoiceModel(), config.getKeyterms().size());
    }

    @Override
    protected void handleMessage(String type, JsonNode msg) {
        switch (type) {
            case "Welcome":
                remoteSessionId = msg.path("request_id").asText(msg.path("session_id").asText(null));
                log.info("Agent welcome: sessionId={}, remoteSessionId={}", sessionId, remoteSessionId);
                break;
            case "SettingsApplied":
                markReady();
                publisher.publish(new SignalEvent(SessionEventType.SETTINGS_APPLIED, NAME));
                break;
            case "UserStartedSpeaking":
                if (agentSpeaking) {
                    log.info("Barge-in detected: sessionId={}", sessionId);
                    agentSpeaking = false;
                    publisher.publish(new SignalEvent(SessionEventType.BARGE_IN, NAME));
                    clear();
                }
                publisher.publish(new SignalEvent(SessionEventType.USER_STARTED_SPEAKING, NAME));
                break;
            case "UserStoppedSpeaking":
                publisher.publish(new SignalEvent(SessionEventType.USER_STOPPED_SPEAKING, NAME));
                break;
            case "AgentStartedSpeaking":
                agentSpeaking = true;
                publisher.publish(new SignalEvent(SessionEventType.AGENT_STARTED_SPEAKING, NAME));
                break;
            case "AgentAudioDone":
                agentSpeaking = false;
                publisher.publish(new SignalEvent(SessionEventType.AGENT_AUDIO_DONE, NAME));
                break;
            case "ConversationText": {
                String role = msg.path("role").asText("");
                String content = msg.path("content").asText("");
                transcriptLog.add(new ConversationEntry(role, content, clock.millis()));
                log.debug("Conversation text: sessionId={}, role={}, len={}", sessionId, role, content.length());
                publisher.publish(new ConversationTextEvent(NAME, role, content));
                break;
            }
            case "PromptUpdated":
                publisher.publish(new SignalEvent(SessionEventType.PROMPT_UPDATED, NAME));
                break;
            case "FunctionCallRequest":
                handleFunctionCallRequest(msg);
                break;
            case "Error": {
                String code = msg.path("code").asText("AGENT_ERROR");
                String message = msg.path("description").asText(msg.path("message").asText(""));
                log.warn("Agent error: sessionId={}, code={}, message={}", sessionId, code, message);
                publisher.publish(new ErrorEvent(NAME, code, message, false));
                break;
            }
            case "History":
                break;
            default:
                log.debug("Unhandled agent message: sessionId={}, type={}", sessionId, type);
        }
    }

    /**
     * 兼容两种格式：顶层 function_name/function_call_id/input，或 functions 数组（arguments 为 JSON 字符串）。
     */
    private void handleFunctionCallRequest(JsonNode msg) {
        if (msg.hasNonNull("function_name")) {
            publisher.publish(new FunctionCallRequestEvent(NAME,
                    msg.path("function_name").asText(),
                    msg.path("function_call_id").asText(),
                    msg.path("input")));
            return;
        }
        for (JsonNode fn : msg.path("functions")) {
            JsonNode input = fn.path("arguments");
            if (input.isTextual()) {
                try {
                    input = objectMapper.readTree(input.asText());
                } catch (JsonProcessingException e) {
                    log.warn("Malformed function arguments: sessionId={}, function={}", sessionId, fn.path("name").asText());
                    input = objectMapper.createObjectNode();
                }
            }
            publisher.publish(new FunctionCallRequestEvent(NAME, fn.path("name").asText(), fn.path("id").asText(), input));
        }
    }

    @Override
    protected void handleAudio(byte[] audio) {
        publisher.publish(new AgentAudioEvent(NAME, audio));
    }

    @Override
    public boolean updatePrompt(String prompt) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("type", "UpdatePrompt");
        msg.put("prompt", prompt);
        return sendJson(msg);
    }

    @Override
    public boolean injectUserMessage(String content) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("type", "InjectUserMessage");
        msg.put("content", content);
        return sendJson(msg);
    }

    @Override
    public boolean injectAgentMessage(String content) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("type", "InjectAgentMessage");
        msg.put("content", content);
        return sendJson(msg);
    }

    @Override
    public boolean functionCallResponse(String functionCallId, String output) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("type", "FunctionCallResponse");
        msg.put("function_call_id", functionCallId);
        msg.put("output", output);
        return sendJson(msg);
    }

    @Override
    public boolean clear() {
        return sendControl("Clear");
    }

    @Override
    public boolean closeStream() {
        return sendControl("CloseStream");
    }

    @Override
    public boolean isAgentSpeaking() {
        return agentSpeaking;
    }

    @Override
    public String remoteSessionId() {
        return remoteSessionId;
    }

    @Override
    public List<ConversationEntry> transcriptLog() {
        synchronized (transcriptLog) {
            return List.copyOf(transcriptLog);
        }
    }
}
