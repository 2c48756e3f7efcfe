package com.deepknow.goodface.coaching.feature;

import com.deepknow.goodface.coaching.domain.event.FunctionCallEvent;
import com.deepknow.goodface.coaching.domain.event.FunctionCallRequestEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventListener;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.feature.FunctionCallRecord;
import com.deepknow.goodface.coaching.domain.feature.FunctionDefinition;
import com.deepknow.goodface.coaching.domain.feature.FunctionHandler;
import com.deepknow.goodface.coaching.domain.feature.FunctionResult;
import com.deepknow.goodface.coaching.domain.link.ConversationalLink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 把代理发起的函数调用映射到本地处理器。
 * 每个请求恰好回复一次：未知函数、处理器异常与失败结果都回复 {"error": "..."}。
 */
public class FunctionBridge implements SessionEventListener {
    private static final Logger log = LoggerFactory.getLogger(FunctionBridge.class);

    private final String sessionId;
    private final ConversationalLink link;
    private final Executor executor;
    private final SessionEventPublisher publisher;
    private final ObjectMapper objectMapper;

    private final Map<String, Registered> functions = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<FunctionCallRecord> callLog = Collections.synchronizedList(new ArrayList<>());

    public FunctionBridge(String sessionId, ConversationalLink link, Executor executor,
                          SessionEventPublisher publisher, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.link = link;
        this.executor = executor;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
    }

    public void register(FunctionDefinition definition, FunctionHandler handler) {
        functions.put(definition.getName(), new Registered(definition, handler));
        log.info("Function registered: sessionId={}, name={}", sessionId, definition.getName());
    }

    public List<FunctionDefinition> definitions() {
        synchronized (functions) {
            List<FunctionDefinition> out = new ArrayList<>();
            functions.values().forEach(r -> out.add(r.definition));
            return out;
        }
    }

    @Override
    public void onEvent(SessionEvent event) {
        if (event instanceof FunctionCallRequestEvent) {
            FunctionCallRequestEvent req = (FunctionCallRequestEvent) event;
            try {
                executor.execute(() -> handle(req.getFunctionName(), req.getFunctionCallId(), req.getInput()));
            } catch (RejectedExecutionException e) {
                log.warn("Function executor unavailable, answering inline: sessionId={}, function={}", sessionId, req.getFunctionName());
                respond(req.getFunctionName(), req.getFunctionCallId(), false, errorJson("Session is closing"), 0);
            }
        }
    }

    void handle(String name, String callId, JsonNode input) {
        long start = System.currentTimeMillis();
        Registered registered = functions.get(name);
        if (registered == null) {
            log.warn("Unknown function requested: sessionId={}, function={}", sessionId, name);
            respond(name, callId, false, errorJson("Unknown function: " + name), start);
            return;
        }
        FunctionResult result;
        try {
            result = registered.handler.handle(input == null ? objectMapper.createObjectNode() : input);
        } catch (Exception e) {
            log.warn("Function handler failed: sessionId={}, function={}", sessionId, name, e);
            respond(name, callId, false, errorJson(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), start);
            return;
        }
        if (result == null) {
            respond(name, callId, false, errorJson("Function returned no result"), start);
        } else if (result.isSuccess()) {
            respond(name, callId, true, result.getOutput() == null ? "" : result.getOutput(), start);
        } else {
            respond(name, callId, false, errorJson(result.getError() == null ? "Function failed" : result.getError()), start);
        }
    }

    private void respond(String name, String callId, boolean success, String output, long start) {
        boolean sent = link.functionCallResponse(callId, output);
        if (!sent) {
            log.warn("Function response not delivered, link not ready: sessionId={}, function={}, callId={}", sessionId, name, callId);
        }
        long duration = start == 0 ? 0 : System.currentTimeMillis() - start;
        callLog.add(new FunctionCallRecord(name, callId, success, output, System.currentTimeMillis()));
        log.info("Function call answered: sessionId={}, function={}, callId={}, success={}, durationMs={}",
                sessionId, name, callId, success, duration);
        publisher.publish(new FunctionCallEvent(name, callId, success, output, duration));
    }

    private String errorJson(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", message));
        } catch (JsonProcessingException e) {
            log.warn("Serialize function error failed: sessionId={}", sessionId, e);
            return "{\"error\":\"internal error\"}";
        }
    }

    public List<FunctionCallRecord> callLog() {
        synchronized (callLog) {
            return List.copyOf(callLog);
        }
    }

    public void cleanup() {
        functions.clear();
        callLog.clear();
    }

    private static final class Registered {
        final FunctionDefinition definition;
        final FunctionHandler handler;

        Registered(FunctionDefinition definition, FunctionHandler handler) {
            this.definition = definition;
            this.handler = handler;
        }
    }
}
