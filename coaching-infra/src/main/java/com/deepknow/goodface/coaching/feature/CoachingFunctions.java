package com.deepknow.goodface.coaching.feature;

import com.deepknow.goodface.coaching.domain.feature.FunctionDefinition;
import com.deepknow.goodface.coaching.domain.feature.FunctionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 教练会话内置函数：记录会话洞察、按症状推荐迷走神经练习。
 */
public class CoachingFunctions {
    private static final Logger log = LoggerFactory.getLogger(CoachingFunctions.class);

    public static final String LOG_SESSION_INSIGHT = "log_session_insight";
    public static final String GET_VAGUS_EXERCISES = "get_vagus_exercises";
    static final int MAX_EXERCISES = 5;
    static final List<String> INSIGHT_CATEGORIES = List.of("breakthrough", "concern", "goal", "action_item");

    private static final Map<String, List<String>> EXERCISES = new LinkedHashMap<>();
    static {
        EXERCISES.put("anxiety", List.of(
                "4-7-8 breathing: Inhale 4 seconds, hold 7, exhale 8",
                "Cold water face immersion for 30 seconds",
                "Humming or singing for 2-3 minutes"));
        EXERCISES.put("stress", List.of(
                "Box breathing: 4 seconds each - inhale, hold, exhale, hold",
                "Gentle neck stretches and massage",
                "Progressive muscle relaxation"));
        EXERCISES.put("insomnia", List.of(
                "Slow diaphragmatic breathing before bed",
                "Gargling with water for 60 seconds",
                "Relaxation body scan meditation"));
        EXERCISES.put("tension", List.of(
                "Neck and shoulder rolls",
                "Massaging the carotid sinus area gently",
                "Chanting \"Om\" or humming"));
    }
    static final List<String> GENERAL_EXERCISES = List.of(
            "Deep breathing: 5 slow breaths, focusing on long exhales",
            "Cold water on face or wrists",
            "Humming or singing your favorite song");

    private final String sessionId;
    private final ObjectMapper objectMapper;
    private final List<String> insights = Collections.synchronizedList(new ArrayList<>());

    public CoachingFunctions(String sessionId, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.objectMapper = objectMapper;
    }

    public void registerAll(FunctionBridge bridge) {
        bridge.register(logSessionInsightDefinition(), this::logSessionInsight);
        bridge.register(getVagusExercisesDefinition(), this::getVagusExercises);
    }

    FunctionDefinition logSessionInsightDefinition() {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("type", "object");
        ObjectNode props = params.putObject("properties");
        ObjectNode insight = props.putObject("insight");
        insight.put("type", "string");
        insight.put("description", "The insight or observation to log");
        ObjectNode category = props.putObject("category");
        category.put("type", "string");
        INSIGHT_CATEGORIES.forEach(category.putArray("enum")::add);
        category.put("description", "Category of the insight");
        params.putArray("required").add("insight").add("category");
        return new FunctionDefinition(LOG_SESSION_INSIGHT,
                "Log an important insight, breakthrough, or action item from the session", params);
    }

    FunctionDefinition getVagusExercisesDefinition() {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("type", "object");
        ObjectNode symptoms = params.putObject("properties").putObject("symptoms");
        symptoms.put("type", "array");
        symptoms.putObject("items").put("type", "string");
        symptoms.put("description", "Current symptoms like anxiety, insomnia, stress, tension");
        params.putArray("required").add("symptoms");
        return new FunctionDefinition(GET_VAGUS_EXERCISES,
                "Get recommended vagus nerve exercises based on current symptoms", params);
    }

    FunctionResult logSessionInsight(JsonNode input) {
        String insight = input.path("insight").asText("").trim();
        String category = input.path("category").asText("").trim();
        if (insight.isEmpty()) {
            return FunctionResult.fail("insight is required");
        }
        if (!INSIGHT_CATEGORIES.contains(category)) {
            return FunctionResult.fail("category must be one of " + INSIGHT_CATEGORIES);
        }
        String entry = "[" + category + "] " + insight;
        insights.add(entry);
        log.info("Session insight logged: sessionId={}, category={}", sessionId, category);
        return FunctionResult.ok("Insight logged: " + entry);
    }

    FunctionResult getVagusExercises(JsonNode input) throws JsonProcessingException {
        List<String> symptoms = new ArrayList<>();
        for (JsonNode s : input.path("symptoms")) {
            symptoms.add(s.asText(""));
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String symptom : symptoms) {
            String lower = symptom.toLowerCase();
            for (Map.Entry<String, List<String>> e : EXERCISES.entrySet()) {
                if (lower.contains(e.getKey())) {
                    unique.addAll(e.getValue());
                }
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        if (unique.isEmpty()) {
            out.put("exercises", GENERAL_EXERCISES);
            out.put("note", "General vagus nerve exercises for wellness");
        } else {
            out.put("exercises", new ArrayList<>(unique).subList(0, Math.min(MAX_EXERCISES, unique.size())));
            out.put("targetSymptoms", symptoms);
        }
        return FunctionResult.ok(objectMapper.writeValueAsString(out));
    }

    public List<String> insights() {
        synchronized (insights) {
            return List.copyOf(insights);
        }
    }
}
