package com.deepknow.goodface.coaching.domain.session;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 强类型会话配置：上游链路、闸门、重连与教练指导参数。
 * 默认值来自应用配置，单个会话可通过 {@link #withOverrides(Map)} 覆盖部分字段。
 */
@Getter
@Builder(toBuilder = true)
public class CoachingSessionConfig {
    public static final String DEFAULT_PROMPT =
            "You are a supportive AI wellness coach specializing in vagus nerve health and stress management. "
                    + "Listen actively, ask open-ended questions and keep responses concise (1-3 sentences). "
                    + "You support wellness and do not provide medical advice.";
    public static final String DEFAULT_GREETING = "Hi there! I'm your AI wellness coach. How are you feeling today?";

    // Deepgram
    private final String apiKey;
    @Builder.Default private final String agentUrl = "wss://agent.deepgram.com/v1/agent/converse";
    @Builder.Default private final String listenUrl = "wss://api.deepgram.com/v1/listen";

    // 对话代理
    @Builder.Default private final String language = "en";
    @Builder.Default private final String sttModel = "nova-3-medical";
    @Builder.Default private final List<String> keyterms = List.of("vagus", "vagus nerve", "vagal tone", "polyvagal",
            "parasympathetic", "nervous system", "HRV", "heart rate variability", "breathwork", "mindfulness");
    @Builder.Default private final String llmProvider = "open_ai";
    @Builder.Default private final String llmModel = "gpt-4o-mini";
    @Builder.Default private final double temperature = 0.7;
    @Builder.Default private final String voiceModel = "aura-2-thalia-en";
    @Builder.Default private final String prompt = DEFAULT_PROMPT;
    // 为空则不下发 greeting
    @Builder.Default private final String greeting = DEFAULT_GREETING;
    @Builder.Default private final String agentEncoding = "linear16";
    @Builder.Default private final int agentSampleRate = 24000;

    // 转写；路由把同一帧同时送往两条链路，编码需与对话链路输入一致
    @Builder.Default private final String listenModel = "nova-3";
    @Builder.Default private final String listenEncoding = "linear16";
    @Builder.Default private final int listenSampleRate = 24000;
    @Builder.Default private final int listenChannels = 1;
    @Builder.Default private final boolean punctuate = true;
    @Builder.Default private final boolean interimResults = true;
    @Builder.Default private final int utteranceEndMs = 1000;
    @Builder.Default private final boolean vadEvents = true;

    // 重连
    @Builder.Default private final int maxReconnectAttempts = 3;
    @Builder.Default private final long reconnectBaseDelayMs = 1000;

    // 闸门
    @Builder.Default private final long keepAliveIntervalMs = 8000;

    // 教练指导
    @Builder.Default private final String guidancePrefix = "Coach guidance: ";
    @Builder.Default private final long guidanceTimeoutMs = 5000;

    @Builder.Default private final long closeGraceMs = 100;

    public static CoachingSessionConfig defaults() {
        return CoachingSessionConfig.builder().build();
    }

    /**
     * 按会话覆盖：prompt / greeting / llmModel / voiceModel / temperature / keyterms。
     * 无法解析的值回落到当前配置。
     */
    public CoachingSessionConfig withOverrides(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        return toBuilder()
                .prompt(getString(overrides, "prompt", prompt))
                .greeting(getString(overrides, "greeting", greeting))
                .llmModel(getString(overrides, "llmModel", llmModel))
                .voiceModel(getString(overrides, "voiceModel", voiceModel))
                .temperature(getDouble(overrides, "temperature", temperature))
                .keyterms(getList(overrides, "keyterms", keyterms))
                .build();
    }

    private static String getString(Map<String, Object> cfg, String key, String def) {
        Object v = cfg.get(key);
        return v == null ? def : String.valueOf(v);
    }
    private static double getDouble(Map<String, Object> cfg, String key, double def) {
        Object v = cfg.get(key);
        if (v == null) return def;
        try { return Double.parseDouble(String.valueOf(v)); } catch (NumberFormatException e) { return def; }
    }
    private static List<String> getList(Map<String, Object> cfg, String key, List<String> def) {
        Object v = cfg.get(key);
        if (!(v instanceof List)) return def;
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) v) {
            if (o != null) out.add(String.valueOf(o));
        }
        return List.copyOf(out);
    }

    public boolean hasGreeting() {
        return greeting != null && !greeting.isBlank();
    }
}
