package com.deepknow.goodface.coaching.config;

import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "coaching")
public class CoachingProperties {
    private final Deepgram deepgram = new Deepgram();
    private final Agent agent = new Agent();
    private final Listen listen = new Listen();
    private final Reconnect reconnect = new Reconnect();
    private final Gate gate = new Gate();
    private final Guidance guidance = new Guidance();
    private final Transcription transcription = new Transcription();
    private final Stream stream = new Stream();

    public Deepgram getDeepgram() { return deepgram; }
    public Agent getAgent() { return agent; }
    public Listen getListen() { return listen; }
    public Reconnect getReconnect() { return reconnect; }
    public Gate getGate() { return gate; }
    public Guidance getGuidance() { return guidance; }
    public Transcription getTranscription() { return transcription; }
    public Stream getStream() { return stream; }

    /**
     * 密钥优先取显式配置，其次取 apiKeyEnv 指定的环境变量。
     */
    public String resolveApiKey() {
        String key = deepgram.getApiKey();
        if (key != null && !key.isEmpty()) return key;
        String env = deepgram.getApiKeyEnv();
        return env == null ? null : System.getenv(env);
    }

    public CoachingSessionConfig toSessionConfig() {
        CoachingSessionConfig.CoachingSessionConfigBuilder b = CoachingSessionConfig.builder()
                .apiKey(resolveApiKey())
                .agentUrl(deepgram.getAgentUrl())
                .listenUrl(deepgram.getListenUrl())
                .language(agent.getLanguage())
                .sttModel(agent.getSttModel())
                .llmProvider(agent.getLlmProvider())
                .llmModel(agent.getLlmModel())
                .temperature(agent.getTemperature())
                .voiceModel(agent.getVoiceModel())
                .greeting(agent.getGreeting())
                .agentEncoding(agent.getEncoding())
                .agentSampleRate(agent.getSampleRate())
                .listenModel(listen.getModel())
                .listenEncoding(listen.getEncoding())
                .listenSampleRate(listen.getSampleRate())
                .listenChannels(listen.getChannels())
                .punctuate(listen.isPunctuate())
                .interimResults(listen.isInterimResults())
                .utteranceEndMs(listen.getUtteranceEndMs())
                .vadEvents(listen.isVadEvents())
                .maxReconnectAttempts(reconnect.getMaxAttempts())
                .reconnectBaseDelayMs(reconnect.getBaseDelayMs())
                .keepAliveIntervalMs(gate.getKeepAliveIntervalMs())
                .guidancePrefix(guidance.getPrefix())
                .guidanceTimeoutMs(guidance.getConfirmationTimeoutMs())
                .closeGraceMs(transcription.getCloseGraceMs());
        // 未配置时沿用内置的提示词与关键词
        if (agent.getPrompt() != null && !agent.getPrompt().isBlank()) b.prompt(agent.getPrompt());
        if (!agent.getKeyterms().isEmpty()) b.keyterms(List.copyOf(agent.getKeyterms()));
        return b.build();
    }

    public static class Deepgram {
        private String apiKey; // 直接配置的密钥（优先级高于 apiKeyEnv）
        private String apiKeyEnv = "DEEPGRAM_API_KEY";
        private String agentUrl = "wss://agent.deepgram.com/v1/agent/converse";
        private String listenUrl = "wss://api.deepgram.com/v1/listen";
        private int connectTimeoutMs = 10000;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
        public String getAgentUrl() { return agentUrl; }
        public void setAgentUrl(String agentUrl) { this.agentUrl = agentUrl; }
        public String getListenUrl() { return listenUrl; }
        public void setListenUrl(String listenUrl) { this.listenUrl = listenUrl; }
        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    public static class Agent {
        private String language = "en";
        private String sttModel = "nova-3-medical";
        private List<String> keyterms = new ArrayList<>();
        private String llmProvider = "open_ai";
        private String llmModel = "gpt-4o-mini";
        private double temperature = 0.7;
        private String voiceModel = "aura-2-thalia-en";
        private String prompt;
        private String greeting = CoachingSessionConfig.DEFAULT_GREETING;
        private String encoding = "linear16";
        private int sampleRate = 24000;

        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
        public String getSttModel() { return sttModel; }
        public void setSttModel(String sttModel) { this.sttModel = sttModel; }
        public List<String> getKeyterms() { return keyterms; }
        public void setKeyterms(List<String> keyterms) { this.keyterms = keyterms == null ? new ArrayList<>() : keyterms; }
        public String getLlmProvider() { return llmProvider; }
        public void setLlmProvider(String llmProvider) { this.llmProvider = llmProvider; }
        public String getLlmModel() { return llmModel; }
        public void setLlmModel(String llmModel) { this.llmModel = llmModel; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public String getVoiceModel() { return voiceModel; }
        public void setVoiceModel(String voiceModel) { this.voiceModel = voiceModel; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
        public String getGreeting() { return greeting; }
        public void setGreeting(String greeting) { this.greeting = greeting; }
        public String getEncoding() { return encoding; }
        public void setEncoding(String encoding) { this.encoding = encoding; }
        public int getSampleRate() { return sampleRate; }
        public void setSampleRate(int sampleRate) { this.sampleRate = sampleRate; }
    }

    public static class Listen {
        private String model = "nova-3";
        private String encoding = "linear16";
        private int sampleRate = 24000;
        private int channels = 1;
        private boolean punctuate = true;
        private boolean interimResults = true;
        private int utteranceEndMs = 1000;
        private boolean vadEvents = true;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getEncoding() { return encoding; }
        public void setEncoding(String encoding) { this.encoding = encoding; }
        public int getSampleRate() { return sampleRate; }
        public void setSampleRate(int sampleRate) { this.sampleRate = sampleRate; }
        public int getChannels() { return channels; }
        public void setChannels(int channels) { this.channels = channels; }
        public boolean isPunctuate() { return punctuate; }
        public void setPunctuate(boolean punctuate) { this.punctuate = punctuate; }
        public boolean isInterimResults() { return interimResults; }
        public void setInterimResults(boolean interimResults) { this.interimResults = interimResults; }
        public int getUtteranceEndMs() { return utteranceEndMs; }
        public void setUtteranceEndMs(int utteranceEndMs) { this.utteranceEndMs = utteranceEndMs; }
        public boolean isVadEvents() { return vadEvents; }
        public void setVadEvents(boolean vadEvents) { this.vadEvents = vadEvents; }
    }

    public static class Reconnect {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
    }

    public static class Gate {
        private long keepAliveIntervalMs = 8000;

        public long getKeepAliveIntervalMs() { return keepAliveIntervalMs; }
        public void setKeepAliveIntervalMs(long keepAliveIntervalMs) { this.keepAliveIntervalMs = keepAliveIntervalMs; }
    }

    public static class Guidance {
        private String prefix = "Coach guidance: ";
        private long confirmationTimeoutMs = 5000;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
        public long getConfirmationTimeoutMs() { return confirmationTimeoutMs; }
        public void setConfirmationTimeoutMs(long confirmationTimeoutMs) { this.confirmationTimeoutMs = confirmationTimeoutMs; }
    }

    public static class Transcription {
        private long closeGraceMs = 100;

        public long getCloseGraceMs() { return closeGraceMs; }
        public void setCloseGraceMs(long closeGraceMs) { this.closeGraceMs = closeGraceMs; }
    }

    /**
     * 参会方 WebSocket 容器参数。
     */
    public static class Stream {
        private int maxBinaryMessageBytes = 64 * 1024;
        private int maxTextMessageBytes = 16 * 1024;
        private long idleTimeoutMs = 60000;

        public int getMaxBinaryMessageBytes() { return maxBinaryMessageBytes; }
        public void setMaxBinaryMessageBytes(int maxBinaryMessageBytes) { this.maxBinaryMessageBytes = maxBinaryMessageBytes; }
        public int getMaxTextMessageBytes() { return maxTextMessageBytes; }
        public void setMaxTextMessageBytes(int maxTextMessageBytes) { this.maxTextMessageBytes = maxTextMessageBytes; }
        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
    }
}
