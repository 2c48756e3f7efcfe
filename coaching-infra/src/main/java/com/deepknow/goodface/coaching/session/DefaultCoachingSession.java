package com.deepknow.goodface.coaching.session;

import com.deepknow.goodface.coaching.domain.audio.AudioEncoding;
import com.deepknow.goodface.coaching.domain.audio.GateStatus;
import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.audio.RouterStats;
import com.deepknow.goodface.coaching.domain.event.AgentAudioEvent;
import com.deepknow.goodface.coaching.domain.event.ErrorEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventBus;
import com.deepknow.goodface.coaching.domain.event.SessionEventListener;
import com.deepknow.goodface.coaching.domain.event.Subscription;
import com.deepknow.goodface.coaching.domain.feature.FunctionDefinition;
import com.deepknow.goodface.coaching.domain.feature.FunctionHandler;
import com.deepknow.goodface.coaching.domain.link.LinkState;
import com.deepknow.goodface.coaching.domain.link.LinkStatus;
import com.deepknow.goodface.coaching.domain.session.CoachingSession;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.deepknow.goodface.coaching.domain.session.SessionHealth;
import com.deepknow.goodface.coaching.feature.CoachingFunctions;
import com.deepknow.goodface.coaching.feature.FunctionBridge;
import com.deepknow.goodface.coaching.feature.GuidanceChannel;
import com.deepknow.goodface.coaching.link.DeepgramAgentLink;
import com.deepknow.goodface.coaching.link.DeepgramListenLink;
import com.deepknow.goodface.coaching.link.LinkConnector;
import com.deepknow.goodface.coaching.routing.AudioGate;
import com.deepknow.goodface.coaching.routing.AudioRouter;
import com.deepknow.goodface.coaching.routing.ParticipantRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个教练会话的所有运行时组件。
 * 定时器、重连退避、指导超时与函数执行共用一个单线程调度器（线程名 coaching-session-&lt;id&gt;）。
 */
public class DefaultCoachingSession implements CoachingSession {
    private static final Logger log = LoggerFactory.getLogger(DefaultCoachingSession.class);

    private final String sessionId;
    private final CoachingSessionConfig config;
    private final ScheduledExecutorService scheduler;
    private final SessionEventBus bus;
    private final ParticipantRegistry registry;
    private final DeepgramAgentLink conversational;
    private final DeepgramListenLink transcription;
    private final AudioGate gate;
    private final AudioRouter router;
    private final GuidanceChannel guidance;
    private final FunctionBridge functionBridge;
    private final CoachingFunctions coachingFunctions;
    private final List<Subscription> internalSubscriptions = new ArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong suppressedAgentAudio = new AtomicLong();

    public DefaultCoachingSession(String sessionId, CoachingSessionConfig config, LinkConnector connector,
                                  ObjectMapper objectMapper, Clock clock) {
        this.sessionId = sessionId;
        this.config = config;
        this.scheduler = newScheduler(sessionId);
        this.bus = new SessionEventBus(sessionId);
        this.registry = new ParticipantRegistry(sessionId);

        this.conversational = new DeepgramAgentLink(sessionId, config, connector, scheduler,
                this::publishFromAgent, objectMapper, this::functionDefinitions, clock);
        this.transcription = new DeepgramListenLink(sessionId, config, connector, scheduler, bus, objectMapper);

        this.gate = new AudioGate(sessionId, conversational, scheduler, bus, clock, config.getKeepAliveIntervalMs());
        this.router = new AudioRouter(sessionId, registry, gate, transcription, bus,
                AudioEncoding.fromWireName(config.getAgentEncoding()), clock);

        this.guidance = new GuidanceChannel(sessionId, conversational, scheduler, bus,
                config.getPrompt(), config.getGuidancePrefix(), config.getGuidanceTimeoutMs());
        this.functionBridge = new FunctionBridge(sessionId, conversational, scheduler, bus, objectMapper);
        this.coachingFunctions = new CoachingFunctions(sessionId, objectMapper);
        coachingFunctions.registerAll(functionBridge);

        internalSubscriptions.add(bus.subscribe(guidance));
        internalSubscriptions.add(bus.subscribe(functionBridge));
        internalSubscriptions.add(bus.subscribe(ErrorEvent.class, this::onError));
    }

    private static ScheduledExecutorService newScheduler(String sessionId) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "coaching-session-" + sessionId);
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private List<FunctionDefinition> functionDefinitions() {
        return functionBridge.definitions();
    }

    // AI 暂停期间不向外输出合成音频
    private void publishFromAgent(SessionEvent event) {
        if (event instanceof AgentAudioEvent && router.isAIPaused()) {
            suppressedAgentAudio.incrementAndGet();
            return;
        }
        bus.publish(event);
    }

    private void onError(ErrorEvent e) {
        if (e.isTerminal()) {
            log.error("Session degraded: sessionId={}, source={}, code={}, health={}", sessionId, e.getSource(), e.getCode(), health());
        }
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public void start() {
        if (closed.get() || !started.compareAndSet(false, true)) return;
        log.info("Starting coaching session: sessionId={}, agentModel={}, listenModel={}",
                sessionId, config.getLlmModel(), config.getListenModel());
        conversational.connect();
        transcription.connect();
    }

    @Override
    public void routeAudio(byte[] audio, String participantId, String participantName) {
        if (closed.get()) {
            log.trace("Audio after cleanup dropped: sessionId={}, participantId={}", sessionId, participantId);
            return;
        }
        router.routeAudio(audio, participantId, participantName);
    }

    @Override
    public void registerParticipant(String participantId, ParticipantRole role, String displayName) {
        router.registerParticipant(participantId, role, displayName);
    }

    @Override
    public void unregisterParticipant(String participantId) {
        router.unregisterParticipant(participantId);
    }

    @Override
    public MuteOutcome setMutedFromAi(String participantId, boolean muted) {
        return router.handleMuteCommand(participantId, muted);
    }

    @Override
    public boolean pauseAI() {
        return router.pauseAI();
    }

    @Override
    public boolean resumeAI() {
        return router.resumeAI();
    }

    @Override
    public boolean isAIPaused() {
        return router.isAIPaused();
    }

    @Override
    public CompletableFuture<Void> sendGuidance(String text, String coachId) {
        return guidance.sendGuidance(text, coachId);
    }

    public void registerFunction(FunctionDefinition definition, FunctionHandler handler) {
        functionBridge.register(definition, handler);
    }

    public void forceKeepAlive() {
        router.forceKeepAlive();
    }

    @Override
    public RouterStats getStats() {
        return router.getStats();
    }

    @Override
    public GateStatus getGateStatus() {
        return router.getGateStatus();
    }

    @Override
    public List<LinkStatus> linkStatuses() {
        return List.of(conversational.status(), transcription.status());
    }

    @Override
    public SessionHealth health() {
        LinkState a = conversational.getState();
        LinkState b = transcription.getState();
        int ready = (a == LinkState.READY ? 1 : 0) + (b == LinkState.READY ? 1 : 0);
        if (ready == 2) return SessionHealth.CONNECTED;
        if (closed.get()) return SessionHealth.DISCONNECTED;
        if (ready == 1 || isConnecting(a) || isConnecting(b)) return SessionHealth.DEGRADED;
        return SessionHealth.DISCONNECTED;
    }

    private static boolean isConnecting(LinkState s) {
        return s == LinkState.CONNECTING || s == LinkState.SETTINGS_PENDING;
    }

    @Override
    public Subscription subscribe(SessionEventListener listener) {
        return bus.subscribe(listener);
    }

    @Override
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Cleaning up coaching session: sessionId={}, suppressedAgentAudio={}", sessionId, suppressedAgentAudio.get());
        guidance.cleanup();
        transcription.closeStream();
        conversational.close();
        router.cleanup();
        functionBridge.cleanup();
        internalSubscriptions.forEach(Subscription::close);
        internalSubscriptions.clear();
        bus.clear();
        // 已排队的延迟任务（转写链路的优雅关闭）仍会执行，周期任务随之取消
        scheduler.shutdown();
        log.info("Coaching session closed: sessionId={}", sessionId);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    public CoachingSessionConfig getConfig() { return config; }
    public long getSuppressedAgentAudio() { return suppressedAgentAudio.get(); }
    public List<String> sessionInsights() { return coachingFunctions.insights(); }

    DeepgramAgentLink conversationalLink() { return conversational; }
    DeepgramListenLink transcriptionLink() { return transcription; }
    FunctionBridge functionBridge() { return functionBridge; }
    GuidanceChannel guidanceChannel() { return guidance; }
}
