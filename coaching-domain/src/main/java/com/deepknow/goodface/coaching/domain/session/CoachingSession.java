package com.deepknow.goodface.coaching.domain.session;

import com.deepknow.goodface.coaching.domain.audio.GateStatus;
import com.deepknow.goodface.coaching.domain.audio.MuteOutcome;
import com.deepknow.goodface.coaching.domain.audio.ParticipantRole;
import com.deepknow.goodface.coaching.domain.audio.RouterStats;
import com.deepknow.goodface.coaching.domain.event.SessionEventListener;
import com.deepknow.goodface.coaching.domain.event.Subscription;
import com.deepknow.goodface.coaching.domain.link.LinkStatus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 一次三方教练会话：持有两条上游链路、闸门、路由、指导通道与函数桥。
 */
public interface CoachingSession {
    String getSessionId();

    /** 建立两条上游链路，立即返回，就绪状态通过 LINK_STATE 事件通知。 */
    void start();

    void routeAudio(byte[] audio, String participantId, String participantName);

    void registerParticipant(String participantId, ParticipantRole role, String displayName);

    void unregisterParticipant(String participantId);

    MuteOutcome setMutedFromAi(String participantId, boolean muted);

    boolean pauseAI();

    boolean resumeAI();

    boolean isAIPaused();

    /**
     * 发送教练指导；future 在 PromptUpdated 确认后完成，
     * 失败时为 GuidanceTimeoutException 或 GuidanceRejectedException。
     */
    CompletableFuture<Void> sendGuidance(String text, String coachId);

    RouterStats getStats();

    GateStatus getGateStatus();

    List<LinkStatus> linkStatuses();

    SessionHealth health();

    Subscription subscribe(SessionEventListener listener);

    /** 幂等。 */
    void cleanup();

    boolean isClosed();
}
