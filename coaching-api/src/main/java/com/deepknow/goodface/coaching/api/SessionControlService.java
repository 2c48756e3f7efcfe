package com.deepknow.goodface.coaching.api;

import com.deepknow.goodface.coaching.api.model.ControlResult;
import com.deepknow.goodface.coaching.api.model.RoutingStatsInfo;
import com.deepknow.goodface.coaching.api.request.EndSessionRequest;
import com.deepknow.goodface.coaching.api.request.GuidanceRequest;
import com.deepknow.goodface.coaching.api.request.MuteFromAiRequest;
import com.deepknow.goodface.coaching.api.request.PauseAiRequest;
import com.deepknow.goodface.coaching.api.request.StartSessionRequest;

/**
 * 会话控制面：供房间/业务侧通过 Dubbo 调用。
 * 所有调用方输入错误通过 {@link ControlResult#getCode()} 返回，不抛出业务异常。
 */
public interface SessionControlService {
    ControlResult startSession(StartSessionRequest req);
    ControlResult endSession(EndSessionRequest req);
    ControlResult muteFromAi(MuteFromAiRequest req);
    ControlResult setAiPaused(PauseAiRequest req);

    /**
     * 发送教练指导，阻塞直到对话端确认（PromptUpdated）或超时。
     */
    ControlResult sendGuidance(GuidanceRequest req);

    RoutingStatsInfo getStats(String sessionId);
}
