package com.deepknow.goodface.coaching.domain.feature;

/**
 * 对话链路拒绝发送（未就绪或会话已关闭）。
 */
public class GuidanceRejectedException extends GuidanceException {
    public GuidanceRejectedException(String message) {
        super(message);
    }
}
