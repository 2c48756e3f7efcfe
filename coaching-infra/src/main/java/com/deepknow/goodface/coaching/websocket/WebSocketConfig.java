package com.deepknow.goodface.coaching.websocket;

import com.deepknow.goodface.coaching.config.CoachingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.ServletContextInitializer;
import org.springframework.context.annotation.Configuration;

import javax.servlet.ServletContext;
import javax.websocket.DeploymentException;
import javax.websocket.server.ServerContainer;

/**
 * 启动时把参会方音频流端点挂到 Servlet 容器上，并按 coaching.stream 设置消息缓冲与空闲超时。
 * 注册失败只记日志，RPC 控制面仍然可用。
 */
@Configuration
public class WebSocketConfig implements ServletContextInitializer {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);
    static final String SERVER_CONTAINER_ATTRIBUTE = "javax.websocket.server.ServerContainer";

    private final CoachingProperties.Stream stream;

    public WebSocketConfig(CoachingProperties properties) {
        this.stream = properties.getStream();
    }

    @Override
    public void onStartup(ServletContext servletContext) {
        Object attr = servletContext.getAttribute(SERVER_CONTAINER_ATTRIBUTE);
        if (!(attr instanceof ServerContainer)) {
            log.warn("No javax.websocket ServerContainer in servlet context, coaching stream disabled");
            return;
        }
        register((ServerContainer) attr);
    }

    boolean register(ServerContainer container) {
        container.setDefaultMaxBinaryMessageBufferSize(stream.getMaxBinaryMessageBytes());
        container.setDefaultMaxTextMessageBufferSize(stream.getMaxTextMessageBytes());
        container.setDefaultMaxSessionIdleTimeout(stream.getIdleTimeoutMs());
        try {
            container.addEndpoint(CoachingStreamEndpoint.class);
        } catch (DeploymentException e) {
            log.error("Register coaching stream endpoint failed: endpoint={}", CoachingStreamEndpoint.class.getSimpleName(), e);
            return false;
        }
        log.info("Coaching stream endpoint registered: maxBinaryBytes={}, maxTextBytes={}, idleTimeoutMs={}",
                stream.getMaxBinaryMessageBytes(), stream.getMaxTextMessageBytes(), stream.getIdleTimeoutMs());
        return true;
    }
}
