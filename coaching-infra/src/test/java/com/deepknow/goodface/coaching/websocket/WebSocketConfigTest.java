package com.deepknow.goodface.coaching.websocket;

import com.deepknow.goodface.coaching.config.CoachingProperties;
import org.junit.jupiter.api.Test;

import javax.servlet.ServletContext;
import javax.websocket.DeploymentException;
import javax.websocket.server.ServerContainer;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebSocketConfigTest {

    /**
     * 记录 setter 与 addEndpoint 调用的容器替身。
     */
    private static ServerContainer recordingContainer(Map<String, Object> calls, boolean failDeploy) {
        return (ServerContainer) Proxy.newProxyInstance(ServerContainer.class.getClassLoader(),
                new Class<?>[]{ServerContainer.class}, (proxy, method, args) -> {
                    if (method.getName().equals("addEndpoint") && failDeploy) {
                        throw new DeploymentException("duplicate path");
                    }
                    calls.put(method.getName(), args == null ? null : args[0]);
                    return null;
                });
    }

    @Test
    void registersEndpointWithConfiguredLimits() {
        CoachingProperties props = new CoachingProperties();
        props.getStream().setMaxBinaryMessageBytes(32768);
        props.getStream().setIdleTimeoutMs(15000);
        Map<String, Object> calls = new HashMap<>();

        boolean registered = new WebSocketConfig(props).register(recordingContainer(calls, false));

        assertThat(registered).isTrue();
        assertThat(calls).containsEntry("addEndpoint", CoachingStreamEndpoint.class)
                .containsEntry("setDefaultMaxBinaryMessageBufferSize", 32768)
                .containsEntry("setDefaultMaxTextMessageBufferSize", 16 * 1024)
                .containsEntry("setDefaultMaxSessionIdleTimeout", 15000L);
    }

    @Test
    void deploymentFailureIsReportedNotThrown() {
        Map<String, Object> calls = new HashMap<>();

        boolean registered = new WebSocketConfig(new CoachingProperties()).register(recordingContainer(calls, true));

        assertThat(registered).isFalse();
        assertThat(calls).doesNotContainKey("addEndpoint");
    }

    @Test
    void missingServerContainerIsSkipped() {
        Map<String, Object> attributes = new HashMap<>();
        ServletContext context = (ServletContext) Proxy.newProxyInstance(ServletContext.class.getClassLoader(),
                new Class<?>[]{ServletContext.class}, (proxy, method, args) -> {
                    if (method.getName().equals("getAttribute")) {
                        attributes.put("requested", args[0]);
                        return null;
                    }
                    return null;
                });

        new WebSocketConfig(new CoachingProperties()).onStartup(context);

        assertThat(attributes).containsEntry("requested", WebSocketConfig.SERVER_CONTAINER_ATTRIBUTE);
    }
}
