package com.deepknow.goodface.coaching.domain.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 单会话事件总线。监听器数量有上限，单个监听器异常只记录日志，不影响其他监听器。
 */
public class SessionEventBus implements SessionEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(SessionEventBus.class);
    public static final int DEFAULT_MAX_LISTENERS = 32;

    private final String sessionId;
    private final int maxListeners;
    private final CopyOnWriteArrayList<SessionEventListener> listeners = new CopyOnWriteArrayList<>();

    public SessionEventBus(String sessionId) {
        this(sessionId, DEFAULT_MAX_LISTENERS);
    }

    public SessionEventBus(String sessionId, int maxListeners) {
        this.sessionId = sessionId;
        this.maxListeners = maxListeners;
    }

    public Subscription subscribe(SessionEventListener listener) {
        if (listener == null) throw new IllegalArgumentException("listener is null");
        synchronized (listeners) {
            if (listeners.size() >= maxListeners) {
                throw new IllegalStateException("Too many listeners for session " + sessionId + ": max=" + maxListeners);
            }
            listeners.add(listener);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * 只订阅某一类事件。
     */
    public <T extends SessionEvent> Subscription subscribe(Class<T> eventClass, Consumer<T> handler) {
        return subscribe(event -> {
            if (eventClass.isInstance(event)) {
                handler.accept(eventClass.cast(event));
            }
        });
    }

    @Override
    public void publish(SessionEvent event) {
        if (event == null) return;
        for (SessionEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (Exception e) {
                log.warn("Event listener failed: sessionId={}, type={}", sessionId, event.getType(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }
}
