package com.deepknow.goodface.coaching.domain.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionEventBusTest {

    @Test
    void failingListenerDoesNotBreakOthers() {
        SessionEventBus bus = new SessionEventBus("s1");
        List<SessionEvent> received = new ArrayList<>();
        bus.subscribe(e -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(received::add);

        bus.publish(new PauseEvent(true));

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getType()).isEqualTo(SessionEventType.AI_PAUSE);
    }

    @Test
    void typedSubscriptionFiltersAndCloses() {
        SessionEventBus bus = new SessionEventBus("s1");
        List<GateEvent> gates = new ArrayList<>();
        Subscription sub = bus.subscribe(GateEvent.class, gates::add);

        bus.publish(new PauseEvent(false));
        bus.publish(new GateEvent(GateEvent.Action.MUTED, "c2"));
        sub.close();
        sub.close();
        bus.publish(new GateEvent(GateEvent.Action.UNMUTED, "c2"));

        assertThat(gates).extracting(GateEvent::getAction).containsExactly(GateEvent.Action.MUTED);
        assertThat(bus.listenerCount()).isZero();
    }

    @Test
    void listenerLimitIsEnforced() {
        SessionEventBus bus = new SessionEventBus("s1", 2);
        bus.subscribe(e -> { });
        bus.subscribe(e -> { });

        assertThatThrownBy(() -> bus.subscribe(e -> { })).isInstanceOf(IllegalStateException.class);

        bus.clear();
        assertThat(bus.listenerCount()).isZero();
    }
}
