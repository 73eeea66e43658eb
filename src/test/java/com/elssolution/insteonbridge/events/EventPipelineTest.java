package com.elssolution.insteonbridge.events;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.EventType;
import com.elssolution.insteonbridge.service.BridgeStatusTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class EventPipelineTest {

    private EventPipeline pipeline;

    @BeforeEach
    void setUp() {
        BridgeSettings settings = new BridgeSettings();
        settings.setEventCapacity(2);
        pipeline = new EventPipeline(settings, new BridgeStatusTracker(settings));
    }

    @Test
    void fullQueueDropsNewEventsWithoutBlocking() {
        assertThat(pipeline.publish(BridgeEvent.deviceRemoved("a"))).isTrue();
        assertThat(pipeline.publish(BridgeEvent.deviceRemoved("b"))).isTrue();
        assertThat(pipeline.publish(BridgeEvent.deviceRemoved("c"))).isFalse();

        assertThat(pipeline.pending()).isEqualTo(2);
        assertThat(pipeline.droppedCount()).isEqualTo(1);
    }

    @Test
    void attachGreetsWithCurrentStatus() {
        RecordingSubscriber sub = new RecordingSubscriber();

        pipeline.attach(sub);

        assertThat(sub.types()).containsExactly(EventType.WS_CONNECTED);
        assertThat(sub.received.get(0).toMap()).containsKey("status");
        assertThat(pipeline.subscriberCount()).isEqualTo(1);
    }

    @Test
    void broadcastDuringGreetingDoesNotOvertakeIt() {
        RecordingSubscriber sub = new RecordingSubscriber() {
            private boolean first = true;

            @Override
            public void send(BridgeEvent event) throws Exception {
                if (first) {
                    first = false;
                    // dispatch thread fires while the greeting is still in flight
                    pipeline.broadcast(BridgeEvent.deviceRemoved("112233"));
                }
                super.send(event);
            }
        };

        pipeline.attach(sub);
        pipeline.broadcast(BridgeEvent.deviceRemoved("445566"));

        assertThat(sub.types()).containsExactly(EventType.WS_CONNECTED, EventType.DEVICE_REMOVED);
        assertThat(sub.received.get(1).get("device_id")).isEqualTo("445566");
    }

    @Test
    void subscriberFailingTheGreetingIsNotKept() {
        RecordingSubscriber sub = new RecordingSubscriber();
        sub.failFromNowOn();

        pipeline.attach(sub);

        assertThat(pipeline.subscriberCount()).isZero();
    }

    @Test
    void failingSubscriberIsDetachedAfterThePassOthersStillReceive() {
        RecordingSubscriber broken = new RecordingSubscriber();
        RecordingSubscriber healthy = new RecordingSubscriber();
        pipeline.attach(broken);
        pipeline.attach(healthy);
        broken.failFromNowOn();

        pipeline.broadcast(BridgeEvent.deviceRemoved("112233"));

        assertThat(healthy.types()).containsExactly(EventType.WS_CONNECTED, EventType.DEVICE_REMOVED);
        assertThat(pipeline.subscriberCount()).isEqualTo(1);
    }

    @Test
    void dispatchLoopDeliversInOrderAndStopsOnInterrupt() throws Exception {
        RecordingSubscriber sub = new RecordingSubscriber();
        pipeline.attach(sub);
        Thread loop = new Thread(pipeline::runDispatchLoop, "test-dispatch");
        loop.start();

        pipeline.publish(BridgeEvent.deviceRemoved("a"));
        pipeline.publish(BridgeEvent.deviceRemoved("b"));

        await().atMost(Duration.ofSeconds(2)).until(() -> sub.received.size() == 3);
        assertThat(sub.received.get(1).get("device_id")).isEqualTo("a");
        assertThat(sub.received.get(2).get("device_id")).isEqualTo("b");

        loop.interrupt();
        loop.join(2000);
        assertThat(loop.isAlive()).isFalse();
    }
}
