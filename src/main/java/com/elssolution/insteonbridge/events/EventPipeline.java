package com.elssolution.insteonbridge.events;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.service.BridgeStatusTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded event queue plus fan-out to attached subscribers.
 *
 * Producers never block: when the queue is full the new event is dropped and logged.
 * One dispatch loop (started by the supervisor) drains the queue and broadcasts.
 */
@Slf4j
@Component
public class EventPipeline {

    private final BlockingQueue<BridgeEvent> queue;
    private final int capacity;
    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final BridgeStatusTracker status;
    private final AtomicLong dropped = new AtomicLong();

    public EventPipeline(BridgeSettings settings, BridgeStatusTracker status) {
        this.capacity = Math.max(1, settings.getEventCapacity());
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.status = status;
    }

    /** Non-blocking enqueue. Returns false when the event was dropped. */
    public boolean publish(BridgeEvent event) {
        if (queue.offer(event)) return true;
        long n = dropped.incrementAndGet();
        log.warn("event_dropped type={} reason=queue_full capacity={} droppedTotal={}",
                event.type().wireName(), capacity, n);
        return false;
    }

    /** Runs until the calling thread is interrupted. */
    public void runDispatchLoop() {
        log.debug("event_dispatch_started");
        try {
            while (!Thread.currentThread().isInterrupted()) {
                broadcast(queue.take());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        log.debug("event_dispatch_stopped");
    }

    /** Deliver to every subscriber; the ones that fail are detached after the pass. */
    public void broadcast(BridgeEvent event) {
        if (subscribers.isEmpty()) return;
        List<EventSubscriber> stale = new ArrayList<>();
        for (EventSubscriber s : subscribers) {
            try {
                s.send(event);
            } catch (Exception e) {
                log.debug("subscriber_send_failed subscriber={} type={}: {}",
                        s.describe(), event.type().wireName(), e.toString());
                stale.add(s);
            }
        }
        if (!stale.isEmpty()) {
            subscribers.removeAll(stale);
            log.info("subscribers_detached count={} remaining={}", stale.size(), subscribers.size());
        }
    }

    /**
     * Send a ws_connected event with the current status, then attach. The greeting is
     * always the first event a subscriber sees.
     */
    public void attach(EventSubscriber subscriber) {
        try {
            subscriber.send(BridgeEvent.wsConnected(status.snapshot(subscribers.size() + 1)));
        } catch (Exception e) {
            log.debug("subscriber_greeting_failed subscriber={}: {}", subscriber.describe(), e.toString());
            return;
        }
        subscribers.add(subscriber);
        log.info("subscriber_attached subscriber={} total={}", subscriber.describe(), subscribers.size());
    }

    public void detach(EventSubscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            log.info("subscriber_detached subscriber={} total={}", subscriber.describe(), subscribers.size());
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public int pending() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }
}
