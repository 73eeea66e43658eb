package com.elssolution.insteonbridge.web;

import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.events.EventSubscriber;
import com.elssolution.insteonbridge.service.InsteonBridgeService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** /ws: each session becomes an event subscriber. Inbound messages are ignored. */
@Slf4j
@Component
public class EventWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_LIMIT_BYTES = 512 * 1024;

    private final InsteonBridgeService bridge;
    private final ObjectMapper mapper;
    private final Map<String, SessionSubscriber> subscribers = new ConcurrentHashMap<>();

    public EventWebSocketHandler(InsteonBridgeService bridge, ObjectMapper mapper) {
        this.bridge = bridge;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        SessionSubscriber subscriber = new SessionSubscriber(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_LIMIT_BYTES), mapper);
        subscribers.put(session.getId(), subscriber);
        bridge.attachSubscriber(subscriber);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error session={}: {}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SessionSubscriber subscriber = subscribers.remove(session.getId());
        if (subscriber != null) bridge.detachSubscriber(subscriber);
    }

    int sessionCount() {
        return subscribers.size();
    }

    static final class SessionSubscriber implements EventSubscriber {
        private final WebSocketSession session;
        private final ObjectMapper mapper;

        SessionSubscriber(WebSocketSession session, ObjectMapper mapper) {
            this.session = session;
            this.mapper = mapper;
        }

        @Override
        public void send(BridgeEvent event) throws Exception {
            if (!session.isOpen()) throw new IllegalStateException("session closed");
            session.sendMessage(new TextMessage(mapper.writeValueAsString(event)));
        }

        @Override
        public String describe() {
            return "ws:" + session.getId();
        }
    }
}
