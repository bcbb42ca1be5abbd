package com.example.homemic_backend.websocket;

import com.example.homemic_backend.service.events.EventBus;
import com.example.homemic_backend.service.events.EventFrameCodec;
import com.example.homemic_backend.service.events.FrameSink;
import com.example.homemic_backend.service.events.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges dashboard websocket sessions onto the {@link EventBus}. Any inbound frame counts as
 * liveness; an inbound {@code ping} is answered with a {@code pong}.
 */
@Component
public class LiveEventsWebSocketHandler extends TextWebSocketHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(LiveEventsWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private record Connection(WebSocketSession outbound, Subscription subscription) {}

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final EventBus eventBus;
    private final EventFrameCodec codec;
    private final Clock clock;

    public LiveEventsWebSocketHandler(EventBus eventBus, EventFrameCodec codec, Clock clock) {
        this.eventBus = eventBus;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        connections.put(session.getId(), new Connection(outbound, eventBus.subscribe(new SessionFrameSink(outbound))));
        LOGGER.debug("WS open id={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        Connection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        connection.subscription().heartbeatAcknowledged();
        if (EventFrameCodec.PING.equals(codec.typeOf(message.getPayload()))) {
            connection.outbound().sendMessage(new TextMessage(codec.pong(clock.instant())));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOGGER.debug("WS transport error id={} err={}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Connection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.subscription().cancel();
        }
        LOGGER.debug("WS closed id={} status={}", session.getId(), status);
    }

    int openSessions() {
        return connections.size();
    }

    static final class SessionFrameSink implements FrameSink {
        private final WebSocketSession session;

        SessionFrameSink(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public String id() {
            return session.getId();
        }

        @Override
        public void send(String frame) throws IOException {
            session.sendMessage(new TextMessage(frame));
        }

        @Override
        public void close(String reason) {
            try {
                session.close(CloseStatus.GOING_AWAY.withReason(reason));
            } catch (IOException e) {
                LOGGER.debug("WS close failed id={} err={}", session.getId(), e.toString());
            }
        }
    }
}
