package com.infinitecanvas.canvasbackend.websocket;

import com.infinitecanvas.canvasbackend.dispatch.MutationDispatcher;
import com.infinitecanvas.canvasbackend.session.CanvasSession;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;

/**
 * WebSocket endpoint of the canvas. Each text frame carries one {@code {type, data}}
 * envelope and is handed to the {@link MutationDispatcher}.
 */
@Component
public class CanvasWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(CanvasWebSocketHandler.class);

    private final SessionRegistry sessionRegistry;
    private final MutationDispatcher dispatcher;
    private final Clock clock;

    public CanvasWebSocketHandler(SessionRegistry sessionRegistry, MutationDispatcher dispatcher, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessionRegistry.register(session);
        log.info("Canvas connection opened: id={}, remote={}, total={}",
                session.getId(), session.getRemoteAddress(), sessionRegistry.connectionCount());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        sessionRegistry.find(session.getId()).ifPresentOrElse(
                canvasSession -> dispatcher.dispatch(canvasSession, message.getPayload()),
                () -> log.warn("Frame from unregistered connection {}", session.getId()));
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        sessionRegistry.find(session.getId()).ifPresent(s -> s.touch(clock.instant()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionRegistry.find(session.getId()).ifPresent(dispatcher::disconnect);
        log.info("Canvas connection closed: id={}, status={}, remaining={}",
                session.getId(), status, sessionRegistry.connectionCount());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }
}
