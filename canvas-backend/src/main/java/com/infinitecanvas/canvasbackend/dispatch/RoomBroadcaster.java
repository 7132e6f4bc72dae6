package com.infinitecanvas.canvasbackend.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.ServerMessage;
import com.infinitecanvas.canvasbackend.session.CanvasSession;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Fan-out of frames to the sessions of a room. A failed send to one peer is
 * logged and skipped.
 */
@Component
public class RoomBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final SessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;

    public RoomBroadcaster(SessionRegistry sessionRegistry, ObjectMapper objectMapper) {
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * Sends {@code payload} to every open session bound to {@code roomName} except {@code origin}.
     *
     * @return number of peers the frame was delivered to
     */
    public int broadcast(String payload, CanvasSession origin, String roomName) {
        int delivered = 0;
        for (CanvasSession peer : sessionRegistry.sessionsInRoom(roomName)) {
            if (peer == origin || !peer.isOpen()) {
                continue;
            }
            try {
                peer.send(payload);
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to deliver to {} in room '{}': {}", peer.getId(), roomName, e.getMessage());
            }
        }
        log.trace("Relayed frame to {} peers in room '{}'", delivered, roomName);
        return delivered;
    }

    public int broadcast(ServerMessage message, CanvasSession origin, String roomName) {
        return broadcast(write(message), origin, roomName);
    }

    public void sendTo(CanvasSession session, ServerMessage message) {
        try {
            session.send(write(message));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send {} to {}: {}", message.type(), session.getId(), e.getMessage());
        }
    }

    public void sendError(CanvasSession session, CanvasException error) {
        sendTo(session, ServerMessage.error(error.getCode(), error.getMessage()));
    }

    private String write(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + message.type() + " message", e);
        }
    }
}
