package com.infinitecanvas.canvasbackend.session;

import com.infinitecanvas.canvasbackend.access.Role;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;

/**
 * One client connection. Room and role are bound once by a join; the user
 * identity arrives later with the first {@code userInfo}.
 */
public class CanvasSession {
    private final WebSocketSession socket;
    private volatile String roomName;
    private volatile Role role;
    private volatile String userId;
    private volatile String userName;
    private volatile Instant lastSeen;

    public CanvasSession(WebSocketSession socket, Instant connectedAt) {
        this.socket = socket;
        this.lastSeen = connectedAt;
    }

    public String getId() {
        return socket.getId();
    }

    public boolean isOpen() {
        return socket.isOpen();
    }

    public synchronized void bind(String roomName, Role role) {
        if (this.roomName != null) {
            throw CanvasException.alreadyJoined(this.roomName);
        }
        this.role = role;
        this.roomName = roomName;
    }

    public boolean isJoined() {
        return roomName != null;
    }

    /**
     * Records the user behind this connection.
     *
     * @return true the first time a user id is recorded
     */
    public synchronized boolean recordUser(String userId, String userName) {
        boolean first = this.userId == null;
        if (first) {
            this.userId = userId;
        }
        if (userName != null) {
            this.userName = userName;
        }
        return first;
    }

    public void touch(Instant now) {
        this.lastSeen = now;
    }

    public void send(String payload) throws IOException {
        synchronized (socket) {
            if (socket.isOpen()) {
                socket.sendMessage(new TextMessage(payload));
            }
        }
    }

    public void ping() throws IOException {
        synchronized (socket) {
            if (socket.isOpen()) {
                socket.sendMessage(new PingMessage());
            }
        }
    }

    public void close(CloseStatus status) throws IOException {
        synchronized (socket) {
            if (socket.isOpen()) {
                socket.close(status);
            }
        }
    }

    public String getRoomName() {
        return roomName;
    }

    public Role getRole() {
        return role;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserName() {
        return userName;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }
}
