package com.infinitecanvas.canvasbackend.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections and, per room, the directory of users announced through {@code userInfo}.
 */
@Component
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    // socket id -> session
    private final ConcurrentHashMap<String, CanvasSession> sessions = new ConcurrentHashMap<>();
    // room -> userId -> presence
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, PresenceEntry>> presence = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public CanvasSession register(WebSocketSession socket) {
        CanvasSession session = new CanvasSession(socket, clock.instant());
        sessions.put(socket.getId(), session);
        log.debug("Registered connection {} (total={})", socket.getId(), sessions.size());
        return session;
    }

    public Optional<CanvasSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<CanvasSession> unregister(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public List<CanvasSession> sessionsInRoom(String roomName) {
        return sessions.values().stream()
                .filter(s -> roomName.equals(s.getRoomName()))
                .toList();
    }

    public List<CanvasSession> allSessions() {
        return List.copyOf(sessions.values());
    }

    public boolean hasSessionsInRoom(String roomName) {
        return sessions.values().stream().anyMatch(s -> roomName.equals(s.getRoomName()));
    }

    public int connectionCount() {
        return sessions.size();
    }

    /**
     * @return users present in the room after the upsert
     */
    public int upsertPresence(String roomName, String userId, String userName) {
        Map<String, PresenceEntry> users = presence.computeIfAbsent(roomName, r -> new ConcurrentHashMap<>());
        users.put(userId, new PresenceEntry(userName, clock.instant()));
        return users.size();
    }

    /**
     * @return the removed entry, if the user was present
     */
    public Optional<PresenceEntry> removePresence(String roomName, String userId) {
        PresenceEntry[] removed = new PresenceEntry[1];
        presence.computeIfPresent(roomName, (room, users) -> {
            removed[0] = users.remove(userId);
            return users.isEmpty() ? null : users;
        });
        return Optional.ofNullable(removed[0]);
    }

    public int presenceCount(String roomName) {
        Map<String, PresenceEntry> users = presence.get(roomName);
        return users == null ? 0 : users.size();
    }

    /**
     * Open sessions with no inbound traffic or pong within {@code threshold}.
     */
    public List<CanvasSession> silentSessions(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        return sessions.values().stream()
                .filter(CanvasSession::isOpen)
                .filter(s -> s.getLastSeen().isBefore(cutoff))
                .toList();
    }

    public record PresenceEntry(String userName, Instant lastSeen) {
    }
}
