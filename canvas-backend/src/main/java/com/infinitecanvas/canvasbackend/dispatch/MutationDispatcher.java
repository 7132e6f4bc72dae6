package com.infinitecanvas.canvasbackend.dispatch;

import com.infinitecanvas.canvasbackend.access.AccessControl;
import com.infinitecanvas.canvasbackend.access.Role;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.CanvasEvent;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.JoinRoom;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UserInfo;
import com.infinitecanvas.canvasbackend.event.CanvasEventDecoder;
import com.infinitecanvas.canvasbackend.event.EventKind;
import com.infinitecanvas.canvasbackend.event.ServerMessage;
import com.infinitecanvas.canvasbackend.event.ServerMessage.RoomSnapshot;
import com.infinitecanvas.canvasbackend.room.Room;
import com.infinitecanvas.canvasbackend.room.RoomMutations;
import com.infinitecanvas.canvasbackend.room.RoomNames;
import com.infinitecanvas.canvasbackend.room.RoomStore;
import com.infinitecanvas.canvasbackend.session.CanvasSession;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import com.infinitecanvas.canvasbackend.session.SessionRegistry.PresenceEntry;
import com.infinitecanvas.canvasbackend.storage.RoomPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Per-frame pipeline: decode, join or authorize, apply, persist, relay.
 *
 * Everything that touches a room happens under that room's monitor, so the events of
 * one room are applied and relayed in the order they were accepted. Rooms do not
 * block each other.
 */
@Component
public class MutationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MutationDispatcher.class);
    private static final String UNKNOWN_USER = "Unknown";

    private final CanvasEventDecoder decoder;
    private final RoomStore roomStore;
    private final RoomMutations mutations;
    private final AccessControl accessControl;
    private final SessionRegistry sessionRegistry;
    private final RoomBroadcaster broadcaster;
    private final Clock clock;

    public MutationDispatcher(CanvasEventDecoder decoder,
                              RoomStore roomStore,
                              RoomMutations mutations,
                              AccessControl accessControl,
                              SessionRegistry sessionRegistry,
                              RoomBroadcaster broadcaster,
                              Clock clock) {
        this.decoder = decoder;
        this.roomStore = roomStore;
        this.mutations = mutations;
        this.accessControl = accessControl;
        this.sessionRegistry = sessionRegistry;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    public void dispatch(CanvasSession session, String payload) {
        session.touch(clock.instant());
        try {
            CanvasEvent event = decoder.decode(payload);
            if (event instanceof JoinRoom join) {
                join(session, join);
            } else {
                apply(session, event, payload);
            }
        } catch (CanvasException e) {
            reject(session, e);
        } catch (RoomPersistenceException e) {
            log.error("Room storage unavailable for connection {}", session.getId(), e);
            closeQuietly(session, CloseStatus.SERVER_ERROR);
        } catch (RuntimeException e) {
            log.error("Dropped frame from {} after an unexpected failure", session.getId(), e);
        }
    }

    /**
     * Removes the session and tells the rest of its room that the user left.
     * Mutations already accepted from this session stay applied.
     */
    public void disconnect(CanvasSession session) {
        sessionRegistry.unregister(session.getId());
        String roomName = session.getRoomName();
        String userId = session.getUserId();
        if (roomName == null) {
            return;
        }
        log.info("Connection {} left room '{}' (user={})", session.getId(), roomName, userId);
        if (userId == null) {
            return;
        }
        Optional<Room> loaded = roomStore.get(roomName);
        if (loaded.isPresent()) {
            synchronized (loaded.get()) {
                announceLeave(session, roomName, userId);
            }
        } else {
            announceLeave(session, roomName, userId);
        }
    }

    private void announceLeave(CanvasSession session, String roomName, String userId) {
        String userName = sessionRegistry.removePresence(roomName, userId)
                .map(PresenceEntry::userName)
                .orElse(session.getUserName());
        broadcaster.broadcast(
                ServerMessage.userLeft(userId, userName != null ? userName : UNKNOWN_USER,
                        sessionRegistry.presenceCount(roomName)),
                session, roomName);
    }

    private void join(CanvasSession session, JoinRoom join) {
        String roomName = RoomNames.requireValid(join.roomName());
        if (session.isJoined()) {
            throw CanvasException.alreadyJoined(session.getRoomName());
        }
        inRoom(roomName, room -> {
            room.ensureLayers();
            Role role = accessControl.resolveRole(room, join.password());
            session.bind(roomName, role);
            RoomSnapshot snapshot = RoomSnapshot.of(room, role, sessionRegistry.presenceCount(roomName));
            broadcaster.sendTo(session, ServerMessage.init(snapshot));
            log.info("Connection {} joined room '{}' as {} ({} elements)",
                    session.getId(), roomName, role.wireName(), room.getElements().size());
        });
    }

    private void apply(CanvasSession session, CanvasEvent event, String payload) {
        if (!session.isJoined()) {
            throw CanvasException.notJoined();
        }
        String roomName = session.getRoomName();
        EventKind kind = event.kind();
        inRoom(roomName, room -> {
            room.ensureLayers();
            if (!accessControl.authorize(session.getRole(), kind)) {
                throw CanvasException.permissionDenied(wireName(event));
            }
            if (event instanceof UserInfo userInfo) {
                announce(session, userInfo, roomName);
            }
            mutations.apply(room, event, clock.instant());
            if (kind.isPersistent()) {
                roomStore.persist(roomName);
            }
            broadcaster.broadcast(payload, session, roomName);
        });
        log.debug("Applied {} from {} in room '{}'", wireName(event), session.getId(), roomName);
    }

    /**
     * Runs the action under the monitor of the cached room, loading it again if the
     * instance was retired by the retention sweep while this thread waited for it.
     */
    private void inRoom(String roomName, Consumer<Room> action) {
        while (true) {
            Room room = roomStore.load(roomName);
            synchronized (room) {
                if (!room.isRetired()) {
                    action.accept(room);
                    return;
                }
            }
            log.debug("Room '{}' was evicted while waiting, loading it again", roomName);
        }
    }

    private void announce(CanvasSession session, UserInfo userInfo, String roomName) {
        boolean first = session.recordUser(userInfo.userId(), userInfo.userName());
        int count = sessionRegistry.upsertPresence(roomName, session.getUserId(), session.getUserName());
        if (first) {
            broadcaster.broadcast(
                    ServerMessage.userJoined(session.getUserId(), session.getUserName(), count),
                    session, roomName);
        }
    }

    private void reject(CanvasSession session, CanvasException e) {
        if (e.getCode().isUserVisible()) {
            log.warn("Rejected frame from {}: {} ({})", session.getId(), e.getMessage(), e.getCode());
            broadcaster.sendError(session, e);
        } else {
            log.warn("Dropped frame from {}: {}", session.getId(), e.getMessage());
        }
    }

    private void closeQuietly(CanvasSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", session.getId(), e.getMessage());
        }
    }

    private static String wireName(CanvasEvent event) {
        if (event instanceof CanvasEvent.UnknownEvent unknown) {
            return unknown.type();
        }
        return event.kind().wireName();
    }
}
