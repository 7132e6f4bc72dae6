package com.infinitecanvas.canvasbackend.web;

import com.infinitecanvas.canvasbackend.room.Room;
import com.infinitecanvas.canvasbackend.room.RoomStore;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import com.infinitecanvas.canvasbackend.web.dto.StatusResponse;
import com.infinitecanvas.canvasbackend.web.dto.StatusResponse.RoomStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Runtime status. Reads memory only; never loads a room from storage.
 */
@RestController
@RequestMapping("/api/status")
public class StatusController {
    private final RoomStore roomStore;
    private final SessionRegistry sessionRegistry;
    private final Clock clock;

    public StatusController(RoomStore roomStore, SessionRegistry sessionRegistry, Clock clock) {
        this.roomStore = roomStore;
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<?> status(@RequestParam(name = "room", required = false) String roomName) {
        RoomStatus roomStatus = null;
        if (roomName != null) {
            Room room = roomStore.get(roomName).orElse(null);
            if (room == null) {
                return ResponseEntity.status(404).body(ApiExceptionHandler.errorBody("Room not loaded: " + roomName));
            }
            synchronized (room) {
                roomStatus = new RoomStatus(
                        roomName,
                        room.getElements().size(),
                        room.getLayers().size(),
                        sessionRegistry.presenceCount(roomName),
                        sessionRegistry.sessionsInRoom(roomName).size(),
                        room.isProtectionEnabled(),
                        room.getLastModified());
            }
        }
        return ResponseEntity.ok(new StatusResponse(
                "running",
                clock.instant(),
                sessionRegistry.connectionCount(),
                roomStore.loadedRoomNames().size(),
                roomStatus));
    }
}
