package com.infinitecanvas.canvasbackend.web;

import com.infinitecanvas.canvasbackend.access.AccessControl;
import com.infinitecanvas.canvasbackend.room.Room;
import com.infinitecanvas.canvasbackend.room.RoomNames;
import com.infinitecanvas.canvasbackend.room.RoomStore;
import com.infinitecanvas.canvasbackend.web.dto.PasswordUpdateRequest;
import com.infinitecanvas.canvasbackend.web.dto.PasswordUpdateResponse;
import com.infinitecanvas.canvasbackend.web.dto.RoomCheckResponse;
import com.infinitecanvas.canvasbackend.web.dto.RoomNameResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.SecureRandom;
import java.util.Map;
import java.util.Random;

/**
 * Room discovery and room protection settings.
 */
@RestController
@RequestMapping("/api/room")
public class RoomController {
    private static final Logger log = LoggerFactory.getLogger(RoomController.class);
    private static final int MAX_GENERATE_ATTEMPTS = 20;

    private final RoomStore roomStore;
    private final AccessControl accessControl;
    private final Random random = new SecureRandom();

    public RoomController(RoomStore roomStore, AccessControl accessControl) {
        this.roomStore = roomStore;
        this.accessControl = accessControl;
    }

    /**
     * Suggest a room name that is not taken yet.
     */
    @GetMapping("/generate")
    public ResponseEntity<?> generate() {
        for (int attempt = 0; attempt < MAX_GENERATE_ATTEMPTS; attempt++) {
            String candidate = RoomNames.generate(random);
            if (!roomStore.exists(candidate)) {
                return ResponseEntity.ok(new RoomNameResponse(candidate));
            }
        }
        log.warn("No free room name found after {} attempts", MAX_GENERATE_ATTEMPTS);
        return ResponseEntity.internalServerError()
                .body(ApiExceptionHandler.errorBody("Could not generate a free room name"));
    }

    @GetMapping("/{roomName}/check")
    public RoomCheckResponse check(@PathVariable String roomName) {
        RoomNames.requireValid(roomName);
        if (!roomStore.exists(roomName)) {
            return new RoomCheckResponse(roomName, false, false);
        }
        Room room = roomStore.load(roomName);
        synchronized (room) {
            return new RoomCheckResponse(roomName, true, room.isProtectionEnabled());
        }
    }

    /**
     * Set, change or remove the room's passwords. An empty {@code password} removes
     * protection. Once a room is protected, every change, removal included, must carry
     * the current full-access password as {@code currentPassword}; otherwise the reply
     * is 403 with {@code {error, message, code}}.
     */
    @PostMapping("/{roomName}/password")
    public PasswordUpdateResponse updatePassword(@PathVariable String roomName,
                                                 @Valid @RequestBody PasswordUpdateRequest request) {
        Room room = roomStore.load(roomName);
        boolean passwordProtected;
        synchronized (room) {
            accessControl.updateCredentials(room, request.getCurrentPassword(),
                    request.getPassword(), request.getReadOnlyPassword());
            passwordProtected = room.isProtectionEnabled();
            roomStore.persist(roomName);
        }
        return new PasswordUpdateResponse(roomName, passwordProtected);
    }
}
