package com.infinitecanvas.canvasbackend.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infinitecanvas.canvasbackend.access.Role;
import com.infinitecanvas.canvasbackend.error.CanvasErrorCode;
import com.infinitecanvas.canvasbackend.room.Camera;
import com.infinitecanvas.canvasbackend.room.Element;
import com.infinitecanvas.canvasbackend.room.Layer;
import com.infinitecanvas.canvasbackend.room.Room;

import java.time.Instant;
import java.util.List;

/**
 * Server-originated envelope, same {@code {type, data}} shape as client messages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(String type, Object data) {

    public static ServerMessage init(RoomSnapshot snapshot) {
        return new ServerMessage("init", snapshot);
    }

    public static ServerMessage error(CanvasErrorCode code, String message) {
        return new ServerMessage("error", new ErrorData(code.name(), message));
    }

    public static ServerMessage userJoined(String userId, String userName, int userCount) {
        return new ServerMessage("userJoined", new PresenceChange(userId, userName, userCount));
    }

    public static ServerMessage userLeft(String userId, String userName, int userCount) {
        return new ServerMessage("userLeft", new PresenceChange(userId, userName, userCount));
    }

    public record ErrorData(String code, String message) {
    }

    public record PresenceChange(String userId, String userName, int userCount) {
    }

    /**
     * State handed to a session right after it joins. Credentials are never part of it.
     */
    public record RoomSnapshot(
            String roomName,
            List<Element> elements,
            List<Layer> layers,
            Camera camera,
            @JsonProperty("isPasswordProtected") boolean passwordProtected,
            Role role,
            Instant timestamp,
            int userCount
    ) {
        public static RoomSnapshot of(Room room, Role role, int userCount) {
            return new RoomSnapshot(
                    room.getName(),
                    List.copyOf(room.getElements()),
                    List.copyOf(room.getLayers()),
                    room.getCamera(),
                    room.isProtectionEnabled(),
                    role,
                    room.getTimestamp(),
                    userCount);
        }
    }
}
