package com.infinitecanvas.canvasbackend.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Server status as seen from memory; {@code room} is present only when a loaded room was asked for.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        String status,
        Instant timestamp,
        int connectedClients,
        int loadedRooms,
        RoomStatus room
) {

    public record RoomStatus(
            String roomName,
            int elements,
            int layers,
            int users,
            int connections,
            @JsonProperty("isPasswordProtected") boolean passwordProtected,
            Instant lastModified
    ) {}
}
