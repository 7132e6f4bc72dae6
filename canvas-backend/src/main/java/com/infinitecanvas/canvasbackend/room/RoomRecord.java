package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Durable shape of a room, one record per room name. Credentials are stored in
 * encoded form ({@code {bcrypt}...}, or {@code {noop}...} for migrated legacy values).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomRecord(
        int schemaVersion,
        List<Element> elements,
        List<Layer> layers,
        Camera camera,
        String fullAccessPassword,
        String readOnlyPassword,
        @JsonProperty("isPasswordProtected") boolean passwordProtected,
        Instant timestamp,
        Instant lastModified
) {
}
