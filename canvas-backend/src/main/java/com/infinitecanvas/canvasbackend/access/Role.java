package com.infinitecanvas.canvasbackend.access;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Write-permission tier resolved when a session joins a room.
 */
public enum Role {
    FULL_ACCESS("full-access"),
    READ_ONLY("read-only");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
