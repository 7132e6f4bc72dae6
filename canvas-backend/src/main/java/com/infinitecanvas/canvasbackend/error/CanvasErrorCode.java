package com.infinitecanvas.canvasbackend.error;

/**
 * Failure categories of the synchronization engine.
 * Only the user-visible ones are ever sent back to a client.
 */
public enum CanvasErrorCode {
    INVALID_IDENTIFIER(true),
    AUTHENTICATION_REJECTED(true),
    PERMISSION_DENIED(true),
    NOT_JOINED(true),
    ALREADY_JOINED(true),
    PERSISTENCE_FAILURE(false),
    MALFORMED_MESSAGE(false);

    private final boolean userVisible;

    CanvasErrorCode(boolean userVisible) {
        this.userVisible = userVisible;
    }

    public boolean isUserVisible() {
        return userVisible;
    }
}
