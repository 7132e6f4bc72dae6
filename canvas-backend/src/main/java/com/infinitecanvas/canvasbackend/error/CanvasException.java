package com.infinitecanvas.canvasbackend.error;

public class CanvasException extends RuntimeException {

    private final CanvasErrorCode code;

    public CanvasException(CanvasErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CanvasException(CanvasErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public CanvasErrorCode getCode() {
        return code;
    }

    public static CanvasException invalidIdentifier(String roomName) {
        return new CanvasException(CanvasErrorCode.INVALID_IDENTIFIER,
                "Invalid room name: " + roomName);
    }

    public static CanvasException authenticationRejected() {
        return new CanvasException(CanvasErrorCode.AUTHENTICATION_REJECTED, "Invalid password");
    }

    public static CanvasException permissionDenied(String operation) {
        return new CanvasException(CanvasErrorCode.PERMISSION_DENIED,
                "Permission denied: read-only access cannot perform '" + operation + "'");
    }

    public static CanvasException notJoined() {
        return new CanvasException(CanvasErrorCode.NOT_JOINED, "Not joined to a room");
    }

    public static CanvasException alreadyJoined(String roomName) {
        return new CanvasException(CanvasErrorCode.ALREADY_JOINED,
                "Connection is already joined to room " + roomName);
    }

    public static CanvasException malformed(String message) {
        return new CanvasException(CanvasErrorCode.MALFORMED_MESSAGE, message);
    }

    public static CanvasException malformed(String message, Throwable cause) {
        return new CanvasException(CanvasErrorCode.MALFORMED_MESSAGE, message, cause);
    }
}
