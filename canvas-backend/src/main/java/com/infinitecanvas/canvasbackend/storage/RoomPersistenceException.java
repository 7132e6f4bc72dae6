package com.infinitecanvas.canvasbackend.storage;

/**
 * Raised by a {@link RoomRepository} when the durable record cannot be read or written.
 */
public class RoomPersistenceException extends RuntimeException {

    public RoomPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
