package com.infinitecanvas.canvasbackend.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.room.RoomRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for room records, keyed by room name.
 *
 * {@link #read} hands back the raw stored document so that older record shapes can be
 * migrated before binding. Failures surface as {@link RoomPersistenceException}.
 */
public interface RoomRepository {

    Optional<ObjectNode> read(String roomName);

    void write(String roomName, RoomRecord record);

    boolean exists(String roomName);

    /**
     * @return true if a record was removed
     */
    boolean delete(String roomName);

    List<String> listRoomNames();
}
