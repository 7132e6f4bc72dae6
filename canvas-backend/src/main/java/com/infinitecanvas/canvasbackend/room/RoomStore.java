package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.storage.RoomPersistenceException;
import com.infinitecanvas.canvasbackend.storage.RoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Cache of loaded rooms backed by a {@link RoomRepository}.
 * A room stays in memory until the retention sweep evicts it.
 */
@Component
public class RoomStore {
    private static final Logger log = LoggerFactory.getLogger(RoomStore.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final RoomRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RoomStore(RoomRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Returns the cached room, loading or creating it on first access.
     *
     * @throws com.infinitecanvas.canvasbackend.error.CanvasException if the name is not a valid room identifier
     * @throws RoomPersistenceException if a stored record exists but cannot be read
     */
    public Room load(String roomName) {
        RoomNames.requireValid(roomName);
        return rooms.computeIfAbsent(roomName, this::readOrCreate);
    }

    public Optional<Room> get(String roomName) {
        return Optional.ofNullable(rooms.get(roomName));
    }

    /**
     * Writes the in-memory room to storage. Failures are logged; memory stays authoritative.
     */
    public void persist(String roomName) {
        Room room = rooms.get(roomName);
        if (room == null) {
            return;
        }
        synchronized (room) {
            room.setLastModified(clock.instant());
            try {
                repository.write(roomName, room.toRecord());
                log.trace("Persisted room '{}' ({} elements)", roomName, room.getElements().size());
            } catch (RoomPersistenceException e) {
                log.error("Failed to persist room '{}'", roomName, e);
            }
        }
    }

    public boolean exists(String roomName) {
        return RoomNames.isValid(roomName) && (rooms.containsKey(roomName) || repository.exists(roomName));
    }

    /**
     * Drops the room from memory after running {@code cleanup}, unless {@code inUse}
     * holds. Both run under the room's monitor when it is loaded; a concurrent
     * {@link #load} of the same name either waits for the outcome or finds the old
     * instance retired.
     *
     * @return true if the room was discarded
     * @throws IOException if the cleanup failed; the room then stays loaded
     */
    public boolean discard(String roomName, BooleanSupplier inUse, StorageCleanup cleanup) throws IOException {
        boolean[] discarded = new boolean[1];
        try {
            rooms.compute(roomName, (name, room) -> {
                if (room == null) {
                    discarded[0] = cleanUnlessInUse(inUse, cleanup);
                    return null;
                }
                synchronized (room) {
                    if (!cleanUnlessInUse(inUse, cleanup)) {
                        return room;
                    }
                    room.retire();
                    discarded[0] = true;
                    log.info("Room '{}' dropped from memory", name);
                    return null;
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return discarded[0];
    }

    public Set<String> loadedRoomNames() {
        return Set.copyOf(rooms.keySet());
    }

    public List<String> storedRoomNames() {
        return repository.listRoomNames();
    }

    private static boolean cleanUnlessInUse(BooleanSupplier inUse, StorageCleanup cleanup) {
        if (inUse.getAsBoolean()) {
            return false;
        }
        try {
            cleanup.run();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return true;
    }

    private Room readOrCreate(String roomName) {
        Instant now = clock.instant();
        Optional<ObjectNode> stored = repository.read(roomName);
        if (stored.isEmpty()) {
            log.info("Creating new room '{}'", roomName);
            return Room.create(roomName, now);
        }
        ObjectNode migrated = RoomRecordMigrator.migrate(stored.get(), now);
        try {
            RoomRecord record = objectMapper.treeToValue(migrated, RoomRecord.class);
            Room room = Room.fromRecord(roomName, record);
            log.info("Loaded room '{}' ({} elements, {} layers)",
                    roomName, room.getElements().size(), room.getLayers().size());
            return room;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RoomPersistenceException("Room record for '" + roomName + "' is corrupt", e);
        }
    }

    /**
     * Removal of whatever a room owns outside the cache.
     */
    @FunctionalInterface
    public interface StorageCleanup {
        void run() throws IOException;
    }
}
