package com.infinitecanvas.canvasbackend.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.room.RoomNames;
import com.infinitecanvas.canvasbackend.room.RoomRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One pretty-printed JSON document per room: {@code <dataDir>/<roomName>.json}.
 * Writes go to a temp file first and are moved into place.
 */
public class FileRoomRepository implements RoomRepository {
    private static final Logger log = LoggerFactory.getLogger(FileRoomRepository.class);
    private static final String SUFFIX = ".json";

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public FileRoomRepository(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper;
    }

    public void init() {
        try {
            Files.createDirectories(dataDir);
            log.info("Room records stored in {}", dataDir.toAbsolutePath());
        } catch (IOException e) {
            throw new RoomPersistenceException("Cannot create data directory " + dataDir, e);
        }
    }

    @Override
    public Optional<ObjectNode> read(String roomName) {
        Path file = fileFor(roomName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            if (node == null || !node.isObject()) {
                throw new RoomPersistenceException("Room record " + file + " is not a JSON object", null);
            }
            return Optional.of((ObjectNode) node);
        } catch (IOException e) {
            throw new RoomPersistenceException("Cannot read room record " + file, e);
        }
    }

    @Override
    public void write(String roomName, RoomRecord record) {
        Path file = fileFor(roomName);
        Path temp = dataDir.resolve(roomName + SUFFIX + ".tmp");
        try {
            Files.createDirectories(dataDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), record);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RoomPersistenceException("Cannot write room record " + file, e);
        }
    }

    @Override
    public boolean exists(String roomName) {
        return Files.isRegularFile(fileFor(roomName));
    }

    @Override
    public boolean delete(String roomName) {
        try {
            return Files.deleteIfExists(fileFor(roomName));
        } catch (IOException e) {
            throw new RoomPersistenceException("Cannot delete room record for " + roomName, e);
        }
    }

    @Override
    public List<String> listRoomNames() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(dataDir)) {
            files.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .filter(RoomNames::isValid)
                    .sorted()
                    .forEach(names::add);
        } catch (IOException e) {
            throw new RoomPersistenceException("Cannot list " + dataDir, e);
        }
        return names;
    }

    private Path fileFor(String roomName) {
        return dataDir.resolve(RoomNames.requireValid(roomName) + SUFFIX);
    }
}
