package com.infinitecanvas.canvasbackend.asset;

import com.infinitecanvas.canvasbackend.room.RoomNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Keeps assets under {@code <uploadsDir>/<roomName>/}.
 */
public class FileSystemAssetStore implements AssetStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemAssetStore.class);

    private final Path uploadsDir;

    public FileSystemAssetStore(Path uploadsDir) {
        this.uploadsDir = uploadsDir;
    }

    @Override
    public String store(String roomName, String originalName, String contentType, InputStream content) throws IOException {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new IllegalArgumentException("Only image uploads are accepted");
        }
        Path roomDir = roomDir(roomName);
        Files.createDirectories(roomDir);

        String filename = System.currentTimeMillis() + "-"
                + UUID.randomUUID().toString().substring(0, 8)
                + extension(originalName);
        Path target = roomDir.resolve(filename);
        long bytes = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Stored asset {} ({} bytes) for room '{}'", filename, bytes, roomName);
        return filename;
    }

    @Override
    public Optional<Path> resolve(String roomName, String filename) {
        if (!RoomNames.isValid(roomName) || filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        String safeName = sanitize(filename);
        Path roomDir = roomDir(roomName);
        Path file = roomDir.resolve(safeName).normalize();
        if (!file.startsWith(roomDir) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(file);
    }

    @Override
    public void deleteRoomAssets(String roomName) throws IOException {
        Path roomDir = roomDir(roomName);
        if (!Files.exists(roomDir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(roomDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
        log.info("Deleted asset directory of room '{}'", roomName);
    }

    private Path roomDir(String roomName) {
        return uploadsDir.resolve(RoomNames.requireValid(roomName)).normalize();
    }

    static String sanitize(String filename) {
        return filename.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String extension(String originalName) {
        if (originalName == null) {
            return "";
        }
        int dot = originalName.lastIndexOf('.');
        if (dot < 0 || dot == originalName.length() - 1) {
            return "";
        }
        String ext = sanitize(originalName.substring(dot).toLowerCase(Locale.ROOT));
        return ext.length() > 10 ? "" : ext;
    }
}
