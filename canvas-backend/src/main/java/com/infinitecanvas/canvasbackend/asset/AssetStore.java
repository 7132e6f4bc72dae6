package com.infinitecanvas.canvasbackend.asset;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Binary assets (uploaded images) referenced by canvas elements, grouped per room.
 */
public interface AssetStore {

    /**
     * Stores an uploaded image under a fresh name.
     *
     * @return the stored file name, to be used as an element's {@code filename}
     * @throws IllegalArgumentException if the content is not an image
     */
    String store(String roomName, String originalName, String contentType, InputStream content) throws IOException;

    Optional<Path> resolve(String roomName, String filename);

    /**
     * Removes every asset of the room. A room without assets is not an error.
     */
    void deleteRoomAssets(String roomName) throws IOException;
}
