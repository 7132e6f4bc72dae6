package com.infinitecanvas.canvasbackend.web;

import com.infinitecanvas.canvasbackend.asset.AssetStore;
import com.infinitecanvas.canvasbackend.config.CanvasProperties;
import com.infinitecanvas.canvasbackend.room.RoomNames;
import com.infinitecanvas.canvasbackend.web.dto.UploadResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Image upload for canvas elements and serving of the stored files.
 */
@RestController
@RequestMapping("/api")
public class UploadController {
    private static final Logger log = LoggerFactory.getLogger(UploadController.class);

    private final AssetStore assetStore;
    private final CanvasProperties properties;

    public UploadController(AssetStore assetStore, CanvasProperties properties) {
        this.assetStore = assetStore;
        this.properties = properties;
    }

    @PostMapping(value = "/upload/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadImage(@RequestParam("image") MultipartFile image,
                                         @RequestParam("roomName") String roomName) {
        RoomNames.requireValid(roomName);
        if (image.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiExceptionHandler.errorBody("No image uploaded"));
        }
        if (image.getSize() > properties.upload().maxBytes()) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(ApiExceptionHandler.errorBody("Image exceeds " + properties.upload().maxBytes() + " bytes"));
        }

        try (InputStream content = image.getInputStream()) {
            String filename = assetStore.store(roomName, image.getOriginalFilename(), image.getContentType(), content);
            return ResponseEntity.ok(new UploadResponse(filename, image.getOriginalFilename()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiExceptionHandler.errorBody(e.getMessage()));
        } catch (IOException e) {
            log.error("Failed to store upload for room '{}'", roomName, e);
            return ResponseEntity.internalServerError().body(ApiExceptionHandler.errorBody("Failed to store image"));
        }
    }

    @GetMapping("/uploads/{roomName}/{filename}")
    public ResponseEntity<Resource> serve(@PathVariable String roomName, @PathVariable String filename) {
        Optional<Path> file = assetStore.resolve(roomName, filename);
        if (file.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Path path = file.get();
        String contentType = null;
        try {
            contentType = Files.probeContentType(path);
        } catch (IOException e) {
            log.debug("Cannot probe content type of {}: {}", path, e.getMessage());
        }
        if (contentType == null) {
            contentType = MediaType.APPLICATION_OCTET_STREAM_VALUE;
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(contentType))
                .header(HttpHeaders.CACHE_CONTROL, "public, max-age=86400")
                .body(new FileSystemResource(path));
    }
}
