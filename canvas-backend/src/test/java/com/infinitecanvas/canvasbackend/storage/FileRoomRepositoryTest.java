package com.infinitecanvas.canvasbackend.storage;

import com.infinitecanvas.canvasbackend.CanvasTestSupport;
import com.infinitecanvas.canvasbackend.room.Camera;
import com.infinitecanvas.canvasbackend.room.Layer;
import com.infinitecanvas.canvasbackend.room.RoomRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class FileRoomRepositoryTest {

    @TempDir
    Path dataDir;

    @Test
    void writesOneDocumentPerRoomAndListsValidNames() throws Exception {
        FileRoomRepository repository = new FileRoomRepository(dataDir, CanvasTestSupport.objectMapper());
        RoomRecord record = new RoomRecord(2, List.of(), List.of(Layer.defaultLayer()), Camera.origin(),
                null, null, false, CanvasTestSupport.NOW, CanvasTestSupport.NOW);

        repository.write("calm-zone-3", record);
        Files.writeString(dataDir.resolve("not a room.json"), "{}");
        Files.writeString(dataDir.resolve("notes.txt"), "ignored");

        Assertions.assertTrue(Files.isRegularFile(dataDir.resolve("calm-zone-3.json")));
        Assertions.assertFalse(Files.exists(dataDir.resolve("calm-zone-3.json.tmp")));
        Assertions.assertEquals(List.of("calm-zone-3"), repository.listRoomNames());
        Assertions.assertTrue(repository.exists("calm-zone-3"));

        String stored = repository.read("calm-zone-3").orElseThrow().toString();
        Assertions.assertTrue(stored.contains("\"isPasswordProtected\":false"));
        Assertions.assertFalse(stored.contains("fullAccessPassword"));
        Assertions.assertTrue(stored.contains("\"lastModified\":\"2024-05-01T12:00:00Z\""));

        Assertions.assertTrue(repository.delete("calm-zone-3"));
        Assertions.assertFalse(repository.delete("calm-zone-3"));
        Assertions.assertTrue(repository.read("calm-zone-3").isEmpty());
    }
}
