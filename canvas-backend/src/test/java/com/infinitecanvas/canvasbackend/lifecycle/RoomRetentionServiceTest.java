package com.infinitecanvas.canvasbackend.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitecanvas.canvasbackend.CanvasTestSupport;
import com.infinitecanvas.canvasbackend.access.AccessControl;
import com.infinitecanvas.canvasbackend.access.Role;
import com.infinitecanvas.canvasbackend.asset.FileSystemAssetStore;
import com.infinitecanvas.canvasbackend.dispatch.MutationDispatcher;
import com.infinitecanvas.canvasbackend.dispatch.RoomBroadcaster;
import com.infinitecanvas.canvasbackend.event.CanvasEventDecoder;
import com.infinitecanvas.canvasbackend.lifecycle.RoomRetentionService.SweepReport;
import com.infinitecanvas.canvasbackend.room.Room;
import com.infinitecanvas.canvasbackend.room.RoomMutations;
import com.infinitecanvas.canvasbackend.room.RoomStore;
import com.infinitecanvas.canvasbackend.session.CanvasSession;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import com.infinitecanvas.canvasbackend.storage.FileRoomRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class RoomRetentionServiceTest {

    private static final Instant NOW = CanvasTestSupport.NOW;

    @TempDir
    Path root;

    private Path dataDir;
    private Path uploadsDir;
    private RoomStore roomStore;
    private SessionRegistry sessionRegistry;
    private RoomRetentionService service;

    @BeforeEach
    void setUp() throws Exception {
        dataDir = root.resolve("data");
        uploadsDir = root.resolve("uploads");
        ObjectMapper mapper = CanvasTestSupport.objectMapper();
        FileRoomRepository repository = new FileRoomRepository(dataDir, mapper);
        repository.init();
        roomStore = new RoomStore(repository, mapper, CanvasTestSupport.fixedClock());
        sessionRegistry = new SessionRegistry(CanvasTestSupport.fixedClock());
        service = new RoomRetentionService(repository, roomStore, new FileSystemAssetStore(uploadsDir),
                sessionRegistry, CanvasTestSupport.fixedClock(), Duration.ofDays(30), Duration.ofHours(24));
    }

    @Test
    void evictsRoomsIdleLongerThanRetention() throws Exception {
        writeRecord("stale-room", "\"lastModified\":\"" + NOW.minus(Duration.ofDays(31)) + "\"");
        writeRecord("fresh-room", "\"lastModified\":\"" + NOW.minus(Duration.ofDays(29)) + "\"");
        Files.createDirectories(uploadsDir.resolve("stale-room"));
        Files.writeString(uploadsDir.resolve("stale-room").resolve("pic.png"), "png");
        roomStore.load("stale-room");

        SweepReport report = service.sweep();

        assertThat(report.scanned()).isEqualTo(2);
        assertThat(report.evicted()).isEqualTo(1);
        assertThat(report.failed()).isZero();
        assertThat(report.startedAt()).isEqualTo(NOW);
        assertThat(dataDir.resolve("stale-room.json")).doesNotExist();
        assertThat(uploadsDir.resolve("stale-room")).doesNotExist();
        assertThat(roomStore.get("stale-room")).isEmpty();
        assertThat(dataDir.resolve("fresh-room.json")).exists();
    }

    @Test
    void legacyRecordFallsBackToCreationTimestamp() throws Exception {
        writeRecord("legacy-room", "\"timestamp\":\"" + NOW.minus(Duration.ofDays(40)) + "\"");

        SweepReport report = service.sweep();

        assertThat(report.evicted()).isEqualTo(1);
        assertThat(dataDir.resolve("legacy-room.json")).doesNotExist();
    }

    @Test
    void missingAssetDirectoryIsNotAnError() throws Exception {
        writeRecord("stale-room", "\"lastModified\":\"" + NOW.minus(Duration.ofDays(60)) + "\"");

        SweepReport report = service.sweep();

        assertThat(report.evicted()).isEqualTo(1);
        assertThat(report.failed()).isZero();
    }

    @Test
    void brokenRecordDoesNotStopTheSweep() throws Exception {
        Files.writeString(dataDir.resolve("broken-room.json"), "{ nope");
        writeRecord("stale-room", "\"lastModified\":\"" + NOW.minus(Duration.ofDays(31)) + "\"");

        SweepReport report = service.sweep();

        assertThat(report.scanned()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.evicted()).isEqualTo(1);
        assertThat(dataDir.resolve("broken-room.json")).exists();
    }

    @Test
    void roomWithLiveConnectionIsSkipped() throws Exception {
        writeRecord("busy-room", "\"lastModified\":\"" + NOW.minus(Duration.ofDays(90)) + "\"");
        WebSocketSession socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn("s1");
        sessionRegistry.register(socket).bind("busy-room", Role.FULL_ACCESS);

        SweepReport report = service.sweep();

        assertThat(report.skippedActive()).isEqualTo(1);
        assertThat(report.evicted()).isZero();
        assertThat(dataDir.resolve("busy-room.json")).exists();
    }

    @Test
    void joinRacingTheSweepLandsInAFreshRoom() throws Exception {
        Files.writeString(dataDir.resolve("stale-room.json"), "{\"elements\":[{\"id\":\"old\",\"layerId\":\"layer_0\"}],"
                + "\"lastModified\":\"" + NOW.minus(Duration.ofDays(31)) + "\"}");
        ObjectMapper mapper = CanvasTestSupport.objectMapper();
        FileRoomRepository repository = spy(new FileRoomRepository(dataDir, mapper));
        RoomStore store = new RoomStore(repository, mapper, CanvasTestSupport.fixedClock());
        MutationDispatcher dispatcher = new MutationDispatcher(
                new CanvasEventDecoder(mapper),
                store,
                new RoomMutations(mapper, CanvasTestSupport.validator()),
                new AccessControl(PasswordEncoderFactories.createDelegatingPasswordEncoder()),
                sessionRegistry,
                new RoomBroadcaster(sessionRegistry, mapper),
                CanvasTestSupport.fixedClock());
        RoomRetentionService racingService = new RoomRetentionService(repository, store,
                new FileSystemAssetStore(uploadsDir), sessionRegistry, CanvasTestSupport.fixedClock(),
                Duration.ofDays(30), Duration.ofHours(24));
        store.load("stale-room");

        List<String> inbox = Collections.synchronizedList(new ArrayList<>());
        WebSocketSession socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn("late");
        when(socket.isOpen()).thenReturn(true);
        doAnswer(inv -> {
            WebSocketMessage<?> message = inv.getArgument(0);
            if (message instanceof TextMessage text) {
                inbox.add(text.getPayload());
            }
            return null;
        }).when(socket).sendMessage(any());
        CanvasSession session = sessionRegistry.register(socket);
        Thread joiner = new Thread(() -> dispatcher.dispatch(session,
                "{\"type\":\"joinRoom\",\"data\":{\"roomName\":\"stale-room\"}}"));
        doAnswer(inv -> {
            joiner.start();
            joiner.join(200);
            return inv.callRealMethod();
        }).when(repository).delete("stale-room");

        SweepReport report = racingService.sweep();
        joiner.join(5000);

        assertThat(report.evicted()).isEqualTo(1);
        assertThat(session.isJoined()).isTrue();
        assertThat(mapper.readTree(inbox.get(0)).at("/data/elements")).isEmpty();

        dispatcher.dispatch(session, "{\"type\":\"add\",\"data\":{\"id\":\"e1\",\"layerId\":\"layer_0\"}}");

        Room current = store.get("stale-room").orElseThrow();
        assertThat(current.getElements()).extracting(e -> e.getId().key()).containsExactly("e1");
        assertThat(Files.readString(dataDir.resolve("stale-room.json"))).contains("e1").doesNotContain("old");
    }

    private void writeRecord(String roomName, String timeField) throws Exception {
        Files.writeString(dataDir.resolve(roomName + ".json"),
                "{\"elements\":[],\"layers\":[]," + timeField + "}");
    }
}
