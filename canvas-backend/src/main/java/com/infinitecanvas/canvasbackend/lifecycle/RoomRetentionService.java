package com.infinitecanvas.canvasbackend.lifecycle;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.asset.AssetStore;
import com.infinitecanvas.canvasbackend.room.RoomRecordMigrator;
import com.infinitecanvas.canvasbackend.room.RoomStore;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import com.infinitecanvas.canvasbackend.storage.RoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reclaims rooms nobody has touched for longer than the retention period:
 * the stored record, the asset directory and the cached copy.
 */
public class RoomRetentionService {
    private static final Logger log = LoggerFactory.getLogger(RoomRetentionService.class);

    private final RoomRepository repository;
    private final RoomStore roomStore;
    private final AssetStore assetStore;
    private final SessionRegistry sessionRegistry;
    private final Clock clock;
    private final Duration maxAge;
    private final Duration sweepInterval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "canvas-retention-sweep");
        t.setDaemon(true);
        return t;
    });

    public RoomRetentionService(RoomRepository repository,
                                RoomStore roomStore,
                                AssetStore assetStore,
                                SessionRegistry sessionRegistry,
                                Clock clock,
                                Duration maxAge,
                                Duration sweepInterval) {
        this.repository = repository;
        this.roomStore = roomStore;
        this.assetStore = assetStore;
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
        this.maxAge = maxAge;
        this.sweepInterval = sweepInterval;
    }

    public void start() {
        long millis = sweepInterval.toMillis();
        // first run right after startup, then at a fixed rate
        scheduler.scheduleAtFixedRate(this::scheduledSweep, 0, millis, TimeUnit.MILLISECONDS);
        log.info("Room retention scheduled every {} (max age {})", sweepInterval, maxAge);
    }

    public void stop() {
        scheduler.shutdownNow();
        log.info("Room retention stopped");
    }

    public synchronized SweepReport sweep() {
        Instant startedAt = clock.instant();
        Instant cutoff = startedAt.minus(maxAge);
        List<String> names = repository.listRoomNames();
        int evicted = 0;
        int failed = 0;
        int skippedActive = 0;

        for (String roomName : names) {
            try {
                Optional<ObjectNode> raw = repository.read(roomName);
                if (raw.isEmpty()) {
                    continue;
                }
                Optional<Instant> lastActivity = RoomRecordMigrator.lastActivity(raw.get());
                if (lastActivity.isEmpty() || !lastActivity.get().isBefore(cutoff)) {
                    continue;
                }
                if (evict(roomName, lastActivity.get())) {
                    evicted++;
                } else {
                    log.info("Room '{}' is past retention but has live connections, skipping", roomName);
                    skippedActive++;
                }
            } catch (IOException | RuntimeException e) {
                log.error("Retention sweep failed for room '{}'", roomName, e);
                failed++;
            }
        }

        SweepReport report = new SweepReport(startedAt, names.size(), evicted, failed, skippedActive);
        log.info("Retention sweep finished: scanned={}, evicted={}, failed={}, skippedActive={}",
                report.scanned(), report.evicted(), report.failed(), report.skippedActive());
        return report;
    }

    /**
     * The live-connection check and the deletion happen under the room's lock, so a
     * join racing the sweep either keeps the room alive or lands in a fresh one.
     */
    private boolean evict(String roomName, Instant lastActivity) throws IOException {
        boolean evicted = roomStore.discard(roomName,
                () -> sessionRegistry.hasSessionsInRoom(roomName),
                () -> {
                    repository.delete(roomName);
                    assetStore.deleteRoomAssets(roomName);
                });
        if (evicted) {
            log.info("Evicted room '{}' (last activity {})", roomName, lastActivity);
        }
        return evicted;
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Scheduled retention sweep failed", e);
        }
    }

    public record SweepReport(Instant startedAt, int scanned, int evicted, int failed, int skippedActive) {
    }
}
