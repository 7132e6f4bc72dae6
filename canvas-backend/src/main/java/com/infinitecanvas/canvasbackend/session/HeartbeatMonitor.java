package com.infinitecanvas.canvasbackend.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pings every open connection at a fixed interval. Silence is reported, never acted on.
 */
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final SessionRegistry sessionRegistry;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "canvas-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public HeartbeatMonitor(SessionRegistry sessionRegistry, Duration interval) {
        this.sessionRegistry = sessionRegistry;
        this.interval = interval;
    }

    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::probe, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Heartbeat started (interval={})", interval);
    }

    public void stop() {
        scheduler.shutdownNow();
        log.info("Heartbeat stopped");
    }

    /**
     * One heartbeat round.
     *
     * @return number of sessions that stayed silent for longer than two intervals
     */
    public int probe() {
        List<CanvasSession> silent = sessionRegistry.silentSessions(interval.multipliedBy(2));
        if (!silent.isEmpty()) {
            log.info("{} of {} connections silent for more than {}",
                    silent.size(), sessionRegistry.connectionCount(), interval.multipliedBy(2));
        }
        for (CanvasSession session : sessionRegistry.allSessions()) {
            try {
                session.ping();
            } catch (IOException | RuntimeException e) {
                log.debug("Ping to {} failed: {}", session.getId(), e.getMessage());
            }
        }
        return silent.size();
    }
}
