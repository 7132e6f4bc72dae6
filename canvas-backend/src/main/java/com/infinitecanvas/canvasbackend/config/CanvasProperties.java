package com.infinitecanvas.canvasbackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for the canvas server, bound from the {@code canvas.*} keys.
 */
@ConfigurationProperties(prefix = "canvas")
public record CanvasProperties(
        @DefaultValue Storage storage,
        @DefaultValue Retention retention,
        @DefaultValue Heartbeat heartbeat,
        @DefaultValue Upload upload,
        @DefaultValue Cors cors
) {

    /**
     * Where room records and room assets live on disk.
     */
    public record Storage(
            @DefaultValue("data") String dataDir,
            @DefaultValue("data/uploads") String uploadsDir
    ) {

        public Path dataPath() {
            return Path.of(dataDir);
        }

        public Path uploadsPath() {
            return Path.of(uploadsDir);
        }
    }

    /**
     * Rooms untouched for longer than {@code maxAge} are evicted by the sweep.
     */
    public record Retention(
            @DefaultValue("30d") Duration maxAge,
            @DefaultValue("24h") Duration sweepInterval
    ) {
    }

    public record Heartbeat(
            @DefaultValue("30s") Duration interval
    ) {
    }

    public record Upload(
            @DefaultValue("10485760") long maxBytes
    ) {
    }

    /**
     * Allowed origin patterns, in the syntax accepted by
     * {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}.
     */
    public record Cors(
            @DefaultValue({"http://localhost:*", "http://127.0.0.1:*"}) List<String> allowedOrigins
    ) {
    }
}
