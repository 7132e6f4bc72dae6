package com.infinitecanvas.canvasbackend.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe listing the endpoints a canvas client talks to.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "services", Map.of(
                        "canvas-sync", "/ws/canvas",
                        "room-api", "/api/room",
                        "uploads", "/api/uploads")));
    }
}
