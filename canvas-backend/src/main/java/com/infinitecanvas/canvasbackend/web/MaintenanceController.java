package com.infinitecanvas.canvasbackend.web;

import com.infinitecanvas.canvasbackend.lifecycle.RoomRetentionService;
import com.infinitecanvas.canvasbackend.lifecycle.RoomRetentionService.SweepReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/maintenance")
public class MaintenanceController {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceController.class);

    private final RoomRetentionService retentionService;

    public MaintenanceController(RoomRetentionService retentionService) {
        this.retentionService = retentionService;
    }

    /**
     * Runs a retention sweep now instead of waiting for the schedule.
     */
    @PostMapping("/sweep")
    public ResponseEntity<SweepReport> sweep() {
        log.info("On-demand retention sweep requested");
        return ResponseEntity.ok(retentionService.sweep());
    }
}
