package com.infinitecanvas.canvasbackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitecanvas.canvasbackend.asset.AssetStore;
import com.infinitecanvas.canvasbackend.asset.FileSystemAssetStore;
import com.infinitecanvas.canvasbackend.lifecycle.RoomRetentionService;
import com.infinitecanvas.canvasbackend.room.RoomStore;
import com.infinitecanvas.canvasbackend.session.HeartbeatMonitor;
import com.infinitecanvas.canvasbackend.session.SessionRegistry;
import com.infinitecanvas.canvasbackend.storage.FileRoomRepository;
import com.infinitecanvas.canvasbackend.storage.RoomRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

@Configuration
public class CanvasConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    @Bean
    public RoomRepository roomRepository(CanvasProperties properties, ObjectMapper objectMapper) {
        FileRoomRepository repository = new FileRoomRepository(properties.storage().dataPath(), objectMapper);
        repository.init();
        return repository;
    }

    @Bean
    public AssetStore assetStore(CanvasProperties properties) {
        return new FileSystemAssetStore(properties.storage().uploadsPath());
    }

    @Bean(destroyMethod = "stop")
    public HeartbeatMonitor heartbeatMonitor(SessionRegistry sessionRegistry, CanvasProperties properties) {
        HeartbeatMonitor monitor = new HeartbeatMonitor(sessionRegistry, properties.heartbeat().interval());
        monitor.start();
        return monitor;
    }

    @Bean(destroyMethod = "stop")
    public RoomRetentionService roomRetentionService(RoomRepository roomRepository,
                                                     RoomStore roomStore,
                                                     AssetStore assetStore,
                                                     SessionRegistry sessionRegistry,
                                                     Clock clock,
                                                     CanvasProperties properties) {
        RoomRetentionService service = new RoomRetentionService(
                roomRepository,
                roomStore,
                assetStore,
                sessionRegistry,
                clock,
                properties.retention().maxAge(),
                properties.retention().sweepInterval());
        service.start();
        return service;
    }
}
