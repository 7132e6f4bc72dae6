package com.infinitecanvas.canvasbackend.config;

import com.infinitecanvas.canvasbackend.websocket.CanvasWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the canvas synchronization endpoint.
 *
 * Clients connect with {@code ws://host:port/ws/canvas} and send a
 * {@code joinRoom} envelope before any room-scoped message.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CanvasWebSocketHandler canvasWebSocketHandler;
    private final CanvasProperties properties;

    public WebSocketConfig(CanvasWebSocketHandler canvasWebSocketHandler, CanvasProperties properties) {
        this.canvasWebSocketHandler = canvasWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(canvasWebSocketHandler, "/ws/canvas")
                .setAllowedOriginPatterns(properties.cors().allowedOrigins().toArray(String[]::new));
    }
}
