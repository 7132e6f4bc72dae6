package com.infinitecanvas.canvasbackend.web.dto;

public record RoomCheckResponse(
        String roomName,
        boolean exists,
        boolean requiresPassword
) {}
