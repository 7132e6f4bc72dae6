package com.infinitecanvas.canvasbackend.web.dto;

public record RoomNameResponse(String roomName) {
}
