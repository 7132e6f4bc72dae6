package com.infinitecanvas.canvasbackend.web.dto;

public record UploadResponse(String filename, String originalName) {
}
