package com.infinitecanvas.canvasbackend.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PasswordUpdateResponse(
        String roomName,
        @JsonProperty("isPasswordProtected") boolean passwordProtected
) {}
