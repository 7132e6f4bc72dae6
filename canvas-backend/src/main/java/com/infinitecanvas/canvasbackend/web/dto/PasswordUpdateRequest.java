package com.infinitecanvas.canvasbackend.web.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to set or clear a room's credentials. An empty {@code password} removes protection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PasswordUpdateRequest {

    @Size(max = 128, message = "password must be at most 128 characters")
    private String password;

    @Size(max = 128, message = "readOnlyPassword must be at most 128 characters")
    private String readOnlyPassword;

    /**
     * Current full-access password, required when the room is already protected
     */
    @Size(max = 128)
    private String currentPassword;
}
