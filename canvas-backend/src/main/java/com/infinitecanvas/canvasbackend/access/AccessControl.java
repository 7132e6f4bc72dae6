package com.infinitecanvas.canvasbackend.access;

import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.EventKind;
import com.infinitecanvas.canvasbackend.room.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Derives a session's role from the room's protection settings and checks
 * each operation against it.
 */
@Component
public class AccessControl {
    private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

    private final PasswordEncoder passwordEncoder;

    public AccessControl(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Resolves the role for a join attempt.
     *
     * @throws CanvasException {@code AUTHENTICATION_REJECTED} if the room is protected
     *                         and the credential matches neither tier
     */
    public Role resolveRole(Room room, String suppliedCredential) {
        if (!room.isProtectionEnabled()) {
            return Role.FULL_ACCESS;
        }
        if (matches(suppliedCredential, room.getFullAccessCredential())) {
            return Role.FULL_ACCESS;
        }
        if (matches(suppliedCredential, room.getReadOnlyCredential())) {
            return Role.READ_ONLY;
        }
        throw CanvasException.authenticationRejected();
    }

    public boolean authorize(Role role, EventKind kind) {
        return !kind.isWrite() || role == Role.FULL_ACCESS;
    }

    /**
     * Sets or clears the room credentials. An empty full-access credential turns
     * protection off. Changing a protected room requires its current full-access credential.
     * Caller holds the room's monitor.
     */
    public void updateCredentials(Room room, String currentCredential,
                                  String fullAccessCredential, String readOnlyCredential) {
        if (room.isProtectionEnabled() && !matches(currentCredential, room.getFullAccessCredential())) {
            throw CanvasException.authenticationRejected();
        }
        if (isBlank(fullAccessCredential)) {
            room.unprotect();
            log.info("Password protection removed from room '{}'", room.getName());
            return;
        }
        String readOnly = isBlank(readOnlyCredential) ? null : passwordEncoder.encode(readOnlyCredential);
        room.protect(passwordEncoder.encode(fullAccessCredential), readOnly);
        log.info("Password protection enabled for room '{}' (read-only access: {})",
                room.getName(), readOnly != null);
    }

    private boolean matches(String raw, String encoded) {
        if (raw == null || encoded == null) {
            return false;
        }
        try {
            return passwordEncoder.matches(raw, encoded);
        } catch (IllegalArgumentException e) {
            log.warn("Stored credential has an unsupported encoding: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
