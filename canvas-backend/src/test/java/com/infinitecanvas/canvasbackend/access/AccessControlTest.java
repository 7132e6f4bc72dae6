package com.infinitecanvas.canvasbackend.access;

import com.infinitecanvas.canvasbackend.CanvasTestSupport;
import com.infinitecanvas.canvasbackend.error.CanvasErrorCode;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.EventKind;
import com.infinitecanvas.canvasbackend.room.Room;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessControlTest {

    private final PasswordEncoder encoder = PasswordEncoderFactories.createDelegatingPasswordEncoder();
    private final AccessControl accessControl = new AccessControl(encoder);
    private Room room;

    @BeforeEach
    void setUp() {
        room = Room.create("calm-zone-3", CanvasTestSupport.NOW);
    }

    @Test
    void unprotectedRoomGrantsFullAccessWhateverIsSupplied() {
        assertThat(accessControl.resolveRole(room, null)).isEqualTo(Role.FULL_ACCESS);
        assertThat(accessControl.resolveRole(room, "anything")).isEqualTo(Role.FULL_ACCESS);
    }

    @Test
    void protectedRoomResolvesBothTiers() {
        accessControl.updateCredentials(room, null, "adm", "ro");

        assertThat(accessControl.resolveRole(room, "adm")).isEqualTo(Role.FULL_ACCESS);
        assertThat(accessControl.resolveRole(room, "ro")).isEqualTo(Role.READ_ONLY);
        assertThatThrownBy(() -> accessControl.resolveRole(room, "wrong"))
                .isInstanceOf(CanvasException.class)
                .hasMessageContaining("password")
                .satisfies(e -> assertThat(((CanvasException) e).getCode())
                        .isEqualTo(CanvasErrorCode.AUTHENTICATION_REJECTED));
        assertThatThrownBy(() -> accessControl.resolveRole(room, null)).isInstanceOf(CanvasException.class);
    }

    @Test
    void credentialsAreStoredEncoded() {
        accessControl.updateCredentials(room, null, "adm", "ro");

        assertThat(room.getFullAccessCredential()).startsWith("{bcrypt}").doesNotContain("adm");
        assertThat(room.getReadOnlyCredential()).startsWith("{bcrypt}");
    }

    @Test
    void migratedPlaintextCredentialStillVerifies() {
        room.protect("{noop}legacy", null);

        assertThat(accessControl.resolveRole(room, "legacy")).isEqualTo(Role.FULL_ACCESS);
        assertThatThrownBy(() -> accessControl.resolveRole(room, "")).isInstanceOf(CanvasException.class);
    }

    @Test
    void changingProtectedRoomRequiresCurrentFullAccessCredential() {
        accessControl.updateCredentials(room, null, "adm", "ro");

        assertThatThrownBy(() -> accessControl.updateCredentials(room, "ro", "other", null))
                .isInstanceOf(CanvasException.class);
        accessControl.updateCredentials(room, "adm", "", null);

        assertThat(room.isProtectionEnabled()).isFalse();
        assertThat(room.getFullAccessCredential()).isNull();
        assertThat(accessControl.resolveRole(room, null)).isEqualTo(Role.FULL_ACCESS);
    }

    @Test
    void readOnlyMayOnlyPerformReadOnlyEffects() {
        assertThat(accessControl.authorize(Role.READ_ONLY, EventKind.DELETE)).isFalse();
        assertThat(accessControl.authorize(Role.READ_ONLY, EventKind.FULL_SYNC)).isFalse();
        assertThat(accessControl.authorize(Role.READ_ONLY, EventKind.CURSOR)).isTrue();
        assertThat(accessControl.authorize(Role.READ_ONLY, EventKind.CAMERA)).isTrue();
        assertThat(accessControl.authorize(Role.READ_ONLY, EventKind.UNKNOWN)).isTrue();
        assertThat(accessControl.authorize(Role.FULL_ACCESS, EventKind.DELETE_LAYER)).isTrue();
    }
}
