package com.infinitecanvas.canvasbackend.event;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client message kinds, keyed by the {@code type} field of the envelope.
 */
public enum EventKind {
    JOIN_ROOM("joinRoom", Category.CONTROL),

    ADD("add", Category.WRITE),
    UPDATE("update", Category.WRITE),
    DELETE("delete", Category.WRITE),
    CLEAR("clear", Category.WRITE),
    FULL_SYNC("fullSync", Category.WRITE),
    PASTE("paste", Category.WRITE),
    ADD_LAYER("addLayer", Category.WRITE),
    DELETE_LAYER("deleteLayer", Category.WRITE),
    UPDATE_LAYER("updateLayer", Category.WRITE),

    CAMERA("camera", Category.READ_ONLY_EFFECT),
    MOVE("move", Category.READ_ONLY_EFFECT),
    CURSOR("cursor", Category.READ_ONLY_EFFECT),
    SHAPE_SELECT("shapeSelect", Category.READ_ONLY_EFFECT),
    SHAPE_RELEASE("shapeRelease", Category.READ_ONLY_EFFECT),
    USER_INFO("userInfo", Category.READ_ONLY_EFFECT),

    // anything this server does not know yet; relayed untouched
    UNKNOWN(null, Category.READ_ONLY_EFFECT);

    public enum Category {
        CONTROL,
        WRITE,
        READ_ONLY_EFFECT
    }

    private static final Map<String, EventKind> BY_WIRE_NAME = Arrays.stream(values())
            .filter(kind -> kind.wireName != null)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.wireName, Function.identity()));

    private final String wireName;
    private final Category category;

    EventKind(String wireName, Category category) {
        this.wireName = wireName;
        this.category = category;
    }

    public static EventKind fromWireName(String type) {
        return type == null ? UNKNOWN : BY_WIRE_NAME.getOrDefault(type, UNKNOWN);
    }

    public String wireName() {
        return wireName;
    }

    public Category category() {
        return category;
    }

    public boolean isWrite() {
        return category == Category.WRITE;
    }

    /**
     * Whether the effect of this kind must survive a restart. Read-only-effect kinds
     * (including the camera, whose latest value rides along with the next snapshot)
     * are never written on their own.
     */
    public boolean isPersistent() {
        return category == Category.WRITE;
    }
}
