package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Upgrades a stored room record of any earlier shape to the current one.
 *
 * Pure function over JSON trees: the input is never modified and no I/O happens here.
 * Every step is idempotent, so current records pass through unchanged apart from
 * the version stamp.
 *
 * <ul>
 *   <li>v0: flat {@code elements}, no layers, single {@code password}</li>
 *   <li>v1: layers and {@code isPasswordProtected}, still {@code password}, maybe no {@code lastModified}</li>
 *   <li>v2: separate full-access / read-only credentials in encoded form</li>
 * </ul>
 */
public final class RoomRecordMigrator {
    public static final int CURRENT_VERSION = 2;

    private static final String LEGACY_PASSWORD = "password";
    private static final String FULL_ACCESS = "fullAccessPassword";
    private static final String READ_ONLY = "readOnlyPassword";
    private static final String PROTECTED = "isPasswordProtected";
    private static final String NOOP_PREFIX = "{noop}";
    private static final Pattern ENCODED = Pattern.compile("^\\{[A-Za-z0-9_-]+}.*", Pattern.DOTALL);

    private RoomRecordMigrator() {
    }

    public static ObjectNode migrate(ObjectNode raw, Instant now) {
        ObjectNode node = raw.deepCopy();
        ArrayNode elements = node.get("elements") instanceof ArrayNode array ? array : node.putArray("elements");

        dropUnidentified(elements);

        JsonNode layers = node.get("layers");
        if (layers instanceof ArrayNode layerArray) {
            dropUnidentified(layerArray);
            for (JsonNode layer : layerArray) {
                if (layer.get("elements") instanceof ArrayNode members) {
                    removeWhere(members, member -> !isIdentifier(member));
                }
            }
        }
        if (layers == null || layers.isNull()) {
            node.putArray("layers").add(layerFromLegacyElements(node, elements));
        } else if (!layers.isArray() || layers.isEmpty()) {
            ObjectNode layer = defaultLayer(node);
            layer.putArray("elements");
            node.putArray("layers").add(layer);
        }

        if (!node.path("camera").isObject()) {
            node.putObject("camera").put("x", 0).put("y", 0).put("zoom", 1);
        }

        String fullAccess = credential(node, FULL_ACCESS);
        if (fullAccess == null) {
            fullAccess = credential(node, LEGACY_PASSWORD);
        }
        node.remove(LEGACY_PASSWORD);
        putCredential(node, FULL_ACCESS, fullAccess);
        putCredential(node, READ_ONLY, credential(node, READ_ONLY));

        boolean requested = node.path(PROTECTED).asBoolean(fullAccess != null);
        node.put(PROTECTED, requested && fullAccess != null);

        Instant lastModified = instant(node.get("lastModified")).orElse(now);
        Instant timestamp = instant(node.get("timestamp")).orElse(now);
        node.put("lastModified", lastModified.toString());
        node.put("timestamp", timestamp.toString());

        node.put("schemaVersion", CURRENT_VERSION);
        return node;
    }

    /**
     * Last activity of a stored record without migrating it: {@code lastModified},
     * falling back to {@code timestamp}.
     */
    public static Optional<Instant> lastActivity(JsonNode raw) {
        return instant(raw.get("lastModified")).or(() -> instant(raw.get("timestamp")));
    }

    private static ObjectNode layerFromLegacyElements(ObjectNode root, ArrayNode elements) {
        ObjectNode layer = defaultLayer(root);
        ArrayNode members = layer.putArray("elements");
        for (JsonNode element : elements) {
            if (element instanceof ObjectNode object && object.hasNonNull("id")) {
                members.add(object.get("id"));
                if (!object.hasNonNull("layerId")) {
                    object.put("layerId", Layer.DEFAULT_ID.key());
                }
            }
        }
        return layer;
    }

    private static ObjectNode defaultLayer(ObjectNode root) {
        return root.objectNode()
                .put("id", Layer.DEFAULT_ID.key())
                .put("name", Layer.DEFAULT_NAME)
                .put("visible", true)
                .put("locked", false);
    }

    /**
     * Removes entries that are not objects or carry no usable {@code id}; nothing can
     * address them, and a layer without an id would break layer assignment.
     */
    private static void dropUnidentified(ArrayNode entries) {
        removeWhere(entries, entry -> !entry.isObject() || !isIdentifier(entry.get("id")));
    }

    private static void removeWhere(ArrayNode array, Predicate<JsonNode> condition) {
        for (int i = array.size() - 1; i >= 0; i--) {
            if (condition.test(array.get(i))) {
                array.remove(i);
            }
        }
    }

    private static boolean isIdentifier(JsonNode node) {
        try {
            return ElementId.fromNullable(node) != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String credential(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        String text = value.asText();
        return ENCODED.matcher(text).matches() ? text : NOOP_PREFIX + text;
    }

    private static void putCredential(ObjectNode node, String field, String value) {
        if (value == null) {
            node.remove(field);
        } else {
            node.put(field, value);
        }
    }

    private static Optional<Instant> instant(JsonNode value) {
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(Instant.ofEpochMilli(value.asLong()));
        }
        try {
            return Optional.of(Instant.parse(value.asText()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
