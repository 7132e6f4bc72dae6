package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;

/**
 * Identifier of an element or layer.
 *
 * Browsers mint numeric ids ({@code Date.now() + Math.random()}), other clients send
 * strings. The id is written back in the JSON type it arrived in; lookups compare the
 * canonical decimal text, so {@code 42}, {@code 42.0} and {@code "42"} name the same object.
 */
public final class ElementId {
    public static final int MAX_LENGTH = 128;

    private final JsonNode value;
    private final String key;

    private ElementId(JsonNode value, String key) {
        this.value = value;
        this.key = key;
    }

    /**
     * @throws IllegalArgumentException if the node is not a non-blank string or a number
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ElementId from(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("Identifier is required");
        }
        if (node.isIntegralNumber()) {
            return checked(node, node.bigIntegerValue().toString());
        }
        if (node.isNumber()) {
            BigDecimal decimal = node.decimalValue();
            return checked(DecimalNode.valueOf(decimal), decimal.stripTrailingZeros().toPlainString());
        }
        if (node.isTextual()) {
            return checked(node, node.asText());
        }
        throw new IllegalArgumentException("Identifier must be a string or a number, got " + node.getNodeType());
    }

    /**
     * Like {@link #from(JsonNode)} but maps an absent or null node to {@code null}.
     */
    public static ElementId fromNullable(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return from(node);
    }

    public static ElementId of(String text) {
        return text == null ? null : from(TextNode.valueOf(text));
    }

    private static ElementId checked(JsonNode value, String key) {
        if (key.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        if (key.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Identifier longer than " + MAX_LENGTH + " characters");
        }
        return new ElementId(value, key);
    }

    @JsonValue
    public JsonNode value() {
        return value;
    }

    public String key() {
        return key;
    }

    public boolean isNumeric() {
        return value.isNumber();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ElementId other && key.equals(other.key));
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
