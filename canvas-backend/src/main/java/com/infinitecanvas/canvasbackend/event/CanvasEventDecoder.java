package com.infinitecanvas.canvasbackend.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.AddElement;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.AddLayer;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.CameraChange;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.ClearCanvas;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.DeleteElement;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.DeleteLayer;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.FullSync;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.JoinRoom;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.PasteElements;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.Signal;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UnknownEvent;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UpdateElement;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UpdateLayer;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UserInfo;
import com.infinitecanvas.canvasbackend.room.Camera;
import com.infinitecanvas.canvasbackend.room.Element;
import com.infinitecanvas.canvasbackend.room.ElementId;
import com.infinitecanvas.canvasbackend.room.Layer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Turns a {@code {type, data}} text frame into a typed {@link CanvasEvent}.
 * Anything that cannot be decoded fails with a {@code MALFORMED_MESSAGE} {@link CanvasException}.
 */
@Component
public class CanvasEventDecoder {

    // sender stamps added by the browser client to every payload
    private static final List<String> SENDER_FIELDS = List.of("userId", "userName");

    private final ObjectMapper objectMapper;

    public CanvasEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CanvasEvent decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw CanvasException.malformed("Message is not valid JSON", e);
        }
        if (root == null || !root.isObject() || !root.path("type").isTextual()) {
            throw CanvasException.malformed("Message has no type");
        }

        String type = root.get("type").asText();
        JsonNode data = root.path("data");
        EventKind kind = EventKind.fromWireName(type);
        try {
            return switch (kind) {
                case JOIN_ROOM -> new JoinRoom(text(data, "roomName"), text(data, "password"));
                case ADD -> new AddElement(read(data, Element.class));
                case UPDATE -> new UpdateElement(requireId(data), changes(data));
                case DELETE -> new DeleteElement(requireId(data));
                case CLEAR -> new ClearCanvas();
                case FULL_SYNC -> new FullSync(
                        readList(data.get("elements"), Element.class),
                        readList(data.get("layers"), Layer.class));
                case PASTE -> new PasteElements(readList(data.get("elements"), Element.class));
                case ADD_LAYER -> new AddLayer(read(data, Layer.class));
                case DELETE_LAYER -> new DeleteLayer(requireId(data));
                case UPDATE_LAYER -> new UpdateLayer(requireId(data), changes(data));
                case CAMERA -> new CameraChange(read(data, Camera.class));
                case MOVE, CURSOR, SHAPE_SELECT, SHAPE_RELEASE -> new Signal(kind, data);
                case USER_INFO -> new UserInfo(requireText(data, "userId"), text(data, "userName"));
                case UNKNOWN -> new UnknownEvent(type, data);
            };
        } catch (IOException | IllegalArgumentException e) {
            throw CanvasException.malformed("Invalid '" + type + "' payload: " + e.getMessage(), e);
        }
    }

    private <T> T read(JsonNode data, Class<T> type) throws JsonProcessingException {
        requireObject(data);
        return objectMapper.treeToValue(data, type);
    }

    private <T> List<T> readList(JsonNode node, Class<T> type) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("expected an array");
        }
        return objectMapper.readerForListOf(type).readValue(node);
    }

    private ObjectNode changes(JsonNode data) {
        ObjectNode changes = requireObject(data).deepCopy();
        changes.remove("id");
        changes.remove(SENDER_FIELDS);
        return changes;
    }

    private static ElementId requireId(JsonNode data) {
        return ElementId.from(requireObject(data).get("id"));
    }

    private static String requireText(JsonNode data, String field) {
        String value = text(data, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static String text(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : null;
    }

    private static ObjectNode requireObject(JsonNode data) {
        if (data instanceof ObjectNode object) {
            return object;
        }
        throw new IllegalArgumentException("data must be an object");
    }
}
