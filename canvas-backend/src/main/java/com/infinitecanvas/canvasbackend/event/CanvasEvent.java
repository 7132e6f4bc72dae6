package com.infinitecanvas.canvasbackend.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.room.Camera;
import com.infinitecanvas.canvasbackend.room.Element;
import com.infinitecanvas.canvasbackend.room.ElementId;
import com.infinitecanvas.canvasbackend.room.Layer;

import java.util.List;

/**
 * A decoded client message. One record per kind; {@link UnknownEvent} keeps
 * kinds from newer clients flowing to peers.
 */
public interface CanvasEvent {

    EventKind kind();

    record JoinRoom(String roomName, String password) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.JOIN_ROOM;
        }
    }

    record AddElement(Element element) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.ADD;
        }
    }

    /**
     * @param changes the supplied fields only, without {@code id}
     */
    record UpdateElement(ElementId id, ObjectNode changes) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.UPDATE;
        }
    }

    record DeleteElement(ElementId id) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.DELETE;
        }
    }

    record ClearCanvas() implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.CLEAR;
        }
    }

    /**
     * Either list may be null, meaning "leave as is".
     */
    record FullSync(List<Element> elements, List<Layer> layers) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.FULL_SYNC;
        }
    }

    record PasteElements(List<Element> elements) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.PASTE;
        }
    }

    record AddLayer(Layer layer) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.ADD_LAYER;
        }
    }

    record DeleteLayer(ElementId id) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.DELETE_LAYER;
        }
    }

    record UpdateLayer(ElementId id, ObjectNode changes) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.UPDATE_LAYER;
        }
    }

    record CameraChange(Camera camera) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.CAMERA;
        }
    }

    /**
     * Ephemeral interaction signals: live drag, cursor, selection hover.
     */
    record Signal(EventKind kind, JsonNode data) implements CanvasEvent {
    }

    record UserInfo(String userId, String userName) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.USER_INFO;
        }
    }

    record UnknownEvent(String type, JsonNode data) implements CanvasEvent {
        @Override
        public EventKind kind() {
            return EventKind.UNKNOWN;
        }
    }
}
