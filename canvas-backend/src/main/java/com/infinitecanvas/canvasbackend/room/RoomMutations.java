package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.CanvasEvent;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.AddElement;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.AddLayer;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.CameraChange;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.ClearCanvas;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.DeleteElement;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.DeleteLayer;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.FullSync;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.PasteElements;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UpdateElement;
import com.infinitecanvas.canvasbackend.event.CanvasEvent.UpdateLayer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merge rules applied to a room for each event kind.
 *
 * Incremental updates are last-writer-wins per field; {@code fullSync} replaces
 * collections wholesale. Payloads are validated before anything is touched, so a
 * rejected event leaves the room unchanged. Caller holds the room's monitor.
 */
@Component
public class RoomMutations {
    private static final Logger log = LoggerFactory.getLogger(RoomMutations.class);

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public RoomMutations(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public void apply(Room room, CanvasEvent event, Instant now) {
        room.ensureLayers();

        if (event instanceof AddElement add) {
            addElement(room, valid(add.element()));
        } else if (event instanceof UpdateElement update) {
            updateElement(room, update.id(), update.changes());
        } else if (event instanceof DeleteElement delete) {
            deleteElement(room, delete.id());
        } else if (event instanceof ClearCanvas) {
            clear(room);
        } else if (event instanceof FullSync sync) {
            fullSync(room, sync.elements(), sync.layers());
        } else if (event instanceof PasteElements paste) {
            List<Element> pasted = paste.elements() == null ? List.of() : paste.elements();
            pasted.forEach(this::valid);
            pasted.forEach(element -> addElement(room, element));
        } else if (event instanceof AddLayer add) {
            addLayer(room, valid(add.layer()));
        } else if (event instanceof DeleteLayer delete) {
            deleteLayer(room, delete.id());
        } else if (event instanceof UpdateLayer update) {
            updateLayer(room, update.id(), update.changes());
        } else if (event instanceof CameraChange camera) {
            room.setCamera(valid(camera.camera()));
        }
        // signals, presence and unknown kinds leave the model alone

        room.ensureLayers();
        room.setTimestamp(now);
    }

    /**
     * Appends the element, replacing one with the same id in place. A declared layer
     * becomes its only owner.
     */
    void addElement(Room room, Element element) {
        int index = room.indexOfElement(element.getId());
        if (index >= 0) {
            room.getElements().set(index, element);
        } else {
            room.getElements().add(element);
        }
        if (element.getLayerId() != null) {
            assignLayer(room, element.getId(), element.getLayerId());
        }
    }

    void updateElement(Room room, ElementId id, ObjectNode changes) {
        int index = room.indexOfElement(id);
        if (index < 0) {
            log.debug("Ignoring update of unknown element {} in room '{}'", id, room.getName());
            return;
        }
        Element current = room.getElements().get(index);
        Element merged = valid(merge(current, changes, Element.class));
        merged.setId(current.getId());
        room.getElements().set(index, merged);

        if (!Objects.equals(current.getLayerId(), merged.getLayerId())) {
            assignLayer(room, current.getId(), merged.getLayerId());
        }
    }

    void deleteElement(Room room, ElementId id) {
        room.getElements().removeIf(e -> id.equals(e.getId()));
        room.getLayers().forEach(layer -> layer.getElements().removeIf(id::equals));
    }

    void clear(Room room) {
        room.getElements().clear();
        room.getLayers().forEach(layer -> layer.getElements().clear());
    }

    void fullSync(Room room, List<Element> elements, List<Layer> layers) {
        if (elements != null) {
            elements.forEach(this::valid);
        }
        if (layers != null) {
            layers.forEach(this::valid);
        }
        if (elements != null) {
            room.setElements(elements);
        }
        if (layers != null) {
            room.setLayers(layers);
            log.debug("Full sync of room '{}': {} layers, {} elements",
                    room.getName(), layers.size(), room.getElements().size());
        }
    }

    void addLayer(Room room, Layer layer) {
        Set<ElementId> known = elementIds(room);
        layer.getElements().removeIf(id -> !known.contains(id));
        int index = room.indexOfLayer(layer.getId());
        if (index >= 0) {
            room.getLayers().set(index, layer);
        } else {
            room.getLayers().add(layer);
        }
        log.debug("Added layer {} ({}) to room '{}'", layer.getName(), layer.getId(), room.getName());
    }

    /**
     * Removes the layer and every element it owns: elements whose {@code layerId}
     * names it, plus unowned members of its list. Elements owned by another layer stay.
     */
    void deleteLayer(Room room, ElementId id) {
        int index = room.indexOfLayer(id);
        if (index < 0) {
            return;
        }
        Layer layer = room.getLayers().get(index);
        Set<ElementId> owned = room.getElements().stream()
                .filter(e -> id.equals(e.getLayerId())
                        || (layer.getElements().contains(e.getId()) && room.findLayer(e.getLayerId()).isEmpty()))
                .map(Element::getId)
                .collect(Collectors.toSet());

        room.getElements().removeIf(e -> owned.contains(e.getId()));
        room.getLayers().remove(index);
        room.getLayers().forEach(other -> other.getElements().removeIf(owned::contains));
        log.debug("Deleted layer {} with {} elements from room '{}'", id, owned.size(), room.getName());
    }

    void updateLayer(Room room, ElementId id, ObjectNode changes) {
        int index = room.indexOfLayer(id);
        if (index < 0) {
            return;
        }
        Layer current = room.getLayers().get(index);
        Layer merged = valid(merge(current, changes, Layer.class));
        merged.setId(current.getId());
        Set<ElementId> known = elementIds(room);
        merged.getElements().removeIf(member -> !known.contains(member));
        room.getLayers().set(index, merged);
    }

    private void assignLayer(Room room, ElementId elementId, ElementId layerId) {
        for (Layer layer : room.getLayers()) {
            if (!Objects.equals(layer.getId(), layerId)) {
                layer.getElements().removeIf(elementId::equals);
            }
        }
        room.findLayer(layerId).ifPresent(layer -> {
            if (!layer.getElements().contains(elementId)) {
                layer.getElements().add(elementId);
            }
        });
    }

    private <T> T merge(T current, ObjectNode changes, Class<T> type) {
        try {
            T copy = objectMapper.treeToValue(objectMapper.valueToTree(current), type);
            return objectMapper.readerForUpdating(copy).readValue(changes);
        } catch (IOException | IllegalArgumentException e) {
            throw CanvasException.malformed("Cannot merge " + type.getSimpleName() + " fields: " + e.getMessage(), e);
        }
    }

    private <T> T valid(T value) {
        if (value == null) {
            throw CanvasException.malformed("Payload is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw CanvasException.malformed("Invalid " + value.getClass().getSimpleName() + ": " + details);
        }
        return value;
    }

    private static Set<ElementId> elementIds(Room room) {
        Set<ElementId> ids = new HashSet<>();
        room.getElements().forEach(e -> ids.add(e.getId()));
        return ids;
    }
}
