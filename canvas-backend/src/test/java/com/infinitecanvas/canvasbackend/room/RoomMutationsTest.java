package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infinitecanvas.canvasbackend.CanvasTestSupport;
import com.infinitecanvas.canvasbackend.error.CanvasErrorCode;
import com.infinitecanvas.canvasbackend.error.CanvasException;
import com.infinitecanvas.canvasbackend.event.CanvasEvent;
import com.infinitecanvas.canvasbackend.event.EventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomMutationsTest {

    private static final Instant NOW = CanvasTestSupport.NOW;

    private final ObjectMapper mapper = CanvasTestSupport.objectMapper();
    private final RoomMutations mutations = new RoomMutations(mapper, CanvasTestSupport.validator());
    private Room room;

    @BeforeEach
    void setUp() {
        room = Room.create("bright-room-7", NOW.minusSeconds(3600));
    }

    @Test
    void addAppendsElementAndJoinsDeclaredLayer() {
        mutations.apply(room, add("e1", "layer_0"), NOW);

        assertThat(room.getElements()).extracting(e -> e.getId().key()).containsExactly("e1");
        assertThat(room.findLayer(id("layer_0")).orElseThrow().getElements()).containsExactly(id("e1"));
        assertThat(room.getTimestamp()).isEqualTo(NOW);
        assertInvariants();
    }

    @Test
    void addWithExistingIdReplacesInPlaceWithoutDuplicatingMembership() {
        mutations.apply(room, add("e1", "layer_0"), NOW);
        mutations.apply(room, add("e2", "layer_0"), NOW);
        Element replacement = new Element("e1", 50, 60, 10, 10, "circle", "layer_0");

        mutations.apply(room, new CanvasEvent.AddElement(replacement), NOW);

        assertThat(room.getElements()).extracting(e -> e.getId().key()).containsExactly("e1", "e2");
        assertThat(room.getElements().get(0).getShape()).isEqualTo("circle");
        assertThat(room.findLayer(id("layer_0")).orElseThrow().getElements()).containsExactly(id("e1"), id("e2"));
    }

    @Test
    void updateMergesOnlySuppliedFields() throws Exception {
        Element element = new Element("e1", 10, 20, 30, 40, "rectangle", "layer_0");
        element.setColor("#ff0000");
        element.setAttribute("strokeWidth", 3);
        mutations.apply(room, new CanvasEvent.AddElement(element), NOW);

        mutations.apply(room, update("e1", "{\"x\":99,\"color\":\"#00ff00\",\"opacity\":0.5}"), NOW);

        Element merged = room.findElement(id("e1")).orElseThrow();
        assertThat(merged.getX()).isEqualTo(99.0);
        assertThat(merged.getY()).isEqualTo(20.0);
        assertThat(merged.getColor()).isEqualTo("#00ff00");
        assertThat(merged.getShape()).isEqualTo("rectangle");
        assertThat(merged.getAttributes()).containsEntry("strokeWidth", 3).containsEntry("opacity", 0.5);
    }

    @Test
    void updateOfUnknownElementChangesNothing() throws Exception {
        mutations.apply(room, add("e1", "layer_0"), NOW);

        mutations.apply(room, update("missing", "{\"x\":1}"), NOW);

        assertThat(room.getElements()).hasSize(1);
        assertThat(room.findElement(id("missing"))).isEmpty();
    }

    @Test
    void updateThatChangesLayerMovesMembership() throws Exception {
        mutations.apply(room, new CanvasEvent.AddLayer(layer("l2", "Layer 2")), NOW);
        mutations.apply(room, add("e1", "layer_0"), NOW);

        mutations.apply(room, update("e1", "{\"layerId\":\"l2\"}"), NOW);

        assertThat(room.findLayer(id("layer_0")).orElseThrow().getElements()).isEmpty();
        assertThat(room.findLayer(id("l2")).orElseThrow().getElements()).containsExactly(id("e1"));
        assertInvariants();
    }

    @Test
    void invalidUpdateLeavesElementUnchanged() throws Exception {
        mutations.apply(room, add("e1", "layer_0"), NOW);

        assertThatThrownBy(() -> mutations.apply(room, update("e1", "{\"x\":1e12}"), NOW))
                .isInstanceOf(CanvasException.class)
                .extracting(e -> ((CanvasException) e).getCode())
                .isEqualTo(CanvasErrorCode.MALFORMED_MESSAGE);
        assertThat(room.findElement(id("e1")).orElseThrow().getX()).isEqualTo(0.0);
    }

    @Test
    void deleteRemovesElementFromEveryLayer() {
        mutations.apply(room, add("e1", "layer_0"), NOW);
        mutations.apply(room, add("e2", "layer_0"), NOW);

        mutations.apply(room, new CanvasEvent.DeleteElement(id("e1")), NOW);

        assertThat(room.getElements()).extracting(e -> e.getId().key()).containsExactly("e2");
        assertThat(room.findLayer(id("layer_0")).orElseThrow().getElements()).containsExactly(id("e2"));
        assertInvariants();
    }

    @Test
    void clearEmptiesElementsButKeepsLayers() {
        mutations.apply(room, new CanvasEvent.AddLayer(layer("l2", "Layer 2")), NOW);
        mutations.apply(room, add("e1", "layer_0"), NOW);
        mutations.apply(room, add("e2", "l2"), NOW);

        mutations.apply(room, new CanvasEvent.ClearCanvas(), NOW);

        assertThat(room.getElements()).isEmpty();
        assertThat(room.getLayers()).extracting(l -> l.getId().key()).containsExactly("layer_0", "l2");
        assertThat(room.getLayers()).allSatisfy(l -> assertThat(l.getElements()).isEmpty());
    }

    @Test
    void fullSyncWithEmptyElementsAndOneLayerReplacesState() {
        mutations.apply(room, add("e1", "layer_0"), NOW);
        Layer only = layer("L", "Only");

        mutations.apply(room, new CanvasEvent.FullSync(List.of(), List.of(only)), NOW);

        assertThat(room.getElements()).isEmpty();
        assertThat(room.getLayers()).extracting(l -> l.getId().key()).containsExactly("L");
    }

    @Test
    void fullSyncWithoutLayersKeepsExistingLayers() {
        mutations.apply(room, new CanvasEvent.AddLayer(layer("l2", "Layer 2")), NOW);

        mutations.apply(room, new CanvasEvent.FullSync(List.of(), null), NOW);

        assertThat(room.getLayers()).extracting(l -> l.getId().key()).containsExactly("layer_0", "l2");
    }

    @Test
    void emptyLayerListSelfHealsToDefaultLayer() {
        mutations.apply(room, new CanvasEvent.FullSync(null, List.of()), NOW);

        assertThat(room.getLayers()).hasSize(1);
        assertThat(room.getLayers().get(0).getId()).isEqualTo(Layer.DEFAULT_ID);
    }

    @Test
    void pasteAddsEveryElement() {
        List<Element> pasted = List.of(
                new Element("p1", 0, 0, 5, 5, "rectangle", "layer_0"),
                new Element("p2", 10, 10, 5, 5, "circle", "layer_0"));

        mutations.apply(room, new CanvasEvent.PasteElements(pasted), NOW);

        assertThat(room.getElements()).extracting(e -> e.getId().key()).containsExactly("p1", "p2");
        assertThat(room.findLayer(id("layer_0")).orElseThrow().getElements()).containsExactly(id("p1"), id("p2"));
    }

    @Test
    void addLayerDropsMembersThatDoNotExist() {
        mutations.apply(room, add("e1", "layer_0"), NOW);
        Layer layer = new Layer(id("l2"), "Layer 2", true, false, new ArrayList<>(List.of(id("ghost"))));

        mutations.apply(room, new CanvasEvent.AddLayer(layer), NOW);

        assertThat(room.findLayer(id("l2")).orElseThrow().getElements()).isEmpty();
        assertInvariants();
    }

    @Test
    void deleteLayerRemovesOnlyElementsItOwns() {
        mutations.apply(room, new CanvasEvent.AddLayer(layer("l2", "Layer 2")), NOW);
        mutations.apply(room, add("keep", "layer_0"), NOW);
        mutations.apply(room, add("gone1", "l2"), NOW);
        mutations.apply(room, add("gone2", "l2"), NOW);

        mutations.apply(room, new CanvasEvent.DeleteLayer(id("l2")), NOW);

        assertThat(room.getLayers()).extracting(l -> l.getId().key()).containsExactly("layer_0");
        assertThat(room.getElements()).extracting(e -> e.getId().key()).containsExactly("keep");
        assertThat(room.findLayer(id("layer_0")).orElseThrow().getElements()).containsExactly(id("keep"));
        assertInvariants();
    }

    @Test
    void deletingLastLayerLeavesDefaultLayer() {
        mutations.apply(room, add("e1", "layer_0"), NOW);

        mutations.apply(room, new CanvasEvent.DeleteLayer(id("layer_0")), NOW);

        assertThat(room.getElements()).isEmpty();
        assertThat(room.getLayers()).extracting(l -> l.getId().key()).containsExactly("layer_0");
    }

    @Test
    void updateLayerKeepsIdAndMergesFields() throws Exception {
        mutations.apply(room, add("e1", "layer_0"), NOW);

        mutations.apply(room, new CanvasEvent.UpdateLayer(id("layer_0"),
                (ObjectNode) mapper.readTree("{\"name\":\"Background\",\"locked\":true}")), NOW);

        Layer updated = room.findLayer(id("layer_0")).orElseThrow();
        assertThat(updated.getName()).isEqualTo("Background");
        assertThat(updated.isLocked()).isTrue();
        assertThat(updated.isVisible()).isTrue();
        assertThat(updated.getElements()).containsExactly(id("e1"));
    }

    @Test
    void cameraIsReplaced() {
        mutations.apply(room, new CanvasEvent.CameraChange(new Camera(120, -40, 2.5)), NOW);

        assertThat(room.getCamera()).isEqualTo(new Camera(120, -40, 2.5));
    }

    @Test
    void signalsLeaveTheModelAlone() {
        mutations.apply(room, add("e1", "layer_0"), NOW);
        List<Element> before = List.copyOf(room.getElements());

        mutations.apply(room, new CanvasEvent.Signal(EventKind.CURSOR, mapper.createObjectNode().put("x", 1)), NOW);

        assertThat(room.getElements()).isEqualTo(before);
    }

    @Test
    void numericIdIsMatchedByItsTextualSpelling() throws Exception {
        Element element = mapper.readValue(
                "{\"id\":1714550000000.5,\"x\":0,\"y\":0,\"layerId\":\"layer_0\"}", Element.class);
        mutations.apply(room, new CanvasEvent.AddElement(element), NOW);

        mutations.apply(room, update("1714550000000.5", "{\"x\":7}"), NOW);

        Element stored = room.getElements().get(0);
        assertThat(stored.getX()).isEqualTo(7.0);
        assertThat(stored.getId().isNumeric()).isTrue();
        JsonNode written = mapper.valueToTree(stored);
        assertThat(written.get("id").isNumber()).isTrue();

        mutations.apply(room, new CanvasEvent.DeleteElement(id("1714550000000.5")), NOW);

        assertThat(room.getElements()).isEmpty();
        assertInvariants();
    }

    @Test
    void layerWithoutIdIsDroppedBeforeAssignment() {
        room.getLayers().add(new Layer(null, "Broken", true, false, new ArrayList<>()));

        mutations.apply(room, add("e1", "x"), NOW);

        assertThat(room.getLayers()).extracting(l -> l.getId().key()).containsExactly("layer_0");
        assertThat(room.getElements()).extracting(e -> e.getId().key()).containsExactly("e1");
        assertInvariants();
    }

    private void assertInvariants() {
        Set<ElementId> ids = new HashSet<>();
        room.getElements().forEach(e -> ids.add(e.getId()));
        Set<ElementId> owned = new HashSet<>();
        assertThat(room.getLayers()).isNotEmpty();
        for (Layer layer : room.getLayers()) {
            assertThat(layer.getId()).isNotNull();
            for (ElementId member : layer.getElements()) {
                assertThat(ids).contains(member);
                assertThat(owned.add(member)).as("element %s in more than one layer", member).isTrue();
            }
        }
    }

    private static CanvasEvent add(String id, String layerId) {
        return new CanvasEvent.AddElement(new Element(id, 0, 0, 10, 10, "rectangle", layerId));
    }

    private CanvasEvent update(String elementId, String json) throws Exception {
        return new CanvasEvent.UpdateElement(id(elementId), (ObjectNode) mapper.readTree(json));
    }

    private static Layer layer(String layerId, String name) {
        return new Layer(id(layerId), name, true, false, new ArrayList<>());
    }

    private static ElementId id(String text) {
        return ElementId.of(text);
    }
}
