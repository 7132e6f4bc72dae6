package com.infinitecanvas.canvasbackend.room;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Authoritative in-memory state of one room.
 *
 * Not thread-safe: callers hold the room's monitor ({@code synchronized (room)})
 * while reading or mutating it.
 */
public class Room {
    private final String name;
    private List<Element> elements;
    private List<Layer> layers;
    private Camera camera;
    private String fullAccessCredential;
    private String readOnlyCredential;
    private boolean protectionEnabled;
    private Instant timestamp;
    private Instant lastModified;
    private boolean retired;

    private Room(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * A fresh, unprotected room with one default layer.
     */
    public static Room create(String name, Instant now) {
        Room room = new Room(name);
        room.elements = new ArrayList<>();
        room.layers = new ArrayList<>(List.of(Layer.defaultLayer()));
        room.camera = Camera.origin();
        room.timestamp = now;
        room.lastModified = now;
        return room;
    }

    public static Room fromRecord(String name, RoomRecord record) {
        Room room = new Room(name);
        room.elements = record.elements() == null ? new ArrayList<>() : new ArrayList<>(record.elements());
        room.layers = record.layers() == null ? new ArrayList<>() : new ArrayList<>(record.layers());
        room.camera = record.camera() == null ? Camera.origin() : record.camera();
        room.fullAccessCredential = record.fullAccessPassword();
        room.readOnlyCredential = record.readOnlyPassword();
        room.protectionEnabled = record.passwordProtected();
        room.timestamp = record.timestamp();
        room.lastModified = record.lastModified();
        room.ensureLayers();
        return room;
    }

    public RoomRecord toRecord() {
        return new RoomRecord(
                RoomRecordMigrator.CURRENT_VERSION,
                new ArrayList<>(elements),
                new ArrayList<>(layers),
                camera,
                fullAccessCredential,
                readOnlyCredential,
                protectionEnabled,
                timestamp,
                lastModified);
    }

    /**
     * Drops layers without an id and null members, then replaces a missing or empty
     * layer collection with the default layer.
     *
     * @return true if anything had to be repaired
     */
    public boolean ensureLayers() {
        boolean repaired = false;
        if (layers != null) {
            repaired = layers.removeIf(layer -> layer == null || layer.getId() == null);
            for (Layer layer : layers) {
                repaired |= layer.getElements().removeIf(Objects::isNull);
            }
        }
        if (layers == null || layers.isEmpty()) {
            layers = new ArrayList<>(List.of(Layer.defaultLayer()));
            return true;
        }
        return repaired;
    }

    /**
     * Marks a room that was dropped from the store. Sessions that raced the eviction
     * and still hold this instance must load the room again. Caller holds the monitor.
     */
    void retire() {
        retired = true;
    }

    public boolean isRetired() {
        return retired;
    }

    public Optional<Element> findElement(ElementId id) {
        return elements.stream().filter(e -> Objects.equals(e.getId(), id)).findFirst();
    }

    public int indexOfElement(ElementId id) {
        for (int i = 0; i < elements.size(); i++) {
            if (Objects.equals(elements.get(i).getId(), id)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Layer> findLayer(ElementId id) {
        if (id == null) {
            return Optional.empty();
        }
        return layers.stream().filter(l -> id.equals(l.getId())).findFirst();
    }

    public int indexOfLayer(ElementId id) {
        for (int i = 0; i < layers.size(); i++) {
            if (Objects.equals(layers.get(i).getId(), id)) {
                return i;
            }
        }
        return -1;
    }

    public String getName() {
        return name;
    }

    public List<Element> getElements() {
        return elements;
    }

    public void setElements(List<Element> elements) {
        this.elements = new ArrayList<>(elements);
    }

    public List<Layer> getLayers() {
        return layers;
    }

    public void setLayers(List<Layer> layers) {
        this.layers = new ArrayList<>(layers);
    }

    public Camera getCamera() {
        return camera;
    }

    public void setCamera(Camera camera) {
        this.camera = camera;
    }

    public String getFullAccessCredential() {
        return fullAccessCredential;
    }

    public String getReadOnlyCredential() {
        return readOnlyCredential;
    }

    public boolean isProtectionEnabled() {
        return protectionEnabled;
    }

    public void protect(String fullAccessCredential, String readOnlyCredential) {
        this.fullAccessCredential = Objects.requireNonNull(fullAccessCredential, "fullAccessCredential");
        this.readOnlyCredential = readOnlyCredential;
        this.protectionEnabled = true;
    }

    public void unprotect() {
        this.fullAccessCredential = null;
        this.readOnlyCredential = null;
        this.protectionEnabled = false;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }
}
