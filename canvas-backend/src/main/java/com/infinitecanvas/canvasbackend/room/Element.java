package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A visual object on the canvas. Properties the server does not model are kept
 * in {@link #getAttributes()} and written back unchanged.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties({"userId", "userName"})
public class Element {

    static final String MIN_COORDINATE = "-1.0E9";
    static final String MAX_COORDINATE = "1.0E9";

    @NotNull(message = "element id is required")
    private ElementId id;

    @DecimalMin(MIN_COORDINATE) @DecimalMax(MAX_COORDINATE)
    private Double x;

    @DecimalMin(MIN_COORDINATE) @DecimalMax(MAX_COORDINATE)
    private Double y;

    @DecimalMin(MIN_COORDINATE) @DecimalMax(MAX_COORDINATE)
    private Double width;

    @DecimalMin(MIN_COORDINATE) @DecimalMax(MAX_COORDINATE)
    private Double height;

    @DecimalMin("-100000") @DecimalMax("100000")
    private Double rotation;

    @Size(max = 64)
    private String color;

    @Size(max = 32)
    private String shape;

    @Size(max = 20000)
    private String text;

    // asset reference returned by the upload endpoint
    @Size(max = 255)
    private String filename;

    @Size(max = 255)
    private String originalName;

    private ElementId layerId;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public Element(String id, double x, double y, double width, double height, String shape, String layerId) {
        this.id = ElementId.of(id);
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.rotation = 0.0;
        this.shape = shape;
        this.layerId = ElementId.of(layerId);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }
}
