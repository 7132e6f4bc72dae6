package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Named grouping of elements. {@code elements} is the ordered membership list and
 * is authoritative for z-order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties({"userId", "userName"})
public class Layer {

    public static final ElementId DEFAULT_ID = ElementId.of("layer_0");
    public static final String DEFAULT_NAME = "Layer 1";

    @NotNull(message = "layer id is required")
    private ElementId id;

    @Size(max = 200)
    private String name;

    private boolean visible = true;

    private boolean locked;

    @Size(max = 100000)
    private List<ElementId> elements = new ArrayList<>();

    public static Layer defaultLayer() {
        return new Layer(DEFAULT_ID, DEFAULT_NAME, true, false, new ArrayList<>());
    }

    public void setElements(List<ElementId> elements) {
        this.elements = elements == null ? new ArrayList<>() : new ArrayList<>(elements);
    }
}
