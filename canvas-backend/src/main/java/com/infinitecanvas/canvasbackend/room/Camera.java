package com.infinitecanvas.canvasbackend.room;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Camera {

    @DecimalMin(Element.MIN_COORDINATE) @DecimalMax(Element.MAX_COORDINATE)
    private double x;

    @DecimalMin(Element.MIN_COORDINATE) @DecimalMax(Element.MAX_COORDINATE)
    private double y;

    @Positive
    @DecimalMax("1000")
    private double zoom = 1;

    public static Camera origin() {
        return new Camera(0, 0, 1);
    }
}
