package com.frontline.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for starting a border push.
 * Uses Double wrappers so Jackson 3 leaves absent fields as null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartPushRequest {

    @NotBlank(message = "War is required")
    private String warId;

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be at least -90")
    @DecimalMax(value = "90.0", message = "Latitude must be at most 90")
    private Double lat;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be at least -180")
    @DecimalMax(value = "180.0", message = "Longitude must be at most 180")
    private Double lng;

    @NotNull(message = "Direction latitude is required")
    @DecimalMin(value = "-90.0", message = "Direction latitude must be at least -90")
    @DecimalMax(value = "90.0", message = "Direction latitude must be at most 90")
    private Double directionLat;

    @NotNull(message = "Direction longitude is required")
    @DecimalMin(value = "-180.0", message = "Direction longitude must be at least -180")
    @DecimalMax(value = "180.0", message = "Direction longitude must be at most 180")
    private Double directionLng;

    @DecimalMin(value = "0.1", message = "Terrain modifier must be at least 0.1")
    @DecimalMax(value = "5.0", message = "Terrain modifier must be at most 5.0")
    private Double terrainModifier;
}
