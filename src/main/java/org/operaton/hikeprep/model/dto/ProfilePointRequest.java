package org.operaton.hikeprep.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for one elevation profile sample.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfilePointRequest {

    @NotNull(message = "Distance is required")
    @DecimalMin(value = "0.0", message = "Distance must not be negative")
    private Double distanceMiles;

    @NotNull(message = "Elevation is required")
    private Double elevationFt;
}
