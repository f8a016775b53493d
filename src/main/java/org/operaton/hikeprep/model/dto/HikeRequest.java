package org.operaton.hikeprep.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for the target hike: its size and elevation profile.
 * Profile points are expected sorted by distance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HikeRequest {

    @Size(max = 200, message = "Name must not exceed 200 characters")
    private String name;

    @NotNull(message = "Distance is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Distance must be greater than 0")
    @DecimalMax(value = "100.0", message = "Distance must not exceed 100 miles")
    private Double distanceMiles;

    @NotNull(message = "Elevation gain is required")
    @DecimalMin(value = "0.0", message = "Elevation gain must not be negative")
    @DecimalMax(value = "30000.0", message = "Elevation gain must not exceed 30000 ft")
    private Double elevationGainFt;

    @Valid
    @Builder.Default
    private List<ProfilePointRequest> profilePoints = new ArrayList<>();
}
