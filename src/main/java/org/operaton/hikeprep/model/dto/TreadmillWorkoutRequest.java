package org.operaton.hikeprep.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.hikeprep.model.plan.FitnessLevel;

/**
 * Request DTO for synthesizing a single treadmill workout from a hike profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreadmillWorkoutRequest {

    @NotNull(message = "Hike is required")
    @Valid
    private HikeRequest hike;

    @NotNull(message = "Fitness level is required")
    private FitnessLevel fitnessLevel;

    /** Null means the duration is estimated from the hike. */
    @Min(value = 1, message = "Target duration must be at least 1 minute")
    @Max(value = 600, message = "Target duration must not exceed 600 minutes")
    private Integer targetDurationMinutes;

    @DecimalMin(value = "0.0", message = "Pack weight must not be negative")
    @DecimalMax(value = "100.0", message = "Pack weight must not exceed 100 lbs")
    private Double packWeightLbs;

    @DecimalMin(value = "-5.0", message = "Minimum incline must be at least -5%")
    @DecimalMax(value = "20.0", message = "Minimum incline must not exceed 20%")
    private Double minInclinePercent;

    @NotNull(message = "Maximum incline is required")
    @DecimalMin(value = "0.0", message = "Maximum incline must be between 0 and 20%")
    @DecimalMax(value = "20.0", message = "Maximum incline must be between 0 and 20%")
    private Double maxInclinePercent;

    @NotNull(message = "Maximum speed is required")
    @DecimalMin(value = "1.0", message = "Maximum speed must be between 1.0 and 8.0 mph")
    @DecimalMax(value = "8.0", message = "Maximum speed must be between 1.0 and 8.0 mph")
    private Double maxSpeedMph;
}
