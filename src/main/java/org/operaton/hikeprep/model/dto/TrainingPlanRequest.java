package org.operaton.hikeprep.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.hikeprep.model.plan.FitnessLevel;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for generating a training plan.
 * Omitted optional fields are filled from configured defaults before validation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrainingPlanRequest {

    @NotNull(message = "Hike is required")
    @Valid
    private HikeRequest hike;

    @NotNull(message = "Fitness level is required")
    private FitnessLevel fitnessLevel;

    /** Defaults to the next Monday when omitted. */
    private LocalDate trainingStartDate;

    private LocalDate targetDate;

    private Integer daysPerWeek;

    /** Weekday indices, 0 = Monday through 6 = Sunday. */
    @Builder.Default
    private List<Integer> preferredDays = new ArrayList<>();

    private Boolean anyDays;

    private Integer baselineMinutes;

    @NotNull(message = "Maximum treadmill incline is required")
    private Double treadmillMaxInclinePercent;

    private Integer treadmillSessionsPerWeek;

    private Integer outdoorHikesPerWeek;

    @NotNull(message = "Maximum treadmill speed is required")
    private Double maxSpeedMph;

    private Boolean includeStrength;

    private Integer strengthSessionsPerWeek;

    private Boolean strengthOnCardioDays;

    private Boolean fillActiveRecoveryDays;
}
