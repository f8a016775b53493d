package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Validated input of a single scheduling call.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingPlanInputs {

    Hike hike;

    FitnessLevel fitnessLevel;

    LocalDate trainingStartDate;

    LocalDate targetDate;

    int daysPerWeek;

    /** Preferred weekdays, 0 = Monday through 6 = Sunday. */
    @Singular
    List<Integer> preferredDays;

    boolean anyDays;

    /** Minutes of exercise the hiker currently does per week. */
    int baselineMinutes;

    TrainingConstraints constraints;

    @Builder.Default
    StrengthSettings strength = StrengthSettings.none();

    @Builder.Default
    boolean fillActiveRecoveryDays = true;
}
