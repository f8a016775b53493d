package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * One 7-day block of the plan, anchored to the training start date.
 * The final week ends on the target date and may be shorter.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingWeek {

    int weekNumber;

    LocalDate startDate;

    LocalDate endDate;

    int totalMinutes;

    String notes;

    String focus;

    @Singular
    List<TrainingDay> days;
}
