package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Complete, immutable result of a scheduling call.
 * Warnings are advisory only and never replace any part of the plan.
 */
@Value
@Builder
@Jacksonized
public class TrainingPlanOutput {

    int totalWeeks;

    @Singular
    List<String> warnings;

    PlanSummary summary;

    @Singular
    List<TrainingWeek> weeks;

    public int totalMinutes() {
        return weeks.stream().mapToInt(TrainingWeek::getTotalMinutes).sum();
    }
}
