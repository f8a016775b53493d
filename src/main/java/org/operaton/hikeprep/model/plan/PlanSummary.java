package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PlanSummary {

    int daysPerWeek;

    /** Weekday indices the plan favours, 0 = Monday. */
    @Singular
    List<Integer> preferredDays;

    int averageWeeklyMinutes;

    PlanIntensity intensity;
}
