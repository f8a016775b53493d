package org.operaton.hikeprep.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A single workout on a training day.
 * Only treadmill-based types carry segments.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingWorkout {

    String id;

    WorkoutType type;

    int durationMinutes;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Double inclineTarget;

    String notes;

    @Singular
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<TrainingSegment> segments;
}
