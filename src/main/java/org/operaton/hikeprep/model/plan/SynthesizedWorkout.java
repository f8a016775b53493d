package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Result of treadmill segment synthesis: warm-up, main phase and cool-down.
 */
@Value
@Builder
@Jacksonized
public class SynthesizedWorkout {

    int totalMinutes;

    @Singular
    List<TrainingSegment> segments;

    public double segmentMinutes() {
        return segments.stream().mapToDouble(TrainingSegment::getMinutes).sum();
    }
}
