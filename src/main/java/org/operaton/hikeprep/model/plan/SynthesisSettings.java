package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for a single segment synthesis.
 * A null {@code targetDurationMinutes} means the duration is estimated from the hike.
 */
@Value
@Builder(toBuilder = true)
public class SynthesisSettings {

    FitnessLevel fitnessLevel;

    Integer targetDurationMinutes;

    double packWeightLbs;

    double minInclinePercent;

    double maxInclinePercent;

    double maxSpeedMph;

    public boolean isAutoDuration() {
        return targetDurationMinutes == null;
    }
}
