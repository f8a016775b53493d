package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Equipment ceilings and requested weekly session counts.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingConstraints {

    double treadmillMaxInclinePercent;

    int treadmillSessionsPerWeek;

    int outdoorHikesPerWeek;

    double maxSpeedMph;
}
