package org.operaton.hikeprep.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A timed treadmill block with a fixed incline and speed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingSegment {

    /** 0 for the warm-up, then 1..n for the main phase, n+1 for the cool-down. */
    int index;

    double minutes;

    double inclinePct;

    double speedMph;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    String note;
}
