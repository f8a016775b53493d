package org.operaton.hikeprep.model.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One sample of a hike's elevation profile.
 * Points of a hike are ordered by distance, ascending.
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor(staticName = "of")
public class ProfilePoint {

    /** Distance from the trailhead in miles. */
    double distanceMiles;

    /** Elevation in feet. */
    double elevationFt;
}
