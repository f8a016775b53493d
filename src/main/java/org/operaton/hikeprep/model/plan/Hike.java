package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Target hike geometry as supplied by the hike data provider.
 * The elevation gain may be precomputed independently of the profile.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Hike {

    double distanceMiles;

    double elevationGainFt;

    @Singular
    List<ProfilePoint> profilePoints;
}
