package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Strength training preferences.
 * When {@code stackOnCardioDays} is set, strength is appended to cardio days
 * instead of taking days of its own.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StrengthSettings {

    boolean includeStrength;

    int sessionsPerWeek;

    boolean stackOnCardioDays;

    public static StrengthSettings none() {
        return StrengthSettings.builder().build();
    }
}
