package org.operaton.hikeprep.model.plan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rough load classification of a plan relative to the hiker's baseline.
 */
public enum PlanIntensity {
    NORMAL,
    MODERATE,
    AGGRESSIVE;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    /**
     * Classifies a plan by current weekly minutes and weekly session count.
     *
     * @param baselineMinutes current weekly exercise minutes
     * @param totalSessions treadmill, outdoor and own-day strength sessions per week
     * @return the plan intensity
     */
    public static PlanIntensity classify(int baselineMinutes, int totalSessions) {
        if (baselineMinutes <= 30 && totalSessions >= 5) {
            return AGGRESSIVE;
        }
        if (baselineMinutes <= 30 && totalSessions >= 4) {
            return MODERATE;
        }
        if (baselineMinutes > 60 && totalSessions >= 6) {
            return AGGRESSIVE;
        }
        return NORMAL;
    }
}
