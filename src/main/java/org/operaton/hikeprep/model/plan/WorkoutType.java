package org.operaton.hikeprep.model.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of workout scheduled on a training day.
 * Serialized as its display label so stored plans stay readable.
 */
public enum WorkoutType {
    TREADMILL_INTERVALS("Treadmill intervals"),
    ZONE2_INCLINE_WALK("Zone 2 incline walk"),
    STRENGTH("Strength"),
    OUTDOOR_LONG_HIKE("Outdoor long hike"),
    RECOVERY_MOBILITY("Recovery / mobility"),
    REST_DAY("Rest day");

    private final String label;

    WorkoutType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Whether workouts of this type carry treadmill segments.
     */
    public boolean isTreadmillBased() {
        return this == TREADMILL_INTERVALS || this == ZONE2_INCLINE_WALK;
    }

    /**
     * Whether this type counts as a cardio session for capacity and strength stacking.
     */
    public boolean isCardio() {
        return isTreadmillBased() || this == OUTDOOR_LONG_HIKE;
    }

    /**
     * Long outdoor hikes and intervals are the high-load days of a week.
     */
    public boolean isHighLoad() {
        return this == OUTDOOR_LONG_HIKE || this == TREADMILL_INTERVALS;
    }

    /**
     * Lower-case, hyphenated form of the label, used in workout ids.
     */
    public String slug() {
        return label.toLowerCase().replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
    }

    @JsonCreator
    public static WorkoutType fromLabel(String value) {
        for (WorkoutType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown workout type: " + value);
    }
}
