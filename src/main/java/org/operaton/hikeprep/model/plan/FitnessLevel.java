package org.operaton.hikeprep.model.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Self-reported fitness level of the hiker.
 * Drives pace estimates, treadmill speed brackets and duration ceilings.
 */
public enum FitnessLevel {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    ADVANCED("Advanced");

    private final String label;

    FitnessLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Resolves a fitness level from its display label or enum name, ignoring case.
     *
     * @param value the label (e.g. "Intermediate") or name (e.g. "INTERMEDIATE")
     * @return the matching fitness level
     * @throws IllegalArgumentException if the value matches no level
     */
    @JsonCreator
    public static FitnessLevel fromValue(String value) {
        for (FitnessLevel level : values()) {
            if (level.label.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown fitness level: " + value);
    }
}
