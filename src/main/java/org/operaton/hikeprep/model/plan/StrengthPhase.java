package org.operaton.hikeprep.model.plan;

/**
 * Strength emphasis of a week, with the fixed block length used for every strength workout.
 */
public enum StrengthPhase {
    MOVEMENT_PREP("movement prep & injury prevention", 20, "Movement prep & injury prevention."),
    LEG_STRENGTH("leg strength + core", 28, "Strength to support climbing endurance."),
    MAINTENANCE("maintenance strength", 18, "Maintain strength, avoid fatigue."),
    RECOVERY("reduced strength for recovery", 15, "Strength reduced for recovery."),
    LIGHT_MOBILITY("light mobility for recovery", 15, "Light mobility only, keep legs fresh.");

    private final String label;
    private final int durationMinutes;
    private final String notes;

    StrengthPhase(String label, int durationMinutes, String notes) {
        this.label = label;
        this.durationMinutes = durationMinutes;
        this.notes = notes;
    }

    public String getLabel() {
        return label;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public String getNotes() {
        return notes;
    }

    public static StrengthPhase forPhase(TrainingPhase phase) {
        return switch (phase) {
            case ADAPTATION -> MOVEMENT_PREP;
            case TAPER -> LIGHT_MOBILITY;
            case DELOAD -> RECOVERY;
            case PEAK -> MAINTENANCE;
            case BUILD -> LEG_STRENGTH;
        };
    }
}
