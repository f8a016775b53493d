package org.operaton.hikeprep.model.plan;

/**
 * Periodization phase of a training week.
 */
public enum TrainingPhase {
    ADAPTATION("Adaptation week: focus on consistency and easy effort.", "Adaptation: building consistency"),
    TAPER("Taper week: reduce volume, keep a little intensity.", "Taper: reduce volume, stay sharp"),
    DELOAD("Deload week: reduce volume and focus on recovery.", "Deload: emphasize recovery"),
    PEAK("Build week: small volume increase.", "Peak: hike-specific endurance"),
    BUILD("Build week: small volume increase.", "Build: increasing time-on-feet");

    private final String note;
    private final String focus;

    TrainingPhase(String note, String focus) {
        this.note = note;
        this.focus = focus;
    }

    public String getNote() {
        return note;
    }

    public String getFocus() {
        return focus;
    }

    /**
     * Weeks in which treadmill work stays at Zone 2 effort.
     */
    public boolean isReduced() {
        return this == DELOAD || this == TAPER;
    }
}
