package org.operaton.hikeprep.util;

import org.operaton.hikeprep.model.plan.ProfilePoint;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Grade arithmetic and the rounding pipeline shared by segment synthesis and scheduling.
 * Every rounded value goes through clamp, round, re-clamp in that order.
 */
public final class GradeMath {

    public static final double FEET_PER_MILE = 5280.0;

    // Guards against division by zero on duplicate or out-of-order samples
    public static final double MIN_SEGMENT_DISTANCE_MILES = 0.01;

    private GradeMath() {
    }

    /**
     * Grade in percent for an elevation change over a horizontal distance.
     *
     * @param elevationDeltaFt elevation change in feet
     * @param distanceMiles horizontal distance in miles
     * @return grade in percent, 0 for a zero distance
     */
    public static double gradePercent(double elevationDeltaFt, double distanceMiles) {
        if (distanceMiles == 0) {
            return 0;
        }
        return elevationDeltaFt / (distanceMiles * FEET_PER_MILE) * 100;
    }

    /**
     * Grades between consecutive profile points.
     *
     * @param points profile points ordered by distance
     * @return one grade per consecutive pair, empty for fewer than two points
     */
    public static List<Double> segmentGrades(List<ProfilePoint> points) {
        List<Double> grades = new ArrayList<>();
        if (points == null || points.size() < 2) {
            return grades;
        }
        for (int i = 1; i < points.size(); i++) {
            ProfilePoint previous = points.get(i - 1);
            ProfilePoint current = points.get(i);
            double distance = Math.max(current.getDistanceMiles() - previous.getDistanceMiles(), MIN_SEGMENT_DISTANCE_MILES);
            grades.add(gradePercent(current.getElevationFt() - previous.getElevationFt(), distance));
        }
        return grades;
    }

    public static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }

    public static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }

    /**
     * Rounds half-up to the nearest multiple of {@code step}.
     * The multiplication runs in decimal so 2.4 stays 2.4 and not 2.4000000000000004.
     */
    public static double roundToStep(double value, double step) {
        if (step <= 0) {
            return value;
        }
        long units = Math.round(value / step);
        return BigDecimal.valueOf(units).multiply(BigDecimal.valueOf(step)).doubleValue();
    }

    /**
     * Clamps, rounds to {@code step}, then clamps again so rounding can never leave the bounds.
     */
    public static double roundWithin(double value, double step, double min, double max) {
        return clamp(roundToStep(clamp(value, min, max), step), min, max);
    }

    public static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
