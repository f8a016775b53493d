package org.operaton.hikeprep.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.model.plan.Hike;
import org.operaton.hikeprep.util.GradeMath;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives what a hike demands from the hiker and the peak targets a plan should reach.
 */
@Service
@Slf4j
public class HikeDemandCalculator {

    private static final double HIKE_PACE_MPH = 3.0;
    private static final double HOURS_PER_1000_FT = 0.5;
    private static final int SUSTAINED_WINDOW = 3;

    /**
     * Estimates hike duration and grade statistics.
     * Duration uses a flat 3 mph pace plus half an hour per 1000 ft of gain.
     */
    public HikeDemands deriveHikeDemands(Hike hike) {
        int duration = (int) Math.round(
            (hike.getDistanceMiles() / HIKE_PACE_MPH + hike.getElevationGainFt() / 1000 * HOURS_PER_1000_FT) * 60);

        List<Double> grades = GradeMath.segmentGrades(hike.getProfilePoints());
        double averageGrade = GradeMath.average(grades);
        double maxSustained = averageGrade;
        for (int i = 0; i < grades.size(); i++) {
            List<Double> window = grades.subList(i, Math.min(i + SUSTAINED_WINDOW, grades.size()));
            maxSustained = Math.max(maxSustained, GradeMath.average(window));
        }

        HikeDemands demands = new HikeDemands(duration, hike.getElevationGainFt(), averageGrade, maxSustained);
        log.debug("Hike demands: {}", demands);
        return demands;
    }

    /**
     * Scales the demands down to what the peak week should reach for a plan of the given length.
     */
    public PeakTargets buildPeakTargets(HikeDemands demands, int totalWeeks) {
        double durationFactor = totalWeeks >= 8 ? 0.85 : totalWeeks >= 4 ? 0.78 : 0.7;
        double inclineFactor = totalWeeks >= 8 ? 0.8 : 0.7;
        double volumeMultiplier = totalWeeks >= 8 ? 1.8 : 1.5;

        return new PeakTargets(
            (int) Math.round(demands.estimatedHikeDurationMinutes() * durationFactor),
            GradeMath.clamp(demands.averageGradePct() * inclineFactor, 2, 12),
            (int) Math.round(demands.estimatedHikeDurationMinutes() * volumeMultiplier));
    }

    /**
     * Typical minimum preparation time for a hike of this size.
     *
     * @return weeks of preparation
     */
    public int minPrepWeeks(double distanceMiles, double elevationGainFt) {
        if (distanceMiles <= 5 && elevationGainFt <= 1000) {
            return 4;
        }
        if (distanceMiles <= 8 || elevationGainFt <= 3000) {
            return 6;
        }
        if (distanceMiles >= 12 || elevationGainFt >= 4500) {
            return 12;
        }
        return 8;
    }

    public record HikeDemands(
        int estimatedHikeDurationMinutes,
        double totalElevationGainFt,
        double averageGradePct,
        double maxSustainedGradePct
    ) {
    }

    public record PeakTargets(int longSessionTarget, double sustainedInclineTarget, int weeklyVolumeTarget) {
    }
}
