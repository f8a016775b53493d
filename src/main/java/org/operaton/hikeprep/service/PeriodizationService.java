package org.operaton.hikeprep.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.model.plan.TrainingPhase;
import org.operaton.hikeprep.util.GradeMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Weekly volume curve and per-week progression of a training plan.
 * Build weeks grow by at most 7%, every 4th week is a deload and the final week a taper.
 */
@Service
@Slf4j
public class PeriodizationService {

    static final int LOW_BASELINE_MINUTES = 30;
    static final int DELOAD_INTERVAL_WEEKS = 4;

    private static final int NEW_TRAINEE_START_MINUTES = 45;
    private static final int MIN_START_MINUTES = 30;
    private static final double WEEKLY_GROWTH = 1.07;
    private static final double WEEKLY_GROWTH_CEILING = 1.1;
    private static final double DELOAD_FACTOR = 0.78;
    private static final double TAPER_FACTOR = 0.55;
    private static final int FIRST_WEEK_CAP = 60;
    private static final int SECOND_WEEK_CAP = 75;
    private static final double BASE_INCLINE = 3.0;

    /**
     * Builds the weekly volume targets in minutes, one entry per week.
     *
     * @param baselineMinutes current weekly exercise minutes
     * @param totalWeeks number of weeks in the plan, at least 1
     * @param weeklyTarget weekly volume the build weeks ramp towards
     * @return volumes for weeks 1..totalWeeks
     */
    public List<Integer> buildWeeklyVolumes(int baselineMinutes, int totalWeeks, int weeklyTarget) {
        List<Integer> volumes = new ArrayList<>();
        boolean lowBaseline = baselineMinutes <= LOW_BASELINE_MINUTES;

        if (totalWeeks <= 1) {
            volumes.add(lowBaseline ? NEW_TRAINEE_START_MINUTES : Math.max(20, (int) Math.round(baselineMinutes * 0.85)));
            return volumes;
        }

        int lastBuild = lowBaseline ? NEW_TRAINEE_START_MINUTES : Math.max(MIN_START_MINUTES, baselineMinutes);
        int peakWeek = peakWeek(totalWeeks);

        for (int week = 1; week <= totalWeeks; week++) {
            if (week == totalWeeks) {
                int peak = Math.max(volumes.stream().mapToInt(Integer::intValue).max().orElse(0), lastBuild);
                volumes.add((int) Math.round(peak * TAPER_FACTOR));
                continue;
            }
            if (week % DELOAD_INTERVAL_WEEKS == 0) {
                volumes.add((int) Math.round(lastBuild * DELOAD_FACTOR));
                continue;
            }

            int remainingWeeks = Math.max(peakWeek - week + 1, 1);
            double targetStep = (weeklyTarget - lastBuild) / (double) remainingWeeks;
            double nextBuild = Math.min(Math.min(lastBuild * WEEKLY_GROWTH, lastBuild * WEEKLY_GROWTH_CEILING),
                lastBuild + targetStep);
            lastBuild = (int) Math.round(Math.max(lastBuild, nextBuild));
            volumes.add(lastBuild);
        }

        if (lowBaseline) {
            volumes.set(0, Math.min(volumes.get(0), FIRST_WEEK_CAP));
            volumes.set(1, Math.min(volumes.get(1), SECOND_WEEK_CAP));
        }

        log.debug("Weekly volumes for baseline {} over {} weeks: {}", baselineMinutes, totalWeeks, volumes);
        return volumes;
    }

    /**
     * Resolves the phase of a week. Adaptation wins over taper, taper over deload,
     * deload over peak.
     *
     * @param weekNumber 1-based week number
     */
    public TrainingPhase phaseOf(int weekNumber, int totalWeeks, int baselineMinutes) {
        if (isAdaptationWeek(weekNumber, baselineMinutes)) {
            return TrainingPhase.ADAPTATION;
        }
        if (weekNumber == totalWeeks) {
            return TrainingPhase.TAPER;
        }
        if (weekNumber % DELOAD_INTERVAL_WEEKS == 0) {
            return TrainingPhase.DELOAD;
        }
        if (weekNumber == totalWeeks - 1) {
            return TrainingPhase.PEAK;
        }
        return TrainingPhase.BUILD;
    }

    public boolean isAdaptationWeek(int weekNumber, int baselineMinutes) {
        return baselineMinutes <= LOW_BASELINE_MINUTES && weekNumber <= 2;
    }

    /**
     * Minutes the week's long session should reach, ramping linearly from the
     * hiker's current long session to the peak target.
     */
    public int longSessionTarget(int baselineMinutes, int peakLongTarget, int weekNumber, int totalWeeks) {
        if (isAdaptationWeek(weekNumber, baselineMinutes)) {
            return (int) Math.round(GradeMath.clamp(peakLongTarget * 0.25, 15, 30));
        }
        double baselineLong = Math.max(20, baselineMinutes * 0.4);
        return (int) Math.round(baselineLong + (peakLongTarget - baselineLong) * progress(weekNumber, totalWeeks));
    }

    /**
     * Treadmill incline ceiling for the week, ramping from 3% towards the peak incline target.
     */
    public double weekInclineCap(double maxInclinePercent, double peakInclineTarget, int weekNumber, int totalWeeks,
                                 int baselineMinutes) {
        if (isAdaptationWeek(weekNumber, baselineMinutes)) {
            return Math.min(maxInclinePercent, BASE_INCLINE);
        }
        double target = BASE_INCLINE + (peakInclineTarget - BASE_INCLINE) * progress(weekNumber, totalWeeks);
        return Math.min(maxInclinePercent, Math.max(BASE_INCLINE, target));
    }

    /**
     * Describes the change against the previous week, or null when the volume is unchanged.
     */
    public String progressionNote(int previousVolume, int currentVolume) {
        if (previousVolume <= 0 || previousVolume == currentVolume) {
            return null;
        }
        long percent = Math.round(Math.abs(currentVolume - previousVolume) * 100.0 / previousVolume);
        if (percent == 0) {
            return null;
        }
        return currentVolume > previousVolume
            ? "Progression: +" + percent + "% volume vs last week."
            : "Volume -" + percent + "% vs last week.";
    }

    int peakWeek(int totalWeeks) {
        return Math.max(totalWeeks - 1, 1);
    }

    private double progress(int weekNumber, int totalWeeks) {
        return Math.min(weekNumber / (double) peakWeek(totalWeeks), 1);
    }
}
