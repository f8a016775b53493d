package org.operaton.hikeprep.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.model.plan.FitnessLevel;
import org.operaton.hikeprep.model.plan.ProfilePoint;
import org.operaton.hikeprep.model.plan.SynthesisSettings;
import org.operaton.hikeprep.model.plan.SynthesizedWorkout;
import org.operaton.hikeprep.model.plan.TrainingSegment;
import org.operaton.hikeprep.util.GradeMath;
import org.operaton.hikeprep.util.PlanFormatter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a hike's elevation profile into timed treadmill segments.
 * Produces a warm-up, a grade-following main phase and a cool-down whose
 * minutes add up to the requested duration.
 */
@Service
@Slf4j
public class SegmentSynthesizer {

    static final int WARM_UP_MINUTES = 5;
    static final int COOL_DOWN_MINUTES = 5;
    static final int MIN_MAIN_MINUTES = 5;
    static final int MIN_TOTAL_MINUTES = WARM_UP_MINUTES + COOL_DOWN_MINUTES + MIN_MAIN_MINUTES;

    // Resampling bounds for the main phase
    static final int MIN_SEGMENTS = 10;
    static final int MAX_SEGMENTS = 30;

    private static final double MINUTE_STEP = 0.5;
    private static final double INCLINE_STEP = 0.5;
    private static final double SPEED_STEP = 0.1;

    private static final double GRADE_SPEED_PENALTY = 0.08;     // mph per % incline
    private static final double DOWNHILL_BOOST_PER_PERCENT = 0.03;
    private static final double MAX_DOWNHILL_BOOST_SHARE = 0.3; // of the bracket range
    private static final double PACK_SPEED_PENALTY_PER_LB = 0.01;
    private static final double ELEVATION_EFFORT_WEIGHT = 1.4;  // per 1000 ft of gain

    private static final double WARM_UP_INCLINE = 1.0;
    private static final double COOL_DOWN_INCLINE = 0.5;
    private static final double WARM_UP_MIN_SPEED = 1.8;
    private static final double COOL_DOWN_MIN_SPEED = 1.6;
    private static final double COOL_DOWN_SPEED_DROP = 0.2;

    /**
     * Synthesizes a treadmill workout from a hike profile.
     *
     * @param profile profile points ordered by distance
     * @param distanceMiles total hike distance, used for the automatic duration
     * @param elevationGainFt total hike gain, used for the automatic duration
     * @param settings fitness level, duration, pack weight and treadmill limits
     * @return the total minutes and the ordered segments
     */
    public SynthesizedWorkout synthesize(
        List<ProfilePoint> profile,
        double distanceMiles,
        double elevationGainFt,
        SynthesisSettings settings
    ) {
        int baseDuration = settings.isAutoDuration()
            ? estimateDurationMinutes(distanceMiles, elevationGainFt, settings.getFitnessLevel())
            : settings.getTargetDurationMinutes();
        int totalMinutes = Math.max(baseDuration, MIN_TOTAL_MINUTES);
        int mainMinutes = totalMinutes - WARM_UP_MINUTES - COOL_DOWN_MINUTES;

        List<SegmentDraft> drafts = normalizeSegmentCount(buildDrafts(profile));
        List<Double> smoothedGrades = smoothGrades(drafts.stream().map(SegmentDraft::gradePercent).toList());

        SynthesizedWorkout.SynthesizedWorkoutBuilder workout = SynthesizedWorkout.builder()
            .totalMinutes(totalMinutes)
            .segment(warmUp(settings));

        List<TrainingSegment> mainPhase = buildMainPhase(drafts, smoothedGrades, mainMinutes, settings);
        workout.segments(mainPhase);
        workout.segment(coolDown(settings, mainPhase.size() + 1));

        log.debug("Synthesized {} main segments over {} minutes ({} profile points)",
            mainPhase.size(), totalMinutes, profile == null ? 0 : profile.size());

        return workout.build();
    }

    /**
     * Estimates how long the hike's profile takes on a treadmill at the given level:
     * flat pace plus a per-1000-ft climbing penalty.
     *
     * @return whole minutes
     */
    public int estimateDurationMinutes(double distanceMiles, double elevationGainFt, FitnessLevel fitnessLevel) {
        double flatMinutes = distanceMiles / flatPaceMph(fitnessLevel) * 60;
        double elevationPenalty = elevationGainFt / 1000 * climbPenaltyMinutes(fitnessLevel);
        return (int) Math.round(flatMinutes + elevationPenalty);
    }

    private List<TrainingSegment> buildMainPhase(
        List<SegmentDraft> drafts,
        List<Double> grades,
        int mainMinutes,
        SynthesisSettings settings
    ) {
        List<TrainingSegment> segments = new ArrayList<>();
        if (drafts.isEmpty()) {
            return segments;
        }

        double totalEffort = drafts.stream().mapToDouble(SegmentDraft::effortScore).sum();
        if (totalEffort <= 0) {
            totalEffort = 1;
        }
        String packNote = settings.getPackWeightLbs() > 0
            ? "Pack weight " + PlanFormatter.formatDecimal(settings.getPackWeightLbs()) + " lbs"
            : null;

        // Cumulative allocation: the rounded end of each segment is fixed, so the last one absorbs the remainder
        double cumulativeEffort = 0;
        double previousEnd = 0;
        int index = 1;
        for (int i = 0; i < drafts.size(); i++) {
            cumulativeEffort += drafts.get(i).effortScore();
            double end = i == drafts.size() - 1
                ? mainMinutes
                : GradeMath.roundWithin(mainMinutes * cumulativeEffort / totalEffort, MINUTE_STEP, previousEnd, mainMinutes);
            double minutes = end - previousEnd;
            previousEnd = end;
            if (minutes <= 0) {
                continue;
            }

            double incline = GradeMath.clamp(grades.get(i), settings.getMinInclinePercent(), settings.getMaxInclinePercent());
            double speed = computeSpeed(incline, settings);

            segments.add(TrainingSegment.builder()
                .index(index++)
                .minutes(minutes)
                .inclinePct(GradeMath.roundWithin(incline, INCLINE_STEP,
                    settings.getMinInclinePercent(), settings.getMaxInclinePercent()))
                .speedMph(GradeMath.roundWithin(speed, SPEED_STEP, 0, settings.getMaxSpeedMph()))
                .note(packNote)
                .build());
        }
        return segments;
    }

    private TrainingSegment warmUp(SynthesisSettings settings) {
        return TrainingSegment.builder()
            .index(0)
            .minutes(WARM_UP_MINUTES)
            .inclinePct(GradeMath.roundWithin(WARM_UP_INCLINE, INCLINE_STEP,
                settings.getMinInclinePercent(), settings.getMaxInclinePercent()))
            .speedMph(GradeMath.roundWithin(warmUpSpeed(settings.getFitnessLevel()), SPEED_STEP,
                WARM_UP_MIN_SPEED, settings.getMaxSpeedMph()))
            .note("Warm-up")
            .build();
    }

    private TrainingSegment coolDown(SynthesisSettings settings, int index) {
        double coolDownSpeed = Math.max(
            warmUpSpeed(settings.getFitnessLevel()) - COOL_DOWN_SPEED_DROP,
            speedBracket(settings.getFitnessLevel()).min());
        return TrainingSegment.builder()
            .index(index)
            .minutes(COOL_DOWN_MINUTES)
            .inclinePct(GradeMath.roundWithin(COOL_DOWN_INCLINE, INCLINE_STEP,
                settings.getMinInclinePercent(), settings.getMaxInclinePercent()))
            .speedMph(GradeMath.roundWithin(coolDownSpeed, SPEED_STEP, COOL_DOWN_MIN_SPEED, settings.getMaxSpeedMph()))
            .note("Cool-down")
            .build();
    }

    /**
     * Converts consecutive profile points into grade drafts.
     */
    List<SegmentDraft> buildDrafts(List<ProfilePoint> points) {
        List<SegmentDraft> drafts = new ArrayList<>();
        if (points == null || points.size() < 2) {
            return drafts;
        }
        for (int i = 1; i < points.size(); i++) {
            ProfilePoint previous = points.get(i - 1);
            ProfilePoint current = points.get(i);
            double distance = Math.max(current.getDistanceMiles() - previous.getDistanceMiles(),
                GradeMath.MIN_SEGMENT_DISTANCE_MILES);
            double elevationDelta = current.getElevationFt() - previous.getElevationFt();
            drafts.add(new SegmentDraft(distance, elevationDelta, GradeMath.gradePercent(elevationDelta, distance)));
        }
        return drafts;
    }

    /**
     * Resamples drafts so the main phase has between 10 and 30 segments,
     * independent of how densely the profile was sampled.
     */
    List<SegmentDraft> normalizeSegmentCount(List<SegmentDraft> drafts) {
        if (drafts.isEmpty()) {
            return drafts;
        }

        List<SegmentDraft> normalized = new ArrayList<>(drafts);

        while (normalized.size() < MIN_SEGMENTS) {
            List<SegmentDraft> expanded = new ArrayList<>(normalized.size() * 2);
            for (SegmentDraft draft : normalized) {
                SegmentDraft half = new SegmentDraft(draft.distanceMiles() / 2, draft.elevationDeltaFt() / 2,
                    draft.gradePercent());
                expanded.add(half);
                expanded.add(half);
            }
            normalized = expanded;
        }

        while (normalized.size() > MAX_SEGMENTS) {
            int groupSize = (int) Math.ceil(normalized.size() / (double) MAX_SEGMENTS);
            List<SegmentDraft> grouped = new ArrayList<>();
            for (int i = 0; i < normalized.size(); i += groupSize) {
                List<SegmentDraft> group = normalized.subList(i, Math.min(i + groupSize, normalized.size()));
                double distance = group.stream().mapToDouble(SegmentDraft::distanceMiles).sum();
                double elevation = group.stream().mapToDouble(SegmentDraft::elevationDeltaFt).sum();
                grouped.add(new SegmentDraft(distance, elevation, GradeMath.gradePercent(elevation, distance)));
            }
            normalized = grouped;
        }

        return normalized;
    }

    /**
     * Centered moving average with a window of 3; edges average the neighbours they have.
     */
    List<Double> smoothGrades(List<Double> grades) {
        List<Double> smoothed = new ArrayList<>(grades.size());
        for (int i = 0; i < grades.size(); i++) {
            int start = Math.max(0, i - 1);
            int end = Math.min(grades.size(), i + 2);
            smoothed.add(GradeMath.average(grades.subList(start, end)));
        }
        return smoothed;
    }

    private double computeSpeed(double incline, SynthesisSettings settings) {
        SpeedBracket bracket = speedBracket(settings.getFitnessLevel());
        double range = bracket.max() - bracket.min();
        double gradePenalty = Math.max(incline, 0) * GRADE_SPEED_PENALTY;
        double downhillBoost = incline < 0
            ? Math.min(Math.abs(incline) * DOWNHILL_BOOST_PER_PERCENT, range * MAX_DOWNHILL_BOOST_SHARE)
            : 0;

        double speed = bracket.max() - gradePenalty + downhillBoost;
        if (settings.getPackWeightLbs() > 0) {
            speed -= settings.getPackWeightLbs() * PACK_SPEED_PENALTY_PER_LB;
        }

        return GradeMath.clamp(speed, bracket.min(), Math.min(settings.getMaxSpeedMph(), bracket.max()));
    }

    private SpeedBracket speedBracket(FitnessLevel fitnessLevel) {
        return switch (fitnessLevel) {
            case BEGINNER -> new SpeedBracket(2.0, 3.2);
            case INTERMEDIATE -> new SpeedBracket(2.8, 4.2);
            case ADVANCED -> new SpeedBracket(3.2, 5.0);
        };
    }

    private double warmUpSpeed(FitnessLevel fitnessLevel) {
        return switch (fitnessLevel) {
            case BEGINNER -> 2.0;
            case INTERMEDIATE -> 2.6;
            case ADVANCED -> 3.0;
        };
    }

    private double flatPaceMph(FitnessLevel fitnessLevel) {
        return switch (fitnessLevel) {
            case BEGINNER -> 2.4;
            case INTERMEDIATE -> 3.2;
            case ADVANCED -> 4.0;
        };
    }

    private double climbPenaltyMinutes(FitnessLevel fitnessLevel) {
        return switch (fitnessLevel) {
            case BEGINNER -> 12;
            case INTERMEDIATE -> 9;
            case ADVANCED -> 7;
        };
    }

    record SegmentDraft(double distanceMiles, double elevationDeltaFt, double gradePercent) {

        double effortScore() {
            return distanceMiles + Math.max(elevationDeltaFt, 0) / 1000 * ELEVATION_EFFORT_WEIGHT;
        }
    }

    private record SpeedBracket(double min, double max) {
    }
}
