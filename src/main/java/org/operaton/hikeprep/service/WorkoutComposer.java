package org.operaton.hikeprep.service;

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.model.plan.FitnessLevel;
import org.operaton.hikeprep.model.plan.Hike;
import org.operaton.hikeprep.model.plan.ProfilePoint;
import org.operaton.hikeprep.model.plan.StrengthPhase;
import org.operaton.hikeprep.model.plan.SynthesisSettings;
import org.operaton.hikeprep.model.plan.SynthesizedWorkout;
import org.operaton.hikeprep.model.plan.TrainingDay;
import org.operaton.hikeprep.model.plan.TrainingPhase;
import org.operaton.hikeprep.model.plan.TrainingSegment;
import org.operaton.hikeprep.model.plan.TrainingWorkout;
import org.operaton.hikeprep.model.plan.WorkoutType;
import org.operaton.hikeprep.service.SessionMixPlanner.PlannedSession;
import org.operaton.hikeprep.util.GradeMath;
import org.operaton.hikeprep.util.PlanFormatter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the concrete workout for a planned session, including treadmill segments.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkoutComposer {

    static final int MIN_TREADMILL_MINUTES = 25;
    static final int MIN_ADAPTATION_MINUTES = 15;
    static final int MAX_ADAPTATION_MINUTES = 25;
    static final int MAX_STRENGTH_ADD_ONS = 2;

    private static final int MIN_ALLOCATION_MINUTES = 20;
    private static final int MAX_OUTDOOR_INCREASE_MINUTES = 20;
    private static final int ZONE2_SMOOTHING_WINDOW = 5;
    private static final double MIN_INTERVAL_SPEED = 1.8;
    private static final double HARD_INCLINE_FACTOR = 1.15;
    private static final double HARD_SPEED_FACTOR = 0.92;
    private static final double RECOVERY_INCLINE_FACTOR = 0.85;
    private static final double RECOVERY_SPEED_FACTOR = 1.08;

    private final SegmentSynthesizer segmentSynthesizer;

    /**
     * Builds the workout for one day slot.
     *
     * @param session the planned workout type for the slot
     * @param context week-level values the workout depends on
     * @return the workout, with segments for treadmill-based types
     */
    public TrainingWorkout buildWorkout(PlannedSession session, WorkoutContext context) {
        WorkoutType type = session.type();
        String id = context.getWeekNumber() + "-" + (context.getSlot() + 1) + "-" + type.slug();

        return switch (type) {
            case TREADMILL_INTERVALS -> intervalWorkout(id, context);
            case ZONE2_INCLINE_WALK -> zone2Workout(id, session.longSession(), context);
            case OUTDOOR_LONG_HIKE -> TrainingWorkout.builder()
                .id(id)
                .type(type)
                .durationMinutes(outdoorMinutes(context))
                .notes("Focus on time-on-feet with "
                    + PlanFormatter.formatFeet(context.getHike().getElevationGainFt() * 0.3) + " ft of climbing.")
                .build();
            case STRENGTH -> strengthWorkout(id, StrengthPhase.forPhase(context.getPhase()));
            case RECOVERY_MOBILITY -> TrainingWorkout.builder()
                .id(id)
                .type(type)
                .durationMinutes(adaptedMinutes(allocate(context.getWeekVolume(), type), context))
                .notes("Easy mobility, light stretching.")
                .build();
            case REST_DAY -> TrainingWorkout.builder()
                .id(id)
                .type(type)
                .durationMinutes(0)
                .notes("Rest day.")
                .build();
        };
    }

    /**
     * Appends strength to the first cardio days of the week, at most two.
     *
     * @param days the week's days in calendar order
     * @param requested strength sessions requested on cardio days
     * @param phase strength phase of the week
     * @return the days with add-ons attached
     */
    public List<TrainingDay> attachStrengthAddOns(List<TrainingDay> days, int requested, StrengthPhase phase) {
        long cardioDays = days.stream().filter(this::isCardioDay).count();
        int remaining = (int) Math.min(Math.min(requested, MAX_STRENGTH_ADD_ONS), cardioDays);

        List<TrainingDay> result = new ArrayList<>(days.size());
        for (TrainingDay day : days) {
            if (remaining > 0 && isCardioDay(day)) {
                TrainingWorkout addOn = strengthWorkout(day.getDate() + "-strength-addon", phase);
                result.add(day.toBuilder().workout(addOn).build());
                remaining--;
            } else {
                result.add(day);
            }
        }
        return result;
    }

    /**
     * Straight line from the trailhead to the summit when the profile is too sparse to derive grades.
     */
    List<ProfilePoint> effectiveProfile(Hike hike) {
        if (hike.getProfilePoints() != null && hike.getProfilePoints().size() >= 2) {
            return hike.getProfilePoints();
        }
        return List.of(ProfilePoint.of(0, 0), ProfilePoint.of(hike.getDistanceMiles(), hike.getElevationGainFt()));
    }

    private TrainingWorkout intervalWorkout(String id, WorkoutContext context) {
        int duration = treadmillMinutes(allocate(context.getWeekVolume(), WorkoutType.TREADMILL_INTERVALS), context);
        SynthesizedWorkout synthesized = synthesize(duration, context);

        List<TrainingSegment> segments = synthesized.getSegments();
        List<TrainingSegment> patterned = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            TrainingSegment segment = segments.get(i);
            if (i == 0 || i == segments.size() - 1) {
                patterned.add(segment);
                continue;
            }
            boolean hard = i % 2 == 1;
            double incline = segment.getInclinePct() * (hard ? HARD_INCLINE_FACTOR : RECOVERY_INCLINE_FACTOR);
            double speed = segment.getSpeedMph() * (hard ? HARD_SPEED_FACTOR : RECOVERY_SPEED_FACTOR);
            double maxSpeed = context.getMaxSpeedMph();
            patterned.add(segment.toBuilder()
                .inclinePct(GradeMath.roundWithin(incline, 0.5, 0, context.getInclineCap()))
                .speedMph(GradeMath.roundWithin(speed, 0.1, Math.min(MIN_INTERVAL_SPEED, maxSpeed), maxSpeed))
                .note(segment.getNote() != null ? segment.getNote() : hard ? "Hard interval" : "Recovery")
                .build());
        }

        return TrainingWorkout.builder()
            .id(id)
            .type(WorkoutType.TREADMILL_INTERVALS)
            .durationMinutes(synthesized.getTotalMinutes())
            .notes(context.getPhase().isReduced()
                ? "Shorter intervals, keep effort smooth."
                : "Incline intervals based on hike profile.")
            .segments(patterned)
            .build();
    }

    private TrainingWorkout zone2Workout(String id, boolean longSession, WorkoutContext context) {
        int allocation = allocate(context.getWeekVolume(), WorkoutType.ZONE2_INCLINE_WALK);
        int target = longSession
            ? Math.max(allocation, context.getLongSessionTarget())
            : (int) Math.round(allocation * 0.9);
        SynthesizedWorkout synthesized = synthesize(treadmillMinutes(target, context), context);

        List<TrainingSegment> segments = synthesized.getSegments();
        List<Double> inclines = segments.stream().map(TrainingSegment::getInclinePct).toList();
        List<TrainingSegment> steady = new ArrayList<>(segments.size());
        int half = ZONE2_SMOOTHING_WINDOW / 2;
        for (int i = 0; i < segments.size(); i++) {
            if (i == 0 || i == segments.size() - 1) {
                steady.add(segments.get(i));
                continue;
            }
            // Window stays inside the main phase
            List<Double> window = inclines.subList(Math.max(1, i - half), Math.min(segments.size() - 1, i + half + 1));
            steady.add(segments.get(i).toBuilder()
                .inclinePct(GradeMath.roundWithin(GradeMath.average(window), 0.5, 0, context.getInclineCap()))
                .build());
        }

        double cap = context.getInclineCap();
        return TrainingWorkout.builder()
            .id(id)
            .type(WorkoutType.ZONE2_INCLINE_WALK)
            .durationMinutes(synthesized.getTotalMinutes())
            .inclineTarget(GradeMath.roundWithin(context.getAverageGradePct(), 0.5, Math.min(2, cap), cap))
            .notes("Steady state, nose-breathing effort.")
            .segments(steady)
            .build();
    }

    private TrainingWorkout strengthWorkout(String id, StrengthPhase phase) {
        return TrainingWorkout.builder()
            .id(id)
            .type(WorkoutType.STRENGTH)
            .durationMinutes(phase.getDurationMinutes())
            .notes(phase.getNotes())
            .build();
    }

    private SynthesizedWorkout synthesize(int targetMinutes, WorkoutContext context) {
        SynthesisSettings settings = SynthesisSettings.builder()
            .fitnessLevel(context.getFitnessLevel())
            .targetDurationMinutes(targetMinutes)
            .packWeightLbs(0)
            .minInclinePercent(0)
            .maxInclinePercent(context.getInclineCap())
            .maxSpeedMph(context.getMaxSpeedMph())
            .build();
        Hike hike = context.getHike();
        return segmentSynthesizer.synthesize(effectiveProfile(hike), hike.getDistanceMiles(),
            hike.getElevationGainFt(), settings);
    }

    private int outdoorMinutes(WorkoutContext context) {
        int previous = context.getPreviousOutdoorMinutes();
        int target = Math.max(context.getLongSessionTarget(), previous);
        return adaptedMinutes(Math.min(target, previous + MAX_OUTDOOR_INCREASE_MINUTES), context);
    }

    private int treadmillMinutes(int minutes, WorkoutContext context) {
        if (context.getPhase() == TrainingPhase.ADAPTATION) {
            return adaptationMinutes(context);
        }
        return GradeMath.clamp(minutes, MIN_TREADMILL_MINUTES, maxTreadmillMinutes(context.getFitnessLevel()));
    }

    private int adaptedMinutes(int minutes, WorkoutContext context) {
        return context.getPhase() == TrainingPhase.ADAPTATION ? adaptationMinutes(context) : minutes;
    }

    // Adaptation weeks split the week's volume evenly over the scheduled days
    private int adaptationMinutes(WorkoutContext context) {
        int perDay = (int) Math.round(context.getWeekVolume() / (double) Math.max(context.getScheduledDays(), 1));
        return GradeMath.clamp(perDay, MIN_ADAPTATION_MINUTES, MAX_ADAPTATION_MINUTES);
    }

    private int allocate(int weekVolume, WorkoutType type) {
        double weight = switch (type) {
            case OUTDOOR_LONG_HIKE -> 0.35;
            case TREADMILL_INTERVALS, ZONE2_INCLINE_WALK -> 0.25;
            case STRENGTH -> 0.15;
            case RECOVERY_MOBILITY -> 0.10;
            case REST_DAY -> 0;
        };
        return Math.max(MIN_ALLOCATION_MINUTES, (int) Math.round(weekVolume * weight));
    }

    private int maxTreadmillMinutes(FitnessLevel fitnessLevel) {
        return switch (fitnessLevel) {
            case BEGINNER -> 60;
            case INTERMEDIATE -> 75;
            case ADVANCED -> 90;
        };
    }

    private boolean isCardioDay(TrainingDay day) {
        return day.getWorkouts().stream().anyMatch(workout -> workout.getType().isCardio());
    }

    /**
     * Week-level values a single workout depends on.
     */
    @Value
    @Builder
    public static class WorkoutContext {
        int weekNumber;
        /** 0-based slot within the week. */
        int slot;
        TrainingPhase phase;
        int weekVolume;
        int scheduledDays;
        int longSessionTarget;
        double inclineCap;
        int previousOutdoorMinutes;
        double averageGradePct;
        FitnessLevel fitnessLevel;
        double maxSpeedMph;
        Hike hike;
    }
}
