package org.operaton.hikeprep.util;

import org.operaton.hikeprep.model.dto.HikeRequest;
import org.operaton.hikeprep.model.dto.ProfilePointRequest;
import org.operaton.hikeprep.model.dto.TrainingPlanRequest;
import org.operaton.hikeprep.model.dto.TreadmillWorkoutRequest;
import org.operaton.hikeprep.model.plan.Hike;
import org.operaton.hikeprep.model.plan.ProfilePoint;
import org.operaton.hikeprep.model.plan.StrengthSettings;
import org.operaton.hikeprep.model.plan.SynthesisSettings;
import org.operaton.hikeprep.model.plan.TrainingConstraints;
import org.operaton.hikeprep.model.plan.TrainingPlanInputs;
import org.operaton.hikeprep.service.WeekDayScheduler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps request DTOs onto the scheduler's domain types.
 */
@Component
public class TrainingPlanRequestMapper {

    private final Clock clock;
    private final WeekDayScheduler weekDayScheduler;
    private final int defaultBaselineMinutes;
    private final boolean defaultAnyDays;
    private final boolean defaultFillActiveRecoveryDays;

    public TrainingPlanRequestMapper(
        Clock clock,
        WeekDayScheduler weekDayScheduler,
        @Value("${hikeprep.planner.default-baseline-minutes:30}") int defaultBaselineMinutes,
        @Value("${hikeprep.planner.default-any-days:true}") boolean defaultAnyDays,
        @Value("${hikeprep.planner.default-fill-active-recovery-days:true}") boolean defaultFillActiveRecoveryDays
    ) {
        this.clock = clock;
        this.weekDayScheduler = weekDayScheduler;
        this.defaultBaselineMinutes = defaultBaselineMinutes;
        this.defaultAnyDays = defaultAnyDays;
        this.defaultFillActiveRecoveryDays = defaultFillActiveRecoveryDays;
    }

    /**
     * The default training start date: the Monday after today.
     */
    public LocalDate defaultStartDate() {
        return weekDayScheduler.nextMonday(LocalDate.now(clock));
    }

    /**
     * Fills omitted optional fields with the configured defaults.
     *
     * @param request the request as received
     * @return a copy with defaults applied
     */
    public TrainingPlanRequest withDefaults(TrainingPlanRequest request) {
        TrainingPlanRequest.TrainingPlanRequestBuilder builder = request.toBuilder();
        if (request.getTrainingStartDate() == null) {
            builder.trainingStartDate(defaultStartDate());
        }
        if (request.getPreferredDays() == null) {
            builder.preferredDays(new ArrayList<>());
        }
        if (request.getAnyDays() == null) {
            builder.anyDays(defaultAnyDays);
        }
        if (request.getBaselineMinutes() == null) {
            builder.baselineMinutes(defaultBaselineMinutes);
        }
        if (request.getTreadmillSessionsPerWeek() == null) {
            builder.treadmillSessionsPerWeek(0);
        }
        if (request.getOutdoorHikesPerWeek() == null) {
            builder.outdoorHikesPerWeek(0);
        }
        if (request.getIncludeStrength() == null) {
            builder.includeStrength(false);
        }
        if (request.getStrengthSessionsPerWeek() == null) {
            builder.strengthSessionsPerWeek(0);
        }
        if (request.getStrengthOnCardioDays() == null) {
            builder.strengthOnCardioDays(false);
        }
        if (request.getFillActiveRecoveryDays() == null) {
            builder.fillActiveRecoveryDays(defaultFillActiveRecoveryDays);
        }
        return builder.build();
    }

    /**
     * Converts a validated request with defaults applied into scheduler inputs.
     */
    public TrainingPlanInputs toInputs(TrainingPlanRequest request) {
        return TrainingPlanInputs.builder()
            .hike(toHike(request.getHike()))
            .fitnessLevel(request.getFitnessLevel())
            .trainingStartDate(request.getTrainingStartDate())
            .targetDate(request.getTargetDate())
            .daysPerWeek(request.getDaysPerWeek())
            .preferredDays(request.getPreferredDays().stream().distinct().toList())
            .anyDays(request.getAnyDays())
            .baselineMinutes(request.getBaselineMinutes())
            .constraints(TrainingConstraints.builder()
                .treadmillMaxInclinePercent(request.getTreadmillMaxInclinePercent())
                .treadmillSessionsPerWeek(request.getTreadmillSessionsPerWeek())
                .outdoorHikesPerWeek(request.getOutdoorHikesPerWeek())
                .maxSpeedMph(request.getMaxSpeedMph())
                .build())
            .strength(StrengthSettings.builder()
                .includeStrength(request.getIncludeStrength())
                .sessionsPerWeek(request.getIncludeStrength() ? request.getStrengthSessionsPerWeek() : 0)
                .stackOnCardioDays(request.getStrengthOnCardioDays())
                .build())
            .fillActiveRecoveryDays(request.getFillActiveRecoveryDays())
            .build();
    }

    /**
     * Synthesis settings for a validated treadmill workout request.
     */
    public SynthesisSettings toSynthesisSettings(TreadmillWorkoutRequest request) {
        return SynthesisSettings.builder()
            .fitnessLevel(request.getFitnessLevel())
            .targetDurationMinutes(request.getTargetDurationMinutes())
            .packWeightLbs(request.getPackWeightLbs() != null ? request.getPackWeightLbs() : 0)
            .minInclinePercent(request.getMinInclinePercent() != null ? request.getMinInclinePercent() : 0)
            .maxInclinePercent(request.getMaxInclinePercent())
            .maxSpeedMph(request.getMaxSpeedMph())
            .build();
    }

    /**
     * Converts the hike, sorting profile points by distance.
     */
    public Hike toHike(HikeRequest request) {
        List<ProfilePoint> points = request.getProfilePoints() == null ? List.of() : request.getProfilePoints().stream()
            .sorted(Comparator.comparing(ProfilePointRequest::getDistanceMiles))
            .map(point -> ProfilePoint.of(point.getDistanceMiles(), point.getElevationFt()))
            .toList();
        return Hike.builder()
            .distanceMiles(request.getDistanceMiles())
            .elevationGainFt(request.getElevationGainFt())
            .profilePoints(points)
            .build();
    }
}
