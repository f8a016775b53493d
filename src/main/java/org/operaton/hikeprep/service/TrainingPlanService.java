package org.operaton.hikeprep.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.model.plan.PlanIntensity;
import org.operaton.hikeprep.model.plan.PlanSummary;
import org.operaton.hikeprep.model.plan.StrengthPhase;
import org.operaton.hikeprep.model.plan.TrainingDay;
import org.operaton.hikeprep.model.plan.TrainingPhase;
import org.operaton.hikeprep.model.plan.TrainingPlanInputs;
import org.operaton.hikeprep.model.plan.TrainingPlanOutput;
import org.operaton.hikeprep.model.plan.TrainingWeek;
import org.operaton.hikeprep.model.plan.TrainingWorkout;
import org.operaton.hikeprep.model.plan.WorkoutType;
import org.operaton.hikeprep.service.HikeDemandCalculator.HikeDemands;
import org.operaton.hikeprep.service.HikeDemandCalculator.PeakTargets;
import org.operaton.hikeprep.service.SessionMixPlanner.PlannedSession;
import org.operaton.hikeprep.service.SessionMixPlanner.SessionMix;
import org.operaton.hikeprep.service.WeekDayScheduler.ScheduledWeek;
import org.operaton.hikeprep.service.WorkoutComposer.WorkoutContext;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a periodized, day-by-day training plan for a target hike.
 * Pure computation: the same inputs always produce the same plan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingPlanService {

    static final String SHORT_PLAN_WARNING =
        "Less than two weeks to your target date. Keep sessions short and stay fresh.";
    static final String AMBITIOUS_PLAN_WARNING =
        "Ambitious plan: recommended only if you already train consistently.";
    static final String STACKED_SESSIONS_WARNING =
        "Stacked sessions create consecutive high-intensity days. Consider reducing sessions or extending your timeline.";
    static final String DEMANDS_NOT_MET_NOTE =
        "This plan does not fully reach hike-specific demands due to limited time or availability.";

    private final HikeDemandCalculator hikeDemandCalculator;
    private final PeriodizationService periodizationService;
    private final SessionMixPlanner sessionMixPlanner;
    private final WeekDayScheduler weekDayScheduler;
    private final WorkoutComposer workoutComposer;

    /**
     * Builds the full plan from validated inputs.
     * Never fails on extreme inputs; shortcomings are reported as warnings and week notes.
     *
     * @param inputs validated plan inputs
     * @return the plan with weeks, warnings and summary
     */
    public TrainingPlanOutput buildTrainingPlan(TrainingPlanInputs inputs) {
        LocalDate startDate = inputs.getTrainingStartDate();
        LocalDate targetDate = inputs.getTargetDate();
        long daysBetween = Math.max(0, ChronoUnit.DAYS.between(startDate, targetDate));
        int totalWeeks = (int) Math.max(1, (daysBetween + 1 + 6) / 7);
        int baseline = inputs.getBaselineMinutes();

        Set<String> warnings = new LinkedHashSet<>();
        if (totalWeeks < 2) {
            warnings.add(SHORT_PLAN_WARNING);
        }

        HikeDemands demands = hikeDemandCalculator.deriveHikeDemands(inputs.getHike());
        int minPrepWeeks = hikeDemandCalculator.minPrepWeeks(
            inputs.getHike().getDistanceMiles(), inputs.getHike().getElevationGainFt());
        if (totalWeeks < minPrepWeeks) {
            warnings.add("This hike typically requires at least " + minPrepWeeks
                + " weeks of preparation. Your plan may not fully prepare you.");
        }
        if (baseline <= PeriodizationService.LOW_BASELINE_MINUTES
            && inputs.getConstraints().getTreadmillSessionsPerWeek()
            + inputs.getConstraints().getOutdoorHikesPerWeek() >= inputs.getDaysPerWeek()) {
            warnings.add(AMBITIOUS_PLAN_WARNING);
        }

        PeakTargets peakTargets = hikeDemandCalculator.buildPeakTargets(demands, totalWeeks);
        List<Integer> volumes = periodizationService.buildWeeklyVolumes(
            baseline, totalWeeks, peakTargets.weeklyVolumeTarget());

        SessionMix weeklyMix = sessionMixPlanner.enforceCapacity(
            inputs.getDaysPerWeek(),
            inputs.getConstraints().getTreadmillSessionsPerWeek(),
            inputs.getConstraints().getOutdoorHikesPerWeek(),
            inputs.getStrength());
        if (weeklyMix.reduced()) {
            warnings.add(SessionMixPlanner.CAPACITY_WARNING);
        }

        int peakWeekIndex = totalWeeks > 1 ? totalWeeks - 2 : 0;
        int previousOutdoorMinutes = (int) Math.round(baseline * 0.4);
        List<TrainingWeek> weeks = new ArrayList<>(totalWeeks);

        for (int index = 0; index < totalWeeks; index++) {
            int weekNumber = index + 1;
            int weekVolume = volumes.get(index);
            LocalDate weekStart = startDate.plusDays(index * 7L);
            LocalDate weekEnd = weekStart.plusDays(6).isAfter(targetDate) ? targetDate : weekStart.plusDays(6);
            TrainingPhase phase = periodizationService.phaseOf(weekNumber, totalWeeks, baseline);

            ScheduledWeek scheduled = weekDayScheduler.scheduleWeekDays(weekStart, weekEnd, inputs);
            if (scheduled.warning() != null) {
                warnings.add(scheduled.warning());
            }
            List<LocalDate> dates = scheduled.days();
            SessionMix mix = sessionMixPlanner.fitToDays(weeklyMix, dates.size());
            List<PlannedSession> sessions = sessionMixPlanner.planWeek(
                mix, phase, weekNumber, dates.size(), inputs.isFillActiveRecoveryDays());

            int longSessionTarget = periodizationService.longSessionTarget(
                baseline, peakTargets.longSessionTarget(), weekNumber, totalWeeks);
            double inclineCap = periodizationService.weekInclineCap(
                inputs.getConstraints().getTreadmillMaxInclinePercent(),
                peakTargets.sustainedInclineTarget(), weekNumber, totalWeeks, baseline);

            List<TrainingDay> days = new ArrayList<>(dates.size());
            for (int slot = 0; slot < dates.size(); slot++) {
                LocalDate date = dates.get(slot);
                TrainingWorkout workout = workoutComposer.buildWorkout(sessions.get(slot), WorkoutContext.builder()
                    .weekNumber(weekNumber)
                    .slot(slot)
                    .phase(phase)
                    .weekVolume(weekVolume)
                    .scheduledDays(dates.size())
                    .longSessionTarget(longSessionTarget)
                    .inclineCap(inclineCap)
                    .previousOutdoorMinutes(previousOutdoorMinutes)
                    .averageGradePct(demands.averageGradePct())
                    .fitnessLevel(inputs.getFitnessLevel())
                    .maxSpeedMph(inputs.getConstraints().getMaxSpeedMph())
                    .hike(inputs.getHike())
                    .build());
                if (workout.getType() == WorkoutType.OUTDOOR_LONG_HIKE) {
                    previousOutdoorMinutes = workout.getDurationMinutes();
                }
                days.add(TrainingDay.builder()
                    .date(date)
                    .dayName(weekDayScheduler.dayName(date))
                    .workout(workout)
                    .build());
            }

            StrengthPhase strengthPhase = StrengthPhase.forPhase(phase);
            if (mix.strengthAddOns() > 0) {
                days = workoutComposer.attachStrengthAddOns(days, mix.strengthAddOns(), strengthPhase);
                if (hasConsecutiveHighLoadDays(days)) {
                    warnings.add(STACKED_SESSIONS_WARNING);
                }
            }

            int totalMinutes = days.stream().mapToInt(TrainingDay::totalMinutes).sum();
            StringBuilder notes = new StringBuilder(phase.getNote());
            if (index == peakWeekIndex && !meetsHikeDemands(days, totalMinutes, inclineCap, demands)) {
                notes.append(' ').append(DEMANDS_NOT_MET_NOTE);
            }
            if (index > 0) {
                String progression = periodizationService.progressionNote(volumes.get(index - 1), weekVolume);
                if (progression != null) {
                    notes.append(' ').append(progression);
                }
            }
            if (inputs.getStrength().isIncludeStrength()) {
                notes.append(" Strength focus: ").append(strengthPhase.getLabel()).append('.');
            }

            weeks.add(TrainingWeek.builder()
                .weekNumber(weekNumber)
                .startDate(weekStart)
                .endDate(weekEnd)
                .totalMinutes(totalMinutes)
                .notes(notes.toString())
                .focus(phase.getFocus())
                .days(days)
                .build());
            log.debug("Week {} ({}): {} days, {} of {} planned minutes",
                weekNumber, phase, days.size(), totalMinutes, weekVolume);
        }

        PlanSummary summary = PlanSummary.builder()
            .daysPerWeek(inputs.getDaysPerWeek())
            .preferredDays(weekDayScheduler.pickTrainingDays(
                inputs.getDaysPerWeek(), inputs.getPreferredDays(), inputs.isAnyDays()))
            .averageWeeklyMinutes((int) Math.round(volumes.stream().mapToInt(Integer::intValue).average().orElse(0)))
            .intensity(PlanIntensity.classify(baseline, weeklyMix.ownDaySessions()))
            .build();

        log.info("Generated {}-week plan from {} to {} with {} warning(s)",
            totalWeeks, startDate, targetDate, warnings.size());

        return TrainingPlanOutput.builder()
            .totalWeeks(totalWeeks)
            .warnings(warnings)
            .summary(summary)
            .weeks(weeks)
            .build();
    }

    private boolean meetsHikeDemands(List<TrainingDay> days, int totalMinutes, double inclineCap,
                                     HikeDemands demands) {
        int duration = demands.estimatedHikeDurationMinutes();
        int longest = days.stream()
            .flatMap(day -> day.getWorkouts().stream())
            .mapToInt(TrainingWorkout::getDurationMinutes)
            .max()
            .orElse(0);
        return longest >= Math.round(duration * 0.7)
            && totalMinutes >= Math.round(duration * 1.5)
            && inclineCap >= demands.averageGradePct() * 0.6;
    }

    /**
     * Two adjacent calendar days that both carry a long hike, intervals or stacked strength.
     */
    boolean hasConsecutiveHighLoadDays(List<TrainingDay> days) {
        for (int i = 1; i < days.size(); i++) {
            TrainingDay previous = days.get(i - 1);
            TrainingDay current = days.get(i);
            if (previous.getDate().plusDays(1).equals(current.getDate())
                && isHighLoadDay(previous) && isHighLoadDay(current)) {
                return true;
            }
        }
        return false;
    }

    private boolean isHighLoadDay(TrainingDay day) {
        return day.getWorkouts().stream()
            .anyMatch(workout -> workout.getType().isHighLoad() || workout.getType() == WorkoutType.STRENGTH);
    }
}
