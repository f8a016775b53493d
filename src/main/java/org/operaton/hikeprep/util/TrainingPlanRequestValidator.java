package org.operaton.hikeprep.util;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.exception.InvalidTrainingPlanException;
import org.operaton.hikeprep.model.dto.TrainingPlanRequest;
import org.operaton.hikeprep.model.dto.TreadmillWorkoutRequest;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validates requests before they reach the scheduler.
 * Structural constraints come from the DTO annotations, plan rules are checked here.
 * Requests with more sessions than training days are accepted; the scheduler reduces them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingPlanRequestValidator {

    static final int MAX_BASELINE_MINUTES = 2000;
    static final double MAX_INCLINE_PERCENT = 20;
    static final double MIN_SPEED_MPH = 1.0;
    static final double MAX_SPEED_MPH = 8.0;
    static final int MAX_OUTDOOR_HIKES = 6;
    static final int MAX_STRENGTH_SESSIONS = 2;

    private final Validator validator;

    /**
     * Validates a plan request whose defaults have already been applied.
     *
     * @param request the plan request
     * @throws InvalidTrainingPlanException with all field errors if the request is invalid
     */
    public void validate(TrainingPlanRequest request) {
        Map<String, String> errors = structuralErrors(request);

        if (request.getTrainingStartDate() == null) {
            errors.putIfAbsent("trainingStartDate", "Training start date is required");
        }
        if (request.getTargetDate() == null) {
            errors.putIfAbsent("targetDate", "Target date is required");
        } else if (request.getTrainingStartDate() != null
            && request.getTrainingStartDate().isAfter(request.getTargetDate())) {
            errors.putIfAbsent("targetDate", "Target date must not be before the training start date");
        }

        Integer daysPerWeek = request.getDaysPerWeek();
        if (daysPerWeek == null) {
            errors.putIfAbsent("daysPerWeek", "Training days per week is required");
        } else if (daysPerWeek < 1 || daysPerWeek > 7) {
            errors.putIfAbsent("daysPerWeek", "Training days per week must be between 1 and 7");
        }

        if (request.getPreferredDays() != null) {
            boolean outOfRange = request.getPreferredDays().stream().anyMatch(day -> day == null || day < 0 || day > 6);
            if (outOfRange) {
                errors.putIfAbsent("preferredDays", "Preferred days must be between 0 (Monday) and 6 (Sunday)");
            } else if (!Boolean.TRUE.equals(request.getAnyDays()) && daysPerWeek != null
                && request.getPreferredDays().stream().distinct().count() > daysPerWeek) {
                errors.putIfAbsent("preferredDays", "Select no more preferred days than training days per week");
            }
        }

        int treadmill = valueOrZero(request.getTreadmillSessionsPerWeek());
        int outdoor = valueOrZero(request.getOutdoorHikesPerWeek());
        if (treadmill < 0) {
            errors.putIfAbsent("treadmillSessionsPerWeek", "Treadmill sessions must not be negative");
        }
        if (outdoor < 0 || outdoor > MAX_OUTDOOR_HIKES) {
            errors.putIfAbsent("outdoorHikesPerWeek", "Outdoor hikes must be between 0 and " + MAX_OUTDOOR_HIKES);
        }
        if (treadmill + outdoor < 1) {
            errors.putIfAbsent("treadmillSessionsPerWeek", "Plan at least one treadmill session or outdoor hike");
        }

        int baseline = valueOrZero(request.getBaselineMinutes());
        if (baseline < 0 || baseline > MAX_BASELINE_MINUTES) {
            errors.putIfAbsent("baselineMinutes", "Baseline minutes must be between 0 and " + MAX_BASELINE_MINUTES);
        }

        Double maxIncline = request.getTreadmillMaxInclinePercent();
        if (maxIncline != null && (maxIncline < 0 || maxIncline > MAX_INCLINE_PERCENT)) {
            errors.putIfAbsent("treadmillMaxInclinePercent", "Maximum incline must be between 0 and 20%");
        }
        Double maxSpeed = request.getMaxSpeedMph();
        if (maxSpeed != null && (maxSpeed < MIN_SPEED_MPH || maxSpeed > MAX_SPEED_MPH)) {
            errors.putIfAbsent("maxSpeedMph", "Maximum speed must be between 1.0 and 8.0 mph");
        }

        if (Boolean.TRUE.equals(request.getIncludeStrength())) {
            int strength = valueOrZero(request.getStrengthSessionsPerWeek());
            if (strength < 0 || strength > MAX_STRENGTH_SESSIONS) {
                errors.putIfAbsent("strengthSessionsPerWeek",
                    "Strength sessions must be between 0 and " + MAX_STRENGTH_SESSIONS);
            } else if (Boolean.TRUE.equals(request.getStrengthOnCardioDays()) && strength > treadmill + outdoor) {
                errors.putIfAbsent("strengthSessionsPerWeek",
                    "Strength on cardio days needs at least as many cardio sessions as strength sessions");
            }
        }

        throwIfInvalid(errors);
    }

    /**
     * Validates a single treadmill workout request.
     *
     * @throws InvalidTrainingPlanException with all field errors if the request is invalid
     */
    public void validate(TreadmillWorkoutRequest request) {
        Map<String, String> errors = structuralErrors(request);
        if (request.getMinInclinePercent() != null && request.getMaxInclinePercent() != null
            && request.getMinInclinePercent() > request.getMaxInclinePercent()) {
            errors.putIfAbsent("minInclinePercent", "Minimum incline must not exceed the maximum incline");
        }
        throwIfInvalid(errors);
    }

    private <T> Map<String, String> structuralErrors(T request) {
        Map<String, String> errors = new LinkedHashMap<>();
        validator.validate(request).stream()
            .sorted(Comparator.comparing((ConstraintViolation<T> violation) -> violation.getPropertyPath().toString())
                .thenComparing(ConstraintViolation::getMessage))
            .forEach(violation -> errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage()));
        return errors;
    }

    private void throwIfInvalid(Map<String, String> errors) {
        if (!errors.isEmpty()) {
            log.debug("Rejected request with {} field error(s): {}", errors.size(), errors.keySet());
            throw new InvalidTrainingPlanException(errors);
        }
    }

    private int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
