package org.operaton.hikeprep.service;

import org.operaton.hikeprep.model.plan.TrainingPlanInputs;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a week's day slots onto calendar dates.
 */
@Service
public class WeekDayScheduler {

    public static final String PREFERRED_DAYS_WARNING =
        "Not enough preferred days this week; some sessions may be skipped.";

    // Mon, Wed, Fri, Sat, Tue, Thu, Sun
    private static final int[] DEFAULT_SPREAD = {0, 2, 4, 5, 1, 3, 6};

    /**
     * Picks the training dates within {@code [weekStart, weekEnd]}.
     * Without usable preferred days the slots are spread evenly over the window;
     * otherwise only preferred weekdays are used and a shortfall is reported.
     */
    public ScheduledWeek scheduleWeekDays(LocalDate weekStart, LocalDate weekEnd, TrainingPlanInputs inputs) {
        List<LocalDate> weekDates = weekStart.datesUntil(weekEnd.plusDays(1)).toList();
        Set<Integer> preferred = validDays(inputs.getPreferredDays());
        int daysPerWeek = inputs.getDaysPerWeek();

        if (inputs.isAnyDays() || preferred.isEmpty()) {
            int step = Math.max(1, weekDates.size() / Math.max(daysPerWeek, 1));
            Set<LocalDate> days = new LinkedHashSet<>();
            for (int i = 0; i < daysPerWeek; i++) {
                days.add(weekDates.get(Math.min(i * step, weekDates.size() - 1)));
            }
            return new ScheduledWeek(List.copyOf(days), null);
        }

        List<LocalDate> days = new ArrayList<>();
        for (LocalDate date : weekDates) {
            if (days.size() >= daysPerWeek) {
                break;
            }
            if (preferred.contains(weekdayIndex(date))) {
                days.add(date);
            }
        }
        return new ScheduledWeek(List.copyOf(days), days.size() < daysPerWeek ? PREFERRED_DAYS_WARNING : null);
    }

    /**
     * Weekday indices the plan favours: valid preferred days first, then the default spread.
     */
    public List<Integer> pickTrainingDays(int daysPerWeek, List<Integer> preferredDays, boolean anyDays) {
        Set<Integer> selection = new LinkedHashSet<>();
        if (!anyDays) {
            for (Integer day : validDays(preferredDays)) {
                if (selection.size() >= daysPerWeek) {
                    break;
                }
                selection.add(day);
            }
        }
        for (int day : DEFAULT_SPREAD) {
            if (selection.size() >= daysPerWeek) {
                break;
            }
            selection.add(day);
        }
        return List.copyOf(selection);
    }

    /**
     * First Monday strictly after {@code from}.
     */
    public LocalDate nextMonday(LocalDate from) {
        return from.with(TemporalAdjusters.next(DayOfWeek.MONDAY));
    }

    public String dayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    /**
     * 0 = Monday through 6 = Sunday.
     */
    public int weekdayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    private Set<Integer> validDays(List<Integer> days) {
        Set<Integer> valid = new LinkedHashSet<>();
        if (days == null) {
            return valid;
        }
        for (Integer day : days) {
            if (day != null && day >= 0 && day <= 6) {
                valid.add(day);
            }
        }
        return valid;
    }

    /**
     * Dates chosen for a week, plus a warning when preferred days ran short.
     */
    public record ScheduledWeek(List<LocalDate> days, String warning) {
    }
}
