package org.operaton.hikeprep.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.model.plan.StrengthSettings;
import org.operaton.hikeprep.model.plan.TrainingPhase;
import org.operaton.hikeprep.model.plan.WorkoutType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Decides how many sessions of each kind a week holds and which day slot each one takes.
 * A week never holds more own-day sessions than it has training days.
 */
@Service
@Slf4j
public class SessionMixPlanner {

    public static final String CAPACITY_WARNING = "Total sessions must fit within your training days.";

    /**
     * Reduces the requested counts until they fit into {@code daysPerWeek}.
     * Own-day strength goes first, then outdoor hikes, then treadmill sessions.
     * Strength stacked on cardio days never takes a day of its own.
     */
    public SessionMix enforceCapacity(int daysPerWeek, int treadmillSessions, int outdoorHikes,
                                      StrengthSettings strength) {
        int treadmill = Math.max(treadmillSessions, 0);
        int outdoor = Math.max(outdoorHikes, 0);
        int requestedStrength = strength != null && strength.isIncludeStrength()
            ? Math.max(strength.getSessionsPerWeek(), 0)
            : 0;
        boolean stacked = strength != null && strength.isStackOnCardioDays();
        int ownDayStrength = stacked ? 0 : requestedStrength;
        int addOns = stacked ? requestedStrength : 0;

        int capacity = Math.max(daysPerWeek, 0);
        int overage = treadmill + outdoor + ownDayStrength - capacity;
        if (overage <= 0) {
            return new SessionMix(treadmill, outdoor, ownDayStrength, addOns, false);
        }

        int strengthCut = Math.min(ownDayStrength, overage);
        ownDayStrength -= strengthCut;
        overage -= strengthCut;

        int outdoorCut = Math.min(outdoor, overage);
        outdoor -= outdoorCut;
        overage -= outdoorCut;

        treadmill = Math.max(treadmill - overage, 0);

        log.debug("Reduced sessions to fit {} days: treadmill={}, outdoor={}, strength={}",
            capacity, treadmill, outdoor, ownDayStrength);
        return new SessionMix(treadmill, outdoor, ownDayStrength, addOns, true);
    }

    /**
     * Re-fits a mix to the number of days actually scheduled in a week.
     */
    public SessionMix fitToDays(SessionMix mix, int dayCount) {
        if (mix.ownDaySessions() <= dayCount) {
            return mix;
        }
        SessionMix fitted = enforceCapacity(dayCount, mix.treadmillSessions(), mix.outdoorHikes(),
            StrengthSettings.builder()
                .includeStrength(mix.strengthDays() > 0)
                .sessionsPerWeek(mix.strengthDays())
                .build());
        return new SessionMix(fitted.treadmillSessions(), fitted.outdoorHikes(), fitted.strengthDays(),
            mix.strengthAddOns(), true);
    }

    /**
     * Assigns a workout type to each of the week's day slots.
     *
     * @param mix session counts after the capacity check
     * @param phase the week's phase
     * @param weekNumber 1-based week number
     * @param slotCount number of scheduled days in the week
     * @param fillActiveRecoveryDays whether empty slots become recovery or rest days
     * @return one planned session per slot
     */
    public List<PlannedSession> planWeek(SessionMix mix, TrainingPhase phase, int weekNumber, int slotCount,
                                         boolean fillActiveRecoveryDays) {
        List<PlannedSession> cardio = new ArrayList<>();
        for (int i = 0; i < mix.outdoorHikes(); i++) {
            cardio.add(new PlannedSession(WorkoutType.OUTDOOR_LONG_HIKE, true));
        }

        boolean zone2Only = phase.isReduced() || weekNumber <= 2;
        for (int i = 0; i < mix.treadmillSessions(); i++) {
            if (mix.outdoorHikes() == 0 && i == 0) {
                cardio.add(new PlannedSession(WorkoutType.ZONE2_INCLINE_WALK, true));
            } else if (!zone2Only && i == 0) {
                cardio.add(new PlannedSession(WorkoutType.TREADMILL_INTERVALS, false));
            } else {
                cardio.add(new PlannedSession(WorkoutType.ZONE2_INCLINE_WALK, false));
            }
        }

        PlannedSession[] slots = new PlannedSession[slotCount];
        List<PlannedSession> strength = new ArrayList<>();
        for (int i = 0; i < mix.strengthDays(); i++) {
            strength.add(new PlannedSession(WorkoutType.STRENGTH, false));
        }
        place(slots, strength, session -> session.type() == WorkoutType.STRENGTH);
        place(slots, cardio.stream().filter(session -> session.type().isHighLoad()).toList(),
            session -> session.type().isHighLoad());
        place(slots, cardio.stream().filter(session -> !session.type().isHighLoad()).toList(), session -> false);

        WorkoutType filler = fillActiveRecoveryDays ? WorkoutType.RECOVERY_MOBILITY : WorkoutType.REST_DAY;
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                slots[i] = new PlannedSession(filler, false);
            }
        }
        return Arrays.asList(slots);
    }

    private void place(PlannedSession[] slots, List<PlannedSession> sessions, Predicate<PlannedSession> avoidNextTo) {
        List<Integer> order = alternatingOrder(slots.length);
        for (PlannedSession session : sessions) {
            Integer free = order.stream()
                .filter(i -> slots[i] == null && !hasAdjacentMatch(slots, i, avoidNextTo))
                .findFirst()
                .orElseGet(() -> order.stream().filter(i -> slots[i] == null).findFirst().orElse(null));
            if (free == null) {
                log.debug("No free slot left for {}", session.type());
                return;
            }
            slots[free] = session;
        }
    }

    private boolean hasAdjacentMatch(PlannedSession[] slots, int index, Predicate<PlannedSession> avoidNextTo) {
        PlannedSession previous = index > 0 ? slots[index - 1] : null;
        PlannedSession next = index < slots.length - 1 ? slots[index + 1] : null;
        return (previous != null && avoidNextTo.test(previous)) || (next != null && avoidNextTo.test(next));
    }

    // Even slots first, then odd: 0, 2, 4, ..., 1, 3, 5, ...
    private List<Integer> alternatingOrder(int length) {
        List<Integer> order = new ArrayList<>(length);
        for (int i = 0; i < length; i += 2) {
            order.add(i);
        }
        for (int i = 1; i < length; i += 2) {
            order.add(i);
        }
        return order;
    }

    /**
     * Weekly session counts after the capacity check.
     *
     * @param strengthDays own-day strength sessions
     * @param strengthAddOns strength sessions requested on cardio days
     * @param reduced whether any requested count was lowered
     */
    public record SessionMix(int treadmillSessions, int outdoorHikes, int strengthDays, int strengthAddOns,
                             boolean reduced) {

        public int ownDaySessions() {
            return treadmillSessions + outdoorHikes + strengthDays;
        }

        public int cardioSessions() {
            return treadmillSessions + outdoorHikes;
        }
    }

    /**
     * A workout type assigned to a day slot. The long flag marks the session
     * that carries the week's long-session target.
     */
    public record PlannedSession(WorkoutType type, boolean longSession) {
    }
}
