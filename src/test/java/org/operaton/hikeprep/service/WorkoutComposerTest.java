package org.operaton.hikeprep.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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
import org.operaton.hikeprep.service.WorkoutComposer.WorkoutContext;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WorkoutComposer.
 * Tests how each workout type is sized and how treadmill segments are reshaped.
 */
@ExtendWith(MockitoExtension.class)
class WorkoutComposerTest {

    @Mock
    private SegmentSynthesizer segmentSynthesizer;

    @InjectMocks
    private WorkoutComposer workoutComposer;

    private Hike hike;
    private WorkoutContext.WorkoutContextBuilder context;

    @BeforeEach
    void setUp() {
        hike = Hike.builder()
            .distanceMiles(5)
            .elevationGainFt(1500)
            .profilePoint(ProfilePoint.of(0, 4000))
            .profilePoint(ProfilePoint.of(2.5, 4750))
            .profilePoint(ProfilePoint.of(5, 5500))
            .build();
        context = WorkoutContext.builder()
            .weekNumber(5)
            .slot(1)
            .phase(TrainingPhase.BUILD)
            .weekVolume(200)
            .scheduledDays(4)
            .longSessionTarget(70)
            .inclineCap(5)
            .previousOutdoorMinutes(50)
            .averageGradePct(5.7)
            .fitnessLevel(FitnessLevel.INTERMEDIATE)
            .maxSpeedMph(4.5)
            .hike(hike);
    }

    @Test
    @DisplayName("Should alternate hard and recovery segments for intervals")
    void testBuildWorkout_IntervalPattern() {
        // Given
        when(segmentSynthesizer.synthesize(anyList(), anyDouble(), anyDouble(), any()))
            .thenReturn(stubWorkout(50, 4.0, 4.0, 4.0, 4.0));

        // When
        TrainingWorkout workout = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.TREADMILL_INTERVALS, false), context.build());

        // Then
        ArgumentCaptor<SynthesisSettings> captor = ArgumentCaptor.forClass(SynthesisSettings.class);
        verify(segmentSynthesizer).synthesize(eq(hike.getProfilePoints()), eq(5.0), eq(1500.0), captor.capture());
        SynthesisSettings settings = captor.getValue();
        assertEquals(50, settings.getTargetDurationMinutes());
        assertEquals(0.0, settings.getMinInclinePercent());
        assertEquals(5.0, settings.getMaxInclinePercent());
        assertEquals(4.5, settings.getMaxSpeedMph());

        assertEquals("5-2-treadmill-intervals", workout.getId());
        assertEquals(50, workout.getDurationMinutes());
        assertEquals("Incline intervals based on hike profile.", workout.getNotes());

        List<TrainingSegment> segments = workout.getSegments();
        assertEquals("Warm-up", segments.get(0).getNote());
        assertEquals(1.0, segments.get(0).getInclinePct());

        assertEquals(4.5, segments.get(1).getInclinePct());
        assertEquals(2.8, segments.get(1).getSpeedMph());
        assertEquals("Hard interval", segments.get(1).getNote());

        assertEquals(3.5, segments.get(2).getInclinePct());
        assertEquals(3.2, segments.get(2).getSpeedMph());
        assertEquals("Recovery", segments.get(2).getNote());

        assertEquals("Cool-down", segments.get(segments.size() - 1).getNote());
    }

    @Test
    @DisplayName("Should shorten interval notes in deload weeks")
    void testBuildWorkout_DeloadIntervalNotes() {
        // Given
        when(segmentSynthesizer.synthesize(anyList(), anyDouble(), anyDouble(), any()))
            .thenReturn(stubWorkout(25, 3.0, 3.0));

        // When
        TrainingWorkout workout = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.TREADMILL_INTERVALS, false),
            context.phase(TrainingPhase.DELOAD).weekVolume(60).build());

        // Then - 25% of 60 is below the 25 minute floor
        ArgumentCaptor<SynthesisSettings> captor = ArgumentCaptor.forClass(SynthesisSettings.class);
        verify(segmentSynthesizer).synthesize(anyList(), anyDouble(), anyDouble(), captor.capture());
        assertEquals(25, captor.getValue().getTargetDurationMinutes());
        assertEquals("Shorter intervals, keep effort smooth.", workout.getNotes());
    }

    @Test
    @DisplayName("Should stretch the long Zone 2 walk to the long-session target")
    void testBuildWorkout_LongZone2() {
        // Given
        when(segmentSynthesizer.synthesize(anyList(), anyDouble(), anyDouble(), any()))
            .thenReturn(stubWorkout(70, 2.0, 4.0, 6.0, 4.0, 2.0));

        // When
        TrainingWorkout workout = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.ZONE2_INCLINE_WALK, true), context.build());

        // Then
        ArgumentCaptor<SynthesisSettings> captor = ArgumentCaptor.forClass(SynthesisSettings.class);
        verify(segmentSynthesizer).synthesize(anyList(), anyDouble(), anyDouble(), captor.capture());
        assertEquals(70, captor.getValue().getTargetDurationMinutes());

        assertEquals(5.0, workout.getInclineTarget());
        assertEquals("Steady state, nose-breathing effort.", workout.getNotes());

        // Main-phase inclines averaged over a window of five, within the main phase
        List<TrainingSegment> segments = workout.getSegments();
        assertEquals(4.0, segments.get(1).getInclinePct());
        assertEquals(3.5, segments.get(3).getInclinePct());
        assertEquals(1.0, segments.get(0).getInclinePct());
    }

    @Test
    @DisplayName("Should run regular Zone 2 walks at 90 percent of their allocation")
    void testBuildWorkout_RegularZone2() {
        // Given
        when(segmentSynthesizer.synthesize(anyList(), anyDouble(), anyDouble(), any()))
            .thenReturn(stubWorkout(45, 3.0));

        // When
        TrainingWorkout workout = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.ZONE2_INCLINE_WALK, false), context.inclineCap(1.5).build());

        // Then
        ArgumentCaptor<SynthesisSettings> captor = ArgumentCaptor.forClass(SynthesisSettings.class);
        verify(segmentSynthesizer).synthesize(anyList(), anyDouble(), anyDouble(), captor.capture());
        assertEquals(45, captor.getValue().getTargetDurationMinutes());
        // A ceiling below 2% becomes the incline target
        assertEquals(1.5, workout.getInclineTarget());
    }

    @Test
    @DisplayName("Should split adaptation week volume evenly and ignore the treadmill floor")
    void testBuildWorkout_AdaptationWeek() {
        // Given
        when(segmentSynthesizer.synthesize(anyList(), anyDouble(), anyDouble(), any()))
            .thenReturn(stubWorkout(15, 1.0));
        WorkoutContext adaptation = context.phase(TrainingPhase.ADAPTATION).weekVolume(48).scheduledDays(5)
            .inclineCap(3).build();

        // When
        workoutComposer.buildWorkout(new PlannedSession(WorkoutType.ZONE2_INCLINE_WALK, true), adaptation);
        TrainingWorkout recovery = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.RECOVERY_MOBILITY, false), adaptation);
        TrainingWorkout outdoor = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.OUTDOOR_LONG_HIKE, true), adaptation);

        // Then
        ArgumentCaptor<SynthesisSettings> captor = ArgumentCaptor.forClass(SynthesisSettings.class);
        verify(segmentSynthesizer).synthesize(anyList(), anyDouble(), anyDouble(), captor.capture());
        assertEquals(15, captor.getValue().getTargetDurationMinutes());
        assertEquals(3.0, captor.getValue().getMaxInclinePercent());
        assertEquals(15, recovery.getDurationMinutes());
        assertEquals(15, outdoor.getDurationMinutes());
    }

    @Test
    @DisplayName("Should grow the outdoor hike by at most 20 minutes")
    void testBuildWorkout_OutdoorLongHike() {
        // When
        TrainingWorkout workout = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.OUTDOOR_LONG_HIKE, true), context.slot(0).longSessionTarget(90).build());

        // Then
        assertEquals("5-1-outdoor-long-hike", workout.getId());
        assertEquals(70, workout.getDurationMinutes());
        assertEquals("Focus on time-on-feet with 450 ft of climbing.", workout.getNotes());
        assertTrue(workout.getSegments().isEmpty());
        verifyNoInteractions(segmentSynthesizer);
    }

    @Test
    @DisplayName("Should never shorten the outdoor hike below the previous one")
    void testBuildWorkout_OutdoorKeepsPreviousDuration() {
        TrainingWorkout workout = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.OUTDOOR_LONG_HIKE, true),
            context.longSessionTarget(40).previousOutdoorMinutes(65).build());

        assertEquals(65, workout.getDurationMinutes());
    }

    @Test
    @DisplayName("Should size strength, recovery and rest days")
    void testBuildWorkout_NonCardioDays() {
        // When
        TrainingWorkout strength = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.STRENGTH, false), context.build());
        TrainingWorkout recovery = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.RECOVERY_MOBILITY, false), context.build());
        TrainingWorkout rest = workoutComposer.buildWorkout(
            new PlannedSession(WorkoutType.REST_DAY, false), context.build());

        // Then
        assertEquals(28, strength.getDurationMinutes());
        assertEquals("Strength to support climbing endurance.", strength.getNotes());
        assertEquals(20, recovery.getDurationMinutes());
        assertEquals(0, rest.getDurationMinutes());
        assertEquals("5-2-rest-day", rest.getId());
        verifyNoInteractions(segmentSynthesizer);
    }

    @Test
    @DisplayName("Should synthesize from a straight line when the profile is too sparse")
    @SuppressWarnings("unchecked")
    void testBuildWorkout_SparseProfileFallback() {
        // Given
        Hike sparse = hike.toBuilder().clearProfilePoints().profilePoint(ProfilePoint.of(0, 4000)).build();
        when(segmentSynthesizer.synthesize(anyList(), anyDouble(), anyDouble(), any()))
            .thenReturn(stubWorkout(45, 3.0));

        // When
        workoutComposer.buildWorkout(new PlannedSession(WorkoutType.ZONE2_INCLINE_WALK, false),
            context.hike(sparse).build());

        // Then
        ArgumentCaptor<List<ProfilePoint>> captor = ArgumentCaptor.forClass(List.class);
        verify(segmentSynthesizer).synthesize(captor.capture(), anyDouble(), anyDouble(), any());
        assertEquals(List.of(ProfilePoint.of(0, 0), ProfilePoint.of(5, 1500)), captor.getValue());
    }

    @Test
    @DisplayName("Should attach at most two strength add-ons to cardio days in calendar order")
    void testAttachStrengthAddOns() {
        // Given
        LocalDate monday = LocalDate.of(2025, 6, 2);
        List<TrainingDay> days = List.of(
            day(monday, WorkoutType.OUTDOOR_LONG_HIKE),
            day(monday.plusDays(1), WorkoutType.RECOVERY_MOBILITY),
            day(monday.plusDays(3), WorkoutType.ZONE2_INCLINE_WALK),
            day(monday.plusDays(5), WorkoutType.TREADMILL_INTERVALS)
        );

        // When
        List<TrainingDay> result = workoutComposer.attachStrengthAddOns(days, 3, StrengthPhase.MAINTENANCE);

        // Then
        assertEquals(2, result.get(0).getWorkouts().size());
        TrainingWorkout addOn = result.get(0).getWorkouts().get(1);
        assertEquals("2025-06-02-strength-addon", addOn.getId());
        assertEquals(WorkoutType.STRENGTH, addOn.getType());
        assertEquals(18, addOn.getDurationMinutes());
        assertEquals(1, result.get(1).getWorkouts().size());
        assertEquals(2, result.get(2).getWorkouts().size());
        assertEquals(1, result.get(3).getWorkouts().size());
    }

    @Test
    @DisplayName("Should not attach more add-ons than cardio days")
    void testAttachStrengthAddOns_FewCardioDays() {
        LocalDate monday = LocalDate.of(2025, 6, 2);
        List<TrainingDay> days = List.of(
            day(monday, WorkoutType.RECOVERY_MOBILITY),
            day(monday.plusDays(2), WorkoutType.ZONE2_INCLINE_WALK)
        );

        List<TrainingDay> result = workoutComposer.attachStrengthAddOns(days, 2, StrengthPhase.LEG_STRENGTH);

        assertEquals(3, result.stream().mapToInt(day -> day.getWorkouts().size()).sum());
    }

    private TrainingDay day(LocalDate date, WorkoutType type) {
        return TrainingDay.builder()
            .date(date)
            .dayName(date.getDayOfWeek().name().substring(0, 3))
            .workout(TrainingWorkout.builder().id(date + "-" + type.slug()).type(type).durationMinutes(30).build())
            .build();
    }

    /**
     * Workout shaped like synthesizer output: warm-up, main segments with the given inclines, cool-down.
     */
    private SynthesizedWorkout stubWorkout(int totalMinutes, double... mainInclines) {
        SynthesizedWorkout.SynthesizedWorkoutBuilder builder = SynthesizedWorkout.builder()
            .totalMinutes(totalMinutes)
            .segment(TrainingSegment.builder().index(0).minutes(5).inclinePct(1.0).speedMph(2.6).note("Warm-up").build());
        double mainMinutes = (totalMinutes - 10) / (double) mainInclines.length;
        for (int i = 0; i < mainInclines.length; i++) {
            builder.segment(TrainingSegment.builder()
                .index(i + 1)
                .minutes(mainMinutes)
                .inclinePct(mainInclines[i])
                .speedMph(3.0)
                .build());
        }
        return builder
            .segment(TrainingSegment.builder().index(mainInclines.length + 1).minutes(5).inclinePct(0.5).speedMph(2.8)
                .note("Cool-down").build())
            .build();
    }
}
