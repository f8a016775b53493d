package org.operaton.hikeprep.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.hikeprep.model.plan.TrainingPhase;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PeriodizationService.
 * Tests the weekly volume curve, week phases and progression ramps.
 */
class PeriodizationServiceTest {

    private final PeriodizationService periodizationService = new PeriodizationService();

    @Test
    @DisplayName("Should ramp towards the weekly target with deload and taper weeks")
    void testBuildWeeklyVolumes_EightWeeks() {
        // When
        List<Integer> volumes = periodizationService.buildWeeklyVolumes(180, 8, 261);

        // Then
        assertEquals(List.of(192, 204, 215, 168, 230, 246, 261, 144), volumes);
    }

    @Test
    @DisplayName("Should never grow a build week by more than 10 percent")
    void testBuildWeeklyVolumes_GrowthCeiling() {
        // Given - a target far above the baseline
        List<Integer> volumes = periodizationService.buildWeeklyVolumes(60, 12, 2000);

        // Then
        for (int i = 0; i < volumes.size() - 1; i++) {
            int week = i + 1;
            if (week % 4 != 0) {
                assertTrue(volumes.get(i + 1) <= volumes.get(i) * 1.10, "week " + (week + 1) + ": " + volumes);
            }
        }
    }

    @Test
    @DisplayName("Should lower deload weeks and the final taper")
    void testBuildWeeklyVolumes_DeloadAndTaper() {
        // When
        List<Integer> volumes = periodizationService.buildWeeklyVolumes(90, 10, 300);

        // Then
        assertEquals(10, volumes.size());
        assertTrue(volumes.get(3) < volumes.get(2));
        assertTrue(volumes.get(7) < volumes.get(6));
        int last = volumes.get(volumes.size() - 1);
        assertTrue(last < Collections.max(volumes.subList(0, volumes.size() - 1)));
    }

    @Test
    @DisplayName("Should never regress when the target is below the baseline")
    void testBuildWeeklyVolumes_TargetBelowBaseline() {
        List<Integer> volumes = periodizationService.buildWeeklyVolumes(300, 6, 120);

        assertEquals(300, volumes.get(0));
        assertEquals(300, volumes.get(1));
        assertEquals(300, volumes.get(2));
    }

    @Test
    @DisplayName("Should cap the first two weeks for a low baseline")
    void testBuildWeeklyVolumes_LowBaselineCaps() {
        // When
        List<Integer> volumes = periodizationService.buildWeeklyVolumes(0, 6, 400);

        // Then
        assertTrue(volumes.get(0) <= 60);
        assertTrue(volumes.get(1) <= 75);
    }

    @Test
    @DisplayName("Should size single-week plans from the baseline")
    void testBuildWeeklyVolumes_SingleWeek() {
        assertEquals(List.of(45), periodizationService.buildWeeklyVolumes(20, 1, 300));
        assertEquals(List.of(85), periodizationService.buildWeeklyVolumes(100, 1, 300));
        assertEquals(List.of(34), periodizationService.buildWeeklyVolumes(40, 1, 300));
    }

    @Test
    @DisplayName("Should resolve week phases in precedence order")
    void testPhaseOf() {
        assertEquals(TrainingPhase.BUILD, periodizationService.phaseOf(1, 8, 180));
        assertEquals(TrainingPhase.DELOAD, periodizationService.phaseOf(4, 8, 180));
        assertEquals(TrainingPhase.PEAK, periodizationService.phaseOf(7, 8, 180));
        assertEquals(TrainingPhase.TAPER, periodizationService.phaseOf(8, 8, 180));
        assertEquals(TrainingPhase.ADAPTATION, periodizationService.phaseOf(1, 8, 20));
        assertEquals(TrainingPhase.ADAPTATION, periodizationService.phaseOf(2, 2, 20));
        assertEquals(TrainingPhase.BUILD, periodizationService.phaseOf(3, 8, 20));
        assertEquals(TrainingPhase.TAPER, periodizationService.phaseOf(8, 8, 20));
    }

    @Test
    @DisplayName("Should ramp the long session from baseline to the peak target")
    void testLongSessionTarget() {
        // baseline long session is 180 * 0.4 = 72
        assertEquals(79, periodizationService.longSessionTarget(180, 123, 1, 8));
        assertEquals(123, periodizationService.longSessionTarget(180, 123, 7, 8));
        assertEquals(123, periodizationService.longSessionTarget(180, 123, 8, 8));
        // adaptation weeks use a quarter of the peak target, between 15 and 30
        assertEquals(25, periodizationService.longSessionTarget(20, 100, 1, 8));
        assertEquals(30, periodizationService.longSessionTarget(20, 200, 2, 8));
    }

    @Test
    @DisplayName("Should ramp the incline ceiling from 3 percent within the treadmill limit")
    void testWeekInclineCap() {
        assertEquals(4.5, periodizationService.weekInclineCap(12, 4.5, 7, 8, 180), 1e-9);
        assertEquals(3.0 + 1.5 / 7, periodizationService.weekInclineCap(12, 4.5, 1, 8, 180), 1e-9);
        assertEquals(3.0, periodizationService.weekInclineCap(12, 4.5, 1, 8, 20), 1e-9);
        assertEquals(2.0, periodizationService.weekInclineCap(2, 4.5, 7, 8, 180), 1e-9);
    }

    @Test
    @DisplayName("Should describe week-over-week volume changes")
    void testProgressionNote() {
        assertEquals("Progression: +7% volume vs last week.", periodizationService.progressionNote(200, 214));
        assertEquals("Volume -22% vs last week.", periodizationService.progressionNote(215, 168));
        assertNull(periodizationService.progressionNote(200, 200));
    }
}
