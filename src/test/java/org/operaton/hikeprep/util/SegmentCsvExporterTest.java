package org.operaton.hikeprep.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.hikeprep.model.plan.SynthesizedWorkout;
import org.operaton.hikeprep.model.plan.TrainingSegment;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SegmentCsvExporter.
 */
class SegmentCsvExporterTest {

    private SegmentCsvExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new SegmentCsvExporter(48);
    }

    @Test
    @DisplayName("Should write a header and one CRLF-terminated row per segment")
    void testToCsv() {
        // Given
        SynthesizedWorkout workout = SynthesizedWorkout.builder()
            .totalMinutes(20)
            .segment(TrainingSegment.builder().index(0).minutes(5).inclinePct(1).speedMph(2.6).note("Warm-up").build())
            .segment(TrainingSegment.builder().index(1).minutes(10).inclinePct(6.5).speedMph(3).build())
            .segment(TrainingSegment.builder().index(2).minutes(5).inclinePct(0.5).speedMph(2.8).note("Cool-down").build())
            .build();

        // When
        String csv = exporter.toCsv(workout);

        // Then
        assertEquals("Segment,Minutes,Incline %,Speed (mph),Notes\r\n"
            + "0,5,1.0,2.6,Warm-up\r\n"
            + "1,10,6.5,3.0,\r\n"
            + "2,5,0.5,2.8,Cool-down\r\n", csv);
    }

    @Test
    @DisplayName("Should keep fractional minutes to one decimal")
    void testToCsv_FractionalMinutes() {
        SynthesizedWorkout workout = SynthesizedWorkout.builder()
            .totalMinutes(3)
            .segment(TrainingSegment.builder().index(1).minutes(2.5).inclinePct(4).speedMph(3.1).build())
            .build();

        assertTrue(exporter.toCsv(workout).contains("1,2.5,4.0,3.1,\r\n"));
    }

    @Test
    @DisplayName("Should quote notes containing commas or quotes")
    void testEscape() {
        assertEquals("Warm-up", SegmentCsvExporter.escape("Warm-up"));
        assertEquals("\"Pack weight 20 lbs, steady\"", SegmentCsvExporter.escape("Pack weight 20 lbs, steady"));
        assertEquals("\"The \"\"Wall\"\"\"", SegmentCsvExporter.escape("The \"Wall\""));
        assertEquals("\"two\nlines\"", SegmentCsvExporter.escape("two\nlines"));
        assertEquals("", SegmentCsvExporter.escape(null));
    }

    @Test
    @DisplayName("Should derive the file name from the hike name")
    void testFileName() {
        assertEquals("half-dome-via-mist-trail-plan.csv", exporter.fileName("Half Dome via Mist Trail"));
        assertEquals("hike-plan.csv", exporter.fileName(null));
        assertEquals("hike-plan.csv", exporter.fileName("!!!"));
    }

    @Test
    @DisplayName("Should cut long names at the configured length")
    void testFileName_Truncated() {
        SegmentCsvExporter shortNames = new SegmentCsvExporter(10);

        assertEquals("half-dome-plan.csv", shortNames.fileName("Half Dome via Mist Trail"));
    }
}
