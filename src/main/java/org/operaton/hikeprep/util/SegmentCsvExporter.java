package org.operaton.hikeprep.util;

import org.operaton.hikeprep.model.plan.SynthesizedWorkout;
import org.operaton.hikeprep.model.plan.TrainingSegment;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Exports treadmill segments as CSV for printing or importing into a spreadsheet.
 */
@Component
public class SegmentCsvExporter {

    static final String HEADER = "Segment,Minutes,Incline %,Speed (mph),Notes";

    private final int maxFileNameLength;

    public SegmentCsvExporter(@Value("${hikeprep.export.max-file-name-length:48}") int maxFileNameLength) {
        this.maxFileNameLength = maxFileNameLength;
    }

    /**
     * Renders one row per segment after the header, lines separated by CRLF.
     *
     * @param workout the synthesized workout
     * @return CSV text
     */
    public String toCsv(SynthesizedWorkout workout) {
        StringBuilder csv = new StringBuilder(HEADER).append("\r\n");
        for (TrainingSegment segment : workout.getSegments()) {
            csv.append(segment.getIndex()).append(',')
                .append(PlanFormatter.formatMinutes(segment.getMinutes())).append(',')
                .append(PlanFormatter.formatIncline(segment.getInclinePct())).append(',')
                .append(PlanFormatter.formatSpeed(segment.getSpeedMph())).append(',')
                .append(escape(segment.getNote()))
                .append("\r\n");
        }
        return csv.toString();
    }

    /**
     * Download file name for a hike, e.g. "half-dome-plan.csv".
     */
    public String fileName(String hikeName) {
        return PlanFormatter.slugify(hikeName, maxFileNameLength) + "-plan.csv";
    }

    // Quotes a field containing a comma, quote or line break and doubles embedded quotes
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
