package org.operaton.hikeprep.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.exception.InvalidTrainingPlanException;
import org.operaton.hikeprep.model.dto.TreadmillWorkoutRequest;
import org.operaton.hikeprep.model.plan.Hike;
import org.operaton.hikeprep.model.plan.SynthesizedWorkout;
import org.operaton.hikeprep.service.SegmentSynthesizer;
import org.operaton.hikeprep.util.SegmentCsvExporter;
import org.operaton.hikeprep.util.TrainingPlanRequestMapper;
import org.operaton.hikeprep.util.TrainingPlanRequestValidator;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for single treadmill workouts synthesized from a hike profile.
 */
@RestController
@RequestMapping("/api/treadmill-workouts")
@RequiredArgsConstructor
@Slf4j
public class TreadmillWorkoutController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final SegmentSynthesizer segmentSynthesizer;
    private final SegmentCsvExporter csvExporter;
    private final TrainingPlanRequestMapper requestMapper;
    private final TrainingPlanRequestValidator requestValidator;

    /**
     * Synthesizes warm-up, main and cool-down segments.
     *
     * POST /api/treadmill-workouts
     */
    @PostMapping
    public ResponseEntity<?> synthesize(@RequestBody TreadmillWorkoutRequest request) {
        try {
            return ResponseEntity.ok(synthesizeValidated(request));
        } catch (InvalidTrainingPlanException e) {
            log.warn("Invalid treadmill workout request: {}", e.getFieldErrors());
            return ResponseEntity.badRequest()
                .body(new ErrorResponse("Invalid treadmill workout request", e.getFieldErrors()));
        }
    }

    /**
     * Same as {@link #synthesize} but answers with a CSV attachment.
     *
     * POST /api/treadmill-workouts/export
     */
    @PostMapping("/export")
    public ResponseEntity<?> export(@RequestBody TreadmillWorkoutRequest request) {
        try {
            SynthesizedWorkout workout = synthesizeValidated(request);
            String fileName = csvExporter.fileName(request.getHike().getName());
            log.info("Exporting {} segments as {}", workout.getSegments().size(), fileName);

            return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                    ContentDisposition.attachment().filename(fileName).build().toString())
                .body(csvExporter.toCsv(workout));
        } catch (InvalidTrainingPlanException e) {
            log.warn("Invalid treadmill export request: {}", e.getFieldErrors());
            return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("Invalid treadmill workout request", e.getFieldErrors()));
        }
    }

    private SynthesizedWorkout synthesizeValidated(TreadmillWorkoutRequest request) {
        requestValidator.validate(request);
        Hike hike = requestMapper.toHike(request.getHike());
        log.info("Synthesizing treadmill workout for {} mi / {} ft", hike.getDistanceMiles(), hike.getElevationGainFt());
        return segmentSynthesizer.synthesize(hike.getProfilePoints(), hike.getDistanceMiles(),
            hike.getElevationGainFt(), requestMapper.toSynthesisSettings(request));
    }
}
