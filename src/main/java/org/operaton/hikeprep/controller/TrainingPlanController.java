package org.operaton.hikeprep.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.hikeprep.exception.InvalidTrainingPlanException;
import org.operaton.hikeprep.model.dto.TrainingPlanRequest;
import org.operaton.hikeprep.model.plan.TrainingPlanOutput;
import org.operaton.hikeprep.service.TrainingPlanService;
import org.operaton.hikeprep.util.TrainingPlanRequestMapper;
import org.operaton.hikeprep.util.TrainingPlanRequestValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

/**
 * REST controller for generating training plans.
 */
@RestController
@RequestMapping("/api/training-plans")
@RequiredArgsConstructor
@Slf4j
public class TrainingPlanController {

    private final TrainingPlanService trainingPlanService;
    private final TrainingPlanRequestMapper requestMapper;
    private final TrainingPlanRequestValidator requestValidator;

    /**
     * Generates a periodized plan for the requested hike and availability.
     *
     * POST /api/training-plans/generate
     *
     * @param request the plan request
     * @return 200 with the plan, or 400 with field errors
     */
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody TrainingPlanRequest request) {
        try {
            TrainingPlanRequest complete = requestMapper.withDefaults(request);
            requestValidator.validate(complete);

            log.info("Generating training plan from {} to {}, {} day(s) per week",
                complete.getTrainingStartDate(), complete.getTargetDate(), complete.getDaysPerWeek());
            TrainingPlanOutput plan = trainingPlanService.buildTrainingPlan(requestMapper.toInputs(complete));
            return ResponseEntity.ok(plan);

        } catch (InvalidTrainingPlanException e) {
            log.warn("Invalid training plan request: {}", e.getFieldErrors());
            return ResponseEntity.badRequest()
                .body(new ErrorResponse("Invalid training plan request", e.getFieldErrors()));
        }
    }

    /**
     * Default training start date, the Monday after today.
     *
     * GET /api/training-plans/next-start-date
     */
    @GetMapping("/next-start-date")
    public ResponseEntity<Map<String, LocalDate>> nextStartDate() {
        return ResponseEntity.ok(Map.of("trainingStartDate", requestMapper.defaultStartDate()));
    }
}
