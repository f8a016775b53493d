package org.operaton.hikeprep.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when a training plan or treadmill workout request is invalid.
 * Carries one message per offending field, in the order the fields were checked.
 */
public class InvalidTrainingPlanException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public InvalidTrainingPlanException(Map<String, String> fieldErrors) {
        super("Invalid training plan request: " + String.join(", ", fieldErrors.keySet()));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
