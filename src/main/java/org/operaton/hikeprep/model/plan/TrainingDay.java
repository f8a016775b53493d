package org.operaton.hikeprep.model.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingDay {

    LocalDate date;

    /** Short English weekday name, e.g. "Mon". */
    String dayName;

    @Singular
    List<TrainingWorkout> workouts;

    public int totalMinutes() {
        return workouts.stream().mapToInt(TrainingWorkout::getDurationMinutes).sum();
    }
}
