package workout.logger.api.loader;

import lombok.Value;

import java.time.Instant;

/**
 * Identifies the history of a workout routine up to, but excluding, {@code before}.
 */
@Value
public class PreviousExercisesKey {
    long workoutRoutineId;
    Instant before;
}
