package workout.logger.api.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class WorkoutSessionView {
    String id;
    Instant start;
    Instant end;
    String workoutRoutineId;
    List<ExerciseView> exercises;
    // Exercises of earlier sessions under the same routine; empty while the session is open.
    List<ExerciseView> prevExercises;
}
