package workout.logger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutSessionInput {
    private String workoutRoutineId;
    private Instant start;
    private Instant end;
    private List<ExerciseInput> exercises = new ArrayList<>();
}
