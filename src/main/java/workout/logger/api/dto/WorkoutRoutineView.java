package workout.logger.api.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WorkoutRoutineView {
    String id;
    String name;
    List<ExerciseRoutineView> exerciseRoutines;
}
