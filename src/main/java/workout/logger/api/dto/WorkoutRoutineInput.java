package workout.logger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutRoutineInput {
    private String name;
    private List<ExerciseRoutineInput> exerciseRoutines = new ArrayList<>();
}
