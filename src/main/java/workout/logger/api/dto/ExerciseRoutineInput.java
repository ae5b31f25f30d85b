package workout.logger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseRoutineInput {
    private String name;
    private Integer sets;
    private Integer reps;
}
