package workout.logger.api.dto;

import lombok.Builder;
import lombok.Value;
import workout.logger.api.entity.ExerciseRoutine;
import workout.logger.api.security.ResourceIds;

@Value
@Builder
public class ExerciseRoutineView {
    String id;
    String name;
    Integer sets;
    Integer reps;

    public static ExerciseRoutineView from(ExerciseRoutine exerciseRoutine) {
        return ExerciseRoutineView.builder()
                .id(ResourceIds.format(exerciseRoutine.getId()))
                .name(exerciseRoutine.getName())
                .sets(exerciseRoutine.getSets())
                .reps(exerciseRoutine.getReps())
                .build();
    }
}
