package workout.logger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import workout.logger.api.entity.Exercise;
import workout.logger.api.security.ResourceIds;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExerciseView {
    String id;
    String exerciseRoutineId;
    String notes;
    List<SetEntryView> sets;

    /**
     * Projection without sets; callers attach them once the set loader resolves.
     */
    public static ExerciseView from(Exercise exercise) {
        return ExerciseView.builder()
                .id(ResourceIds.format(exercise.getId()))
                .exerciseRoutineId(ResourceIds.format(exercise.getExerciseRoutineId()))
                .notes(exercise.getNotes())
                .build();
    }
}
