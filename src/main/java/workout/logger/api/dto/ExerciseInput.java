package workout.logger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseInput {
    private String exerciseRoutineId;
    private String notes;
    private List<SetEntryInput> setEntries = new ArrayList<>();
}
