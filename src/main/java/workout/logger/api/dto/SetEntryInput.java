package workout.logger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Used for both adding and updating a set; on update, null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetEntryInput {
    private Double weight;
    private Integer reps;
}
