package workout.logger.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.SQLRestriction;

@Entity
@Table(name = "exercise_routines")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@ToString
public class ExerciseRoutine extends SoftDeletableEntity {
    @Column(name = "workout_routine_id", nullable = false, updatable = false)
    private Long workoutRoutineId;

    @Column(nullable = false)
    private String name;

    private Integer sets;

    private Integer reps;
}
