package workout.logger.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.SQLRestriction;

@Entity
@Table(name = "exercises")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@ToString
public class Exercise extends SoftDeletableEntity {
    @Column(name = "workout_session_id", nullable = false, updatable = false)
    private Long workoutSessionId;

    @Column(name = "exercise_routine_id", nullable = false)
    private Long exerciseRoutineId;

    @Column(columnDefinition = "TEXT")
    private String notes;
}
