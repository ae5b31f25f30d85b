package workout.logger.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;

@Entity
@Table(name = "workout_sessions")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@ToString
public class WorkoutSession extends SoftDeletableEntity {
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    // Reference only; the session is owned by the user, not by the routine.
    @Column(name = "workout_routine_id", nullable = false)
    private Long workoutRoutineId;

    @Column(name = "start_time", nullable = false)
    private Instant start;

    @Column(name = "end_time")
    private Instant end;
}
