package workout.logger.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.SQLRestriction;

@Entity
@Table(name = "workout_routines")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@ToString
public class WorkoutRoutine extends SoftDeletableEntity {
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(nullable = false)
    private String name;
}
