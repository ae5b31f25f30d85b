package workout.logger.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.SQLRestriction;

@Entity
@Table(name = "set_entries")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@ToString
public class SetEntry extends SoftDeletableEntity {
    @Column(name = "exercise_id", nullable = false, updatable = false)
    private Long exerciseId;

    private Double weight;

    private Integer reps;
}
