package workout.logger.api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workout.logger.api.entity.Exercise;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface ExerciseRepository extends JpaRepository<Exercise, Long> {
    List<Exercise> findByWorkoutSessionIdOrderByIdAsc(Long workoutSessionId);

    List<Exercise> findByWorkoutSessionIdInOrderByIdAsc(Collection<Long> workoutSessionIds);

    @Query("SELECT e.id FROM Exercise e WHERE e.workoutSessionId = :workoutSessionId")
    List<Long> findIdsByWorkoutSessionId(@Param("workoutSessionId") Long workoutSessionId);

    @Modifying
    @Query("UPDATE Exercise e SET e.deletedAt = :deletedAt WHERE e.id = :id AND e.deletedAt IS NULL")
    int softDeleteById(@Param("id") Long id, @Param("deletedAt") Instant deletedAt);

    @Modifying
    @Query("UPDATE Exercise e SET e.deletedAt = :deletedAt WHERE e.workoutSessionId = :workoutSessionId AND e.deletedAt IS NULL")
    int softDeleteByWorkoutSessionId(@Param("workoutSessionId") Long workoutSessionId, @Param("deletedAt") Instant deletedAt);
}
