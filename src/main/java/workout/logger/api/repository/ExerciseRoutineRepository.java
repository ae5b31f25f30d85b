package workout.logger.api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workout.logger.api.entity.ExerciseRoutine;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface ExerciseRoutineRepository extends JpaRepository<ExerciseRoutine, Long> {
    List<ExerciseRoutine> findByWorkoutRoutineIdOrderByIdAsc(Long workoutRoutineId);

    // Batched fetch behind the exercise routine loader
    List<ExerciseRoutine> findByWorkoutRoutineIdInOrderByIdAsc(Collection<Long> workoutRoutineIds);

    @Modifying
    @Query("UPDATE ExerciseRoutine e SET e.deletedAt = :deletedAt WHERE e.id = :id AND e.deletedAt IS NULL")
    int softDeleteById(@Param("id") Long id, @Param("deletedAt") Instant deletedAt);

    @Modifying
    @Query("UPDATE ExerciseRoutine e SET e.deletedAt = :deletedAt WHERE e.workoutRoutineId = :workoutRoutineId AND e.deletedAt IS NULL")
    int softDeleteByWorkoutRoutineId(@Param("workoutRoutineId") Long workoutRoutineId, @Param("deletedAt") Instant deletedAt);
}
