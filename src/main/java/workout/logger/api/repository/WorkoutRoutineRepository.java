package workout.logger.api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workout.logger.api.entity.WorkoutRoutine;

import java.time.Instant;
import java.util.List;

@Repository
public interface WorkoutRoutineRepository extends JpaRepository<WorkoutRoutine, Long> {
    List<WorkoutRoutine> findByUserIdOrderByIdAsc(Long userId);

    @Modifying
    @Query("UPDATE WorkoutRoutine w SET w.deletedAt = :deletedAt WHERE w.id = :id AND w.deletedAt IS NULL")
    int softDeleteById(@Param("id") Long id, @Param("deletedAt") Instant deletedAt);
}
