package workout.logger.api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workout.logger.api.entity.WorkoutSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface WorkoutSessionRepository extends JpaRepository<WorkoutSession, Long> {
    List<WorkoutSession> findByUserIdOrderByStartDesc(Long userId);

    // Batched fetch behind the previous exercises loader
    List<WorkoutSession> findByUserIdAndWorkoutRoutineIdInAndStartBeforeOrderByStartDesc(
            Long userId, Collection<Long> workoutRoutineIds, Instant before);

    @Modifying
    @Query("UPDATE WorkoutSession w SET w.deletedAt = :deletedAt WHERE w.id = :id AND w.deletedAt IS NULL")
    int softDeleteById(@Param("id") Long id, @Param("deletedAt") Instant deletedAt);
}
