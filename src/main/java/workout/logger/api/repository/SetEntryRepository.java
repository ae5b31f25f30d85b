package workout.logger.api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import workout.logger.api.entity.SetEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface SetEntryRepository extends JpaRepository<SetEntry, Long> {
    List<SetEntry> findByExerciseIdOrderByIdAsc(Long exerciseId);

    List<SetEntry> findByExerciseIdInOrderByIdAsc(Collection<Long> exerciseIds);

    @Modifying
    @Query("UPDATE SetEntry s SET s.deletedAt = :deletedAt WHERE s.id = :id AND s.deletedAt IS NULL")
    int softDeleteById(@Param("id") Long id, @Param("deletedAt") Instant deletedAt);

    @Modifying
    @Query("UPDATE SetEntry s SET s.deletedAt = :deletedAt WHERE s.exerciseId IN :exerciseIds AND s.deletedAt IS NULL")
    int softDeleteByExerciseIdIn(@Param("exerciseIds") Collection<Long> exerciseIds, @Param("deletedAt") Instant deletedAt);
}
