package workout.logger.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workout.logger.api.dto.ExerciseRoutineInput;
import workout.logger.api.dto.ExerciseRoutineView;
import workout.logger.api.entity.ExerciseRoutine;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.repository.ExerciseRoutineRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.ResourceIds;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static workout.logger.api.security.OwnershipChain.EXERCISE_ROUTINE;
import static workout.logger.api.security.OwnershipChain.WORKOUT_ROUTINE;

@Slf4j
@Service
public class ExerciseRoutineService {
    private final ExerciseRoutineRepository exerciseRoutineRepository;
    private final AccessControlService accessControlService;
    private final Clock clock;

    public ExerciseRoutineService(
            ExerciseRoutineRepository exerciseRoutineRepository,
            AccessControlService accessControlService,
            Clock clock) {
        this.exerciseRoutineRepository = exerciseRoutineRepository;
        this.accessControlService = accessControlService;
        this.clock = clock;
    }

    @Transactional
    public ExerciseRoutineView addExerciseRoutine(RequestContext context, String workoutRoutineId,
                                                  ExerciseRoutineInput input) {
        long routineId = ResourceIds.parse(WORKOUT_ROUTINE, workoutRoutineId);
        accessControlService.verifyAccess(WORKOUT_ROUTINE, context.getUserId(), routineId);

        ExerciseRoutine saved = createExerciseRoutine(routineId, input);
        log.info("User {} added exercise routine {} to workout routine {}", context.getUserId(), saved.getId(), routineId);
        return ExerciseRoutineView.from(saved);
    }

    @Transactional(readOnly = true)
    public List<ExerciseRoutineView> getExerciseRoutines(RequestContext context, String workoutRoutineId) {
        long routineId = ResourceIds.parse(WORKOUT_ROUTINE, workoutRoutineId);
        accessControlService.verifyAccess(WORKOUT_ROUTINE, context.getUserId(), routineId);

        return exerciseRoutineRepository.findByWorkoutRoutineIdOrderByIdAsc(routineId).stream()
                .map(ExerciseRoutineView::from)
                .collect(Collectors.toList());
    }

    /**
     * Applies the non-null fields of {@code input}.
     */
    @Transactional
    public ExerciseRoutineView updateExerciseRoutine(RequestContext context, String exerciseRoutineId,
                                                     ExerciseRoutineInput input) {
        long id = ResourceIds.parse(EXERCISE_ROUTINE, exerciseRoutineId);
        accessControlService.verifyAccess(EXERCISE_ROUTINE, context.getUserId(), id);

        ExerciseRoutine exerciseRoutine = exerciseRoutineRepository.findById(id)
                .orElseThrow(ResourceAccessDeniedException::new);
        if (input.getName() != null) {
            validateName(input.getName());
            exerciseRoutine.setName(input.getName().trim());
        }
        if (input.getSets() != null) {
            exerciseRoutine.setSets(requireNonNegative("sets", input.getSets()));
        }
        if (input.getReps() != null) {
            exerciseRoutine.setReps(requireNonNegative("reps", input.getReps()));
        }

        log.info("User {} updated exercise routine {}", context.getUserId(), id);
        return ExerciseRoutineView.from(exerciseRoutineRepository.save(exerciseRoutine));
    }

    @Transactional
    public void deleteExerciseRoutine(RequestContext context, String exerciseRoutineId) {
        long id = ResourceIds.parse(EXERCISE_ROUTINE, exerciseRoutineId);
        accessControlService.verifyAccess(EXERCISE_ROUTINE, context.getUserId(), id);

        if (exerciseRoutineRepository.softDeleteById(id, Instant.now(clock)) == 0) {
            throw new ResourceAccessDeniedException();
        }
        log.info("User {} deleted exercise routine {}", context.getUserId(), id);
    }

    /**
     * Persists a new exercise routine under a routine the caller has already been checked against.
     */
    public ExerciseRoutine createExerciseRoutine(long workoutRoutineId, ExerciseRoutineInput input) {
        validateName(input.getName());
        ExerciseRoutine exerciseRoutine = new ExerciseRoutine();
        exerciseRoutine.setWorkoutRoutineId(workoutRoutineId);
        exerciseRoutine.setName(input.getName().trim());
        exerciseRoutine.setSets(requireNonNegative("sets", input.getSets() == null ? 0 : input.getSets()));
        exerciseRoutine.setReps(requireNonNegative("reps", input.getReps() == null ? 0 : input.getReps()));
        return exerciseRoutineRepository.save(exerciseRoutine);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Exercise routine name is required");
        }
    }

    static int requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new InvalidArgumentException("Invalid " + field + ": must not be negative");
        }
        return value;
    }
}
