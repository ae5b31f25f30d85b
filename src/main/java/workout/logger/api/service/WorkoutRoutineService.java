package workout.logger.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workout.logger.api.dto.ExerciseRoutineInput;
import workout.logger.api.dto.ExerciseRoutineView;
import workout.logger.api.dto.UpdateWorkoutRoutineInput;
import workout.logger.api.dto.WorkoutRoutineInput;
import workout.logger.api.dto.WorkoutRoutineView;
import workout.logger.api.entity.ExerciseRoutine;
import workout.logger.api.entity.WorkoutRoutine;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.repository.ExerciseRoutineRepository;
import workout.logger.api.repository.WorkoutRoutineRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.ResourceIds;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static workout.logger.api.security.OwnershipChain.WORKOUT_ROUTINE;

@Slf4j
@Service
public class WorkoutRoutineService {
    static final int MIN_NAME_LENGTH = 3;

    private final WorkoutRoutineRepository workoutRoutineRepository;
    private final ExerciseRoutineRepository exerciseRoutineRepository;
    private final ExerciseRoutineService exerciseRoutineService;
    private final AccessControlService accessControlService;
    private final Clock clock;

    public WorkoutRoutineService(
            WorkoutRoutineRepository workoutRoutineRepository,
            ExerciseRoutineRepository exerciseRoutineRepository,
            ExerciseRoutineService exerciseRoutineService,
            AccessControlService accessControlService,
            Clock clock) {
        this.workoutRoutineRepository = workoutRoutineRepository;
        this.exerciseRoutineRepository = exerciseRoutineRepository;
        this.exerciseRoutineService = exerciseRoutineService;
        this.accessControlService = accessControlService;
        this.clock = clock;
    }

    @Transactional
    public WorkoutRoutineView createWorkoutRoutine(RequestContext context, WorkoutRoutineInput input) {
        validateName(input.getName());

        WorkoutRoutine routine = new WorkoutRoutine();
        routine.setUserId(context.getUserId());
        routine.setName(input.getName().trim());
        routine = workoutRoutineRepository.save(routine);

        List<ExerciseRoutineView> exerciseRoutines = new ArrayList<>();
        if (input.getExerciseRoutines() != null) {
            for (ExerciseRoutineInput exerciseRoutineInput : input.getExerciseRoutines()) {
                ExerciseRoutine saved = exerciseRoutineService.createExerciseRoutine(routine.getId(), exerciseRoutineInput);
                exerciseRoutines.add(ExerciseRoutineView.from(saved));
            }
        }

        log.info("User {} created workout routine {} with {} exercise routines",
                context.getUserId(), routine.getId(), exerciseRoutines.size());
        return toView(routine, exerciseRoutines);
    }

    /**
     * All of the caller's routines. Exercise routines for every routine come from one batched fetch.
     */
    @Transactional(readOnly = true)
    public List<WorkoutRoutineView> getWorkoutRoutines(RequestContext context) {
        List<WorkoutRoutine> routines = workoutRoutineRepository.findByUserIdOrderByIdAsc(context.getUserId());
        if (routines.isEmpty()) {
            return List.of();
        }

        List<Long> routineIds = routines.stream().map(WorkoutRoutine::getId).collect(Collectors.toList());
        Map<Long, List<ExerciseRoutineView>> exerciseRoutines =
                context.getLoaders().exerciseRoutinesByWorkoutRoutine().fetch(routineIds);

        List<WorkoutRoutineView> views = new ArrayList<>();
        for (WorkoutRoutine routine : routines) {
            views.add(toView(routine, exerciseRoutines.get(routine.getId())));
        }
        return views;
    }

    @Transactional(readOnly = true)
    public WorkoutRoutineView getWorkoutRoutine(RequestContext context, String workoutRoutineId) {
        long id = ResourceIds.parse(WORKOUT_ROUTINE, workoutRoutineId);
        accessControlService.verifyAccess(WORKOUT_ROUTINE, context.getUserId(), id);

        WorkoutRoutine routine = findRoutine(id);
        return toView(routine, listExerciseRoutines(id));
    }

    @Transactional
    public WorkoutRoutineView updateWorkoutRoutine(RequestContext context, String workoutRoutineId,
                                                   UpdateWorkoutRoutineInput input) {
        long id = ResourceIds.parse(WORKOUT_ROUTINE, workoutRoutineId);
        accessControlService.verifyAccess(WORKOUT_ROUTINE, context.getUserId(), id);
        validateName(input.getName());

        WorkoutRoutine routine = findRoutine(id);
        routine.setName(input.getName().trim());
        routine = workoutRoutineRepository.save(routine);

        log.info("User {} renamed workout routine {}", context.getUserId(), id);
        return toView(routine, listExerciseRoutines(id));
    }

    /**
     * Soft-deletes the routine and its exercise routines in one transaction.
     */
    @Transactional
    public void deleteWorkoutRoutine(RequestContext context, String workoutRoutineId) {
        long id = ResourceIds.parse(WORKOUT_ROUTINE, workoutRoutineId);
        accessControlService.verifyAccess(WORKOUT_ROUTINE, context.getUserId(), id);

        Instant now = Instant.now(clock);
        int exerciseRoutines = exerciseRoutineRepository.softDeleteByWorkoutRoutineId(id, now);
        if (workoutRoutineRepository.softDeleteById(id, now) == 0) {
            // Deleted concurrently after the access check
            throw new ResourceAccessDeniedException();
        }
        log.info("User {} deleted workout routine {} and {} exercise routines", context.getUserId(), id, exerciseRoutines);
    }

    private WorkoutRoutine findRoutine(long id) {
        return workoutRoutineRepository.findById(id).orElseThrow(ResourceAccessDeniedException::new);
    }

    private List<ExerciseRoutineView> listExerciseRoutines(long workoutRoutineId) {
        return exerciseRoutineRepository.findByWorkoutRoutineIdOrderByIdAsc(workoutRoutineId).stream()
                .map(ExerciseRoutineView::from)
                .collect(Collectors.toList());
    }

    private static WorkoutRoutineView toView(WorkoutRoutine routine, List<ExerciseRoutineView> exerciseRoutines) {
        return WorkoutRoutineView.builder()
                .id(ResourceIds.format(routine.getId()))
                .name(routine.getName())
                .exerciseRoutines(exerciseRoutines == null ? List.of() : exerciseRoutines)
                .build();
    }

    static void validateName(String name) {
        if (name == null || name.trim().length() < MIN_NAME_LENGTH) {
            throw new InvalidArgumentException("Invalid Routine Name Length");
        }
    }
}
