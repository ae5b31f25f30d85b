package workout.logger.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workout.logger.api.dto.ExerciseInput;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.SetEntryInput;
import workout.logger.api.dto.SetEntryView;
import workout.logger.api.dto.UpdateExerciseInput;
import workout.logger.api.entity.Exercise;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.repository.ExerciseRepository;
import workout.logger.api.repository.SetEntryRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.ResourceIds;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static workout.logger.api.security.OwnershipChain.EXERCISE;
import static workout.logger.api.security.OwnershipChain.EXERCISE_ROUTINE;
import static workout.logger.api.security.OwnershipChain.WORKOUT_SESSION;

@Slf4j
@Service
public class ExerciseService {
    private final ExerciseRepository exerciseRepository;
    private final SetEntryRepository setEntryRepository;
    private final SetEntryService setEntryService;
    private final AccessControlService accessControlService;
    private final Clock clock;

    public ExerciseService(
            ExerciseRepository exerciseRepository,
            SetEntryRepository setEntryRepository,
            SetEntryService setEntryService,
            AccessControlService accessControlService,
            Clock clock) {
        this.exerciseRepository = exerciseRepository;
        this.setEntryRepository = setEntryRepository;
        this.setEntryService = setEntryService;
        this.accessControlService = accessControlService;
        this.clock = clock;
    }

    @Transactional
    public ExerciseView addExercise(RequestContext context, String workoutSessionId, ExerciseInput input) {
        long sessionId = ResourceIds.parse(WORKOUT_SESSION, workoutSessionId);
        accessControlService.verifyAccess(WORKOUT_SESSION, context.getUserId(), sessionId);

        ExerciseView exercise = createExercise(context, sessionId, input);
        log.info("User {} added exercise {} to workout session {}", context.getUserId(), exercise.getId(), sessionId);
        return exercise;
    }

    @Transactional(readOnly = true)
    public ExerciseView getExercise(RequestContext context, String exerciseId) {
        long id = ResourceIds.parse(EXERCISE, exerciseId);
        accessControlService.verifyAccess(EXERCISE, context.getUserId(), id);

        Exercise exercise = exerciseRepository.findById(id).orElseThrow(ResourceAccessDeniedException::new);
        return withSets(exercise);
    }

    /**
     * Exercises of one session; the sets of all of them come from one batched fetch.
     */
    @Transactional(readOnly = true)
    public List<ExerciseView> getExercises(RequestContext context, String workoutSessionId) {
        long sessionId = ResourceIds.parse(WORKOUT_SESSION, workoutSessionId);
        accessControlService.verifyAccess(WORKOUT_SESSION, context.getUserId(), sessionId);

        List<ExerciseView> exercises = exerciseRepository.findByWorkoutSessionIdOrderByIdAsc(sessionId).stream()
                .map(ExerciseView::from)
                .collect(Collectors.toList());
        return attachSets(context, exercises);
    }

    @Transactional
    public ExerciseView updateExercise(RequestContext context, String exerciseId, UpdateExerciseInput input) {
        long id = ResourceIds.parse(EXERCISE, exerciseId);
        accessControlService.verifyAccess(EXERCISE, context.getUserId(), id);

        Exercise exercise = exerciseRepository.findById(id).orElseThrow(ResourceAccessDeniedException::new);
        exercise.setNotes(input.getNotes());
        exercise = exerciseRepository.save(exercise);

        log.info("User {} updated exercise {}", context.getUserId(), id);
        return withSets(exercise);
    }

    /**
     * Soft-deletes the exercise and its sets in one transaction.
     */
    @Transactional
    public void deleteExercise(RequestContext context, String exerciseId) {
        long id = ResourceIds.parse(EXERCISE, exerciseId);
        accessControlService.verifyAccess(EXERCISE, context.getUserId(), id);

        Instant now = Instant.now(clock);
        int sets = setEntryRepository.softDeleteByExerciseIdIn(List.of(id), now);
        if (exerciseRepository.softDeleteById(id, now) == 0) {
            throw new ResourceAccessDeniedException();
        }
        log.info("User {} deleted exercise {} and {} sets", context.getUserId(), id, sets);
    }

    /**
     * Persists an exercise and its sets under a session the caller has already been checked against.
     * The referenced exercise routine must belong to the caller as well.
     */
    public ExerciseView createExercise(RequestContext context, long workoutSessionId, ExerciseInput input) {
        long exerciseRoutineId = ResourceIds.parse(EXERCISE_ROUTINE, input.getExerciseRoutineId());
        accessControlService.verifyAccess(EXERCISE_ROUTINE, context.getUserId(), exerciseRoutineId);

        Exercise exercise = new Exercise();
        exercise.setWorkoutSessionId(workoutSessionId);
        exercise.setExerciseRoutineId(exerciseRoutineId);
        exercise.setNotes(input.getNotes());
        exercise = exerciseRepository.save(exercise);

        List<SetEntryView> sets = new ArrayList<>();
        if (input.getSetEntries() != null) {
            for (SetEntryInput setEntryInput : input.getSetEntries()) {
                sets.add(SetEntryView.from(setEntryService.createSetEntry(exercise.getId(), setEntryInput)));
            }
        }
        return ExerciseView.from(exercise).toBuilder().sets(sets).build();
    }

    /**
     * Returns {@code exercises} in the same order with their sets attached, using the request's set loader.
     */
    public List<ExerciseView> attachSets(RequestContext context, List<ExerciseView> exercises) {
        if (exercises.isEmpty()) {
            return List.of();
        }
        List<Long> exerciseIds = exercises.stream()
                .map(exercise -> Long.valueOf(exercise.getId()))
                .collect(Collectors.toList());
        Map<Long, List<SetEntryView>> sets = context.getLoaders().setEntriesByExercise().fetch(exerciseIds);

        List<ExerciseView> views = new ArrayList<>(exercises.size());
        for (int i = 0; i < exercises.size(); i++) {
            views.add(exercises.get(i).toBuilder().sets(sets.get(exerciseIds.get(i))).build());
        }
        return views;
    }

    private ExerciseView withSets(Exercise exercise) {
        List<SetEntryView> sets = setEntryRepository.findByExerciseIdOrderByIdAsc(exercise.getId()).stream()
                .map(SetEntryView::from)
                .collect(Collectors.toList());
        return ExerciseView.from(exercise).toBuilder().sets(sets).build();
    }
}
