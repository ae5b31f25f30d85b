package workout.logger.api.loader;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import workout.logger.api.dto.ExerciseRoutineView;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.SetEntryView;
import workout.logger.api.entity.Exercise;
import workout.logger.api.entity.ExerciseRoutine;
import workout.logger.api.entity.SetEntry;
import workout.logger.api.repository.ExerciseRepository;
import workout.logger.api.repository.ExerciseRoutineRepository;
import workout.logger.api.repository.SetEntryRepository;
import workout.logger.api.repository.WorkoutSessionRepository;
import workout.logger.api.security.Principal;

import java.util.concurrent.Executor;

/**
 * Builds a fresh {@link RequestContext} per request. Loaders are never shared between requests.
 */
@Component
public class RequestContextFactory {
    private final ExerciseRoutineRepository exerciseRoutineRepository;
    private final ExerciseRepository exerciseRepository;
    private final SetEntryRepository setEntryRepository;
    private final WorkoutSessionRepository workoutSessionRepository;
    private final Executor executor;
    private final int maxBatchSize;

    public RequestContextFactory(
            ExerciseRoutineRepository exerciseRoutineRepository,
            ExerciseRepository exerciseRepository,
            SetEntryRepository setEntryRepository,
            WorkoutSessionRepository workoutSessionRepository,
            @Qualifier("batchLoaderExecutor") Executor executor,
            @Value("${workout.loader.max-batch-size:100}") int maxBatchSize) {
        this.exerciseRoutineRepository = exerciseRoutineRepository;
        this.exerciseRepository = exerciseRepository;
        this.setEntryRepository = setEntryRepository;
        this.workoutSessionRepository = workoutSessionRepository;
        this.executor = executor;
        this.maxBatchSize = maxBatchSize;
    }

    public RequestContext open(Principal principal) {
        return new RequestContext(principal, newLoaders(principal.getId()));
    }

    RequestLoaders newLoaders(long userId) {
        BatchLoader<Long, ExerciseRoutineView> exerciseRoutines = new BatchLoader<>(
                "exerciseRoutinesByWorkoutRoutine",
                keys -> BatchFunction.groupBy(
                        exerciseRoutineRepository.findByWorkoutRoutineIdInOrderByIdAsc(keys),
                        ExerciseRoutine::getWorkoutRoutineId,
                        ExerciseRoutineView::from),
                executor,
                maxBatchSize);

        BatchLoader<Long, ExerciseView> exercises = new BatchLoader<>(
                "exercisesByWorkoutSession",
                keys -> BatchFunction.groupBy(
                        exerciseRepository.findByWorkoutSessionIdInOrderByIdAsc(keys),
                        Exercise::getWorkoutSessionId,
                        ExerciseView::from),
                executor,
                maxBatchSize);

        BatchLoader<Long, SetEntryView> setEntries = new BatchLoader<>(
                "setEntriesByExercise",
                keys -> BatchFunction.groupBy(
                        setEntryRepository.findByExerciseIdInOrderByIdAsc(keys),
                        SetEntry::getExerciseId,
                        SetEntryView::from),
                executor,
                maxBatchSize);

        BatchLoader<PreviousExercisesKey, ExerciseView> previousExercises = new BatchLoader<>(
                "previousExercises",
                new PreviousExercisesFunction(userId, workoutSessionRepository, exerciseRepository),
                executor,
                maxBatchSize);

        return new RequestLoaders(exerciseRoutines, exercises, setEntries, previousExercises);
    }
}
