package workout.logger.api.loader;

import workout.logger.api.dto.ExerciseRoutineView;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.SetEntryView;

/**
 * The loaders one request uses to hydrate child collections.
 */
public class RequestLoaders {
    private final BatchLoader<Long, ExerciseRoutineView> exerciseRoutinesByWorkoutRoutine;
    private final BatchLoader<Long, ExerciseView> exercisesByWorkoutSession;
    private final BatchLoader<Long, SetEntryView> setEntriesByExercise;
    private final BatchLoader<PreviousExercisesKey, ExerciseView> previousExercises;

    public RequestLoaders(
            BatchLoader<Long, ExerciseRoutineView> exerciseRoutinesByWorkoutRoutine,
            BatchLoader<Long, ExerciseView> exercisesByWorkoutSession,
            BatchLoader<Long, SetEntryView> setEntriesByExercise,
            BatchLoader<PreviousExercisesKey, ExerciseView> previousExercises) {
        this.exerciseRoutinesByWorkoutRoutine = exerciseRoutinesByWorkoutRoutine;
        this.exercisesByWorkoutSession = exercisesByWorkoutSession;
        this.setEntriesByExercise = setEntriesByExercise;
        this.previousExercises = previousExercises;
    }

    public BatchLoader<Long, ExerciseRoutineView> exerciseRoutinesByWorkoutRoutine() {
        return exerciseRoutinesByWorkoutRoutine;
    }

    public BatchLoader<Long, ExerciseView> exercisesByWorkoutSession() {
        return exercisesByWorkoutSession;
    }

    public BatchLoader<Long, SetEntryView> setEntriesByExercise() {
        return setEntriesByExercise;
    }

    public BatchLoader<PreviousExercisesKey, ExerciseView> previousExercises() {
        return previousExercises;
    }

    public void cancelAll() {
        exerciseRoutinesByWorkoutRoutine.cancel();
        exercisesByWorkoutSession.cancel();
        setEntriesByExercise.cancel();
        previousExercises.cancel();
    }
}
