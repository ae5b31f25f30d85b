package workout.logger.api.loader;

import workout.logger.api.dto.ExerciseView;
import workout.logger.api.entity.Exercise;
import workout.logger.api.entity.WorkoutSession;
import workout.logger.api.repository.ExerciseRepository;
import workout.logger.api.repository.WorkoutSessionRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exercises one user recorded under a routine before a point in time, newest session first.
 * A batch costs two queries whatever the number of keys: the candidate sessions of every routine
 * in the batch up to the latest cut-off, then their exercises. Each key keeps the sessions that
 * started before its own cut-off.
 */
class PreviousExercisesFunction implements BatchFunction<PreviousExercisesKey, ExerciseView> {
    private final long userId;
    private final WorkoutSessionRepository workoutSessionRepository;
    private final ExerciseRepository exerciseRepository;

    PreviousExercisesFunction(long userId, WorkoutSessionRepository workoutSessionRepository,
                              ExerciseRepository exerciseRepository) {
        this.userId = userId;
        this.workoutSessionRepository = workoutSessionRepository;
        this.exerciseRepository = exerciseRepository;
    }

    @Override
    public Map<PreviousExercisesKey, List<ExerciseView>> load(List<PreviousExercisesKey> keys) {
        Set<Long> routineIds = keys.stream()
                .map(PreviousExercisesKey::getWorkoutRoutineId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Instant latest = keys.stream()
                .map(PreviousExercisesKey::getBefore)
                .max(Comparator.naturalOrder())
                .orElseThrow();

        List<WorkoutSession> sessions = workoutSessionRepository
                .findByUserIdAndWorkoutRoutineIdInAndStartBeforeOrderByStartDesc(userId, routineIds, latest);
        if (sessions.isEmpty()) {
            return Map.of();
        }

        List<Long> sessionIds = sessions.stream().map(WorkoutSession::getId).collect(Collectors.toList());
        Map<Long, List<ExerciseView>> exercisesBySession = BatchFunction.groupBy(
                exerciseRepository.findByWorkoutSessionIdInOrderByIdAsc(sessionIds),
                Exercise::getWorkoutSessionId,
                ExerciseView::from);

        Map<PreviousExercisesKey, List<ExerciseView>> result = new LinkedHashMap<>();
        for (PreviousExercisesKey key : keys) {
            List<ExerciseView> exercises = new ArrayList<>();
            for (WorkoutSession session : sessions) {
                if (session.getWorkoutRoutineId() == key.getWorkoutRoutineId()
                        && session.getStart().isBefore(key.getBefore())) {
                    exercises.addAll(exercisesBySession.getOrDefault(session.getId(), List.of()));
                }
            }
            result.put(key, exercises);
        }
        return result;
    }
}
