package workout.logger.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workout.logger.api.dto.ExerciseInput;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.UpdateWorkoutSessionInput;
import workout.logger.api.dto.WorkoutSessionInput;
import workout.logger.api.dto.WorkoutSessionView;
import workout.logger.api.entity.WorkoutSession;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.PreviousExercisesKey;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.repository.ExerciseRepository;
import workout.logger.api.repository.SetEntryRepository;
import workout.logger.api.repository.WorkoutSessionRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.ResourceIds;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static workout.logger.api.security.OwnershipChain.WORKOUT_ROUTINE;
import static workout.logger.api.security.OwnershipChain.WORKOUT_SESSION;

@Slf4j
@Service
public class WorkoutSessionService {
    private final WorkoutSessionRepository workoutSessionRepository;
    private final ExerciseRepository exerciseRepository;
    private final SetEntryRepository setEntryRepository;
    private final ExerciseService exerciseService;
    private final AccessControlService accessControlService;
    private final Clock clock;

    public WorkoutSessionService(
            WorkoutSessionRepository workoutSessionRepository,
            ExerciseRepository exerciseRepository,
            SetEntryRepository setEntryRepository,
            ExerciseService exerciseService,
            AccessControlService accessControlService,
            Clock clock) {
        this.workoutSessionRepository = workoutSessionRepository;
        this.exerciseRepository = exerciseRepository;
        this.setEntryRepository = setEntryRepository;
        this.exerciseService = exerciseService;
        this.accessControlService = accessControlService;
        this.clock = clock;
    }

    /**
     * Records a session against one of the caller's routines. Every exercise must reference an
     * exercise routine the caller owns; the whole session is rejected otherwise.
     */
    @Transactional
    public WorkoutSessionView addWorkoutSession(RequestContext context, WorkoutSessionInput input) {
        long routineId = ResourceIds.parse(WORKOUT_ROUTINE, input.getWorkoutRoutineId());
        accessControlService.verifyAccess(WORKOUT_ROUTINE, context.getUserId(), routineId);
        validateTimes(input.getStart(), input.getEnd());

        WorkoutSession session = new WorkoutSession();
        session.setUserId(context.getUserId());
        session.setWorkoutRoutineId(routineId);
        session.setStart(input.getStart());
        session.setEnd(input.getEnd());
        session = workoutSessionRepository.save(session);

        List<ExerciseView> exercises = new ArrayList<>();
        if (input.getExercises() != null) {
            for (ExerciseInput exerciseInput : input.getExercises()) {
                exercises.add(exerciseService.createExercise(context, session.getId(), exerciseInput));
            }
        }

        log.info("User {} added workout session {} with {} exercises",
                context.getUserId(), session.getId(), exercises.size());
        return toView(session, exercises, previousExercises(context, List.of(session)));
    }

    /**
     * All of the caller's sessions, newest first. Exercises come from one batched fetch across
     * sessions and their sets from one batched fetch across exercises.
     */
    @Transactional(readOnly = true)
    public List<WorkoutSessionView> getWorkoutSessions(RequestContext context) {
        List<WorkoutSession> sessions = workoutSessionRepository.findByUserIdOrderByStartDesc(context.getUserId());
        return assemble(context, sessions);
    }

    @Transactional(readOnly = true)
    public WorkoutSessionView getWorkoutSession(RequestContext context, String workoutSessionId) {
        long id = ResourceIds.parse(WORKOUT_SESSION, workoutSessionId);
        accessControlService.verifyAccess(WORKOUT_SESSION, context.getUserId(), id);

        return assemble(context, List.of(findSession(id))).get(0);
    }

    @Transactional
    public WorkoutSessionView updateWorkoutSession(RequestContext context, String workoutSessionId,
                                                   UpdateWorkoutSessionInput input) {
        long id = ResourceIds.parse(WORKOUT_SESSION, workoutSessionId);
        accessControlService.verifyAccess(WORKOUT_SESSION, context.getUserId(), id);

        WorkoutSession session = findSession(id);
        Instant start = input.getStart() != null ? input.getStart() : session.getStart();
        Instant end = input.getEnd() != null ? input.getEnd() : session.getEnd();
        validateTimes(start, end);
        session.setStart(start);
        session.setEnd(end);
        session = workoutSessionRepository.save(session);

        log.info("User {} updated workout session {}", context.getUserId(), id);
        return assemble(context, List.of(session)).get(0);
    }

    /**
     * Soft-deletes the session with its exercises and their sets in one transaction.
     */
    @Transactional
    public void deleteWorkoutSession(RequestContext context, String workoutSessionId) {
        long id = ResourceIds.parse(WORKOUT_SESSION, workoutSessionId);
        accessControlService.verifyAccess(WORKOUT_SESSION, context.getUserId(), id);

        Instant now = Instant.now(clock);
        List<Long> exerciseIds = exerciseRepository.findIdsByWorkoutSessionId(id);
        int sets = exerciseIds.isEmpty() ? 0 : setEntryRepository.softDeleteByExerciseIdIn(exerciseIds, now);
        int exercises = exerciseRepository.softDeleteByWorkoutSessionId(id, now);
        if (workoutSessionRepository.softDeleteById(id, now) == 0) {
            throw new ResourceAccessDeniedException();
        }
        log.info("User {} deleted workout session {} with {} exercises and {} sets",
                context.getUserId(), id, exercises, sets);
    }

    private List<WorkoutSessionView> assemble(RequestContext context, List<WorkoutSession> sessions) {
        if (sessions.isEmpty()) {
            return List.of();
        }

        List<Long> sessionIds = sessions.stream().map(WorkoutSession::getId).collect(Collectors.toList());
        Map<Long, List<ExerciseView>> exercisesBySession =
                context.getLoaders().exercisesByWorkoutSession().fetch(sessionIds);

        List<ExerciseView> allExercises = new ArrayList<>();
        for (Long sessionId : sessionIds) {
            allExercises.addAll(exercisesBySession.get(sessionId));
        }
        Iterator<ExerciseView> withSets = exerciseService.attachSets(context, allExercises).iterator();
        Map<Long, List<ExerciseView>> previousBySession = previousExercises(context, sessions);

        List<WorkoutSessionView> views = new ArrayList<>(sessions.size());
        for (WorkoutSession session : sessions) {
            int count = exercisesBySession.get(session.getId()).size();
            List<ExerciseView> exercises = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                exercises.add(withSets.next());
            }
            views.add(toView(session, exercises, previousBySession));
        }
        return views;
    }

    /**
     * Exercises recorded before each ended session under the same routine, newest session first,
     * from one batched fetch. Open sessions are left out and read as an empty history.
     */
    private Map<Long, List<ExerciseView>> previousExercises(RequestContext context, List<WorkoutSession> sessions) {
        Map<Long, PreviousExercisesKey> keys = new LinkedHashMap<>();
        for (WorkoutSession session : sessions) {
            if (session.getEnd() != null) {
                keys.put(session.getId(), new PreviousExercisesKey(session.getWorkoutRoutineId(), session.getStart()));
            }
        }
        if (keys.isEmpty()) {
            return Map.of();
        }

        Map<PreviousExercisesKey, List<ExerciseView>> loaded =
                context.getLoaders().previousExercises().fetch(keys.values());
        Map<Long, List<ExerciseView>> previousBySession = new LinkedHashMap<>();
        keys.forEach((sessionId, key) -> previousBySession.put(sessionId, loaded.get(key)));
        return previousBySession;
    }

    private WorkoutSession findSession(long id) {
        return workoutSessionRepository.findById(id).orElseThrow(ResourceAccessDeniedException::new);
    }

    private static WorkoutSessionView toView(WorkoutSession session, List<ExerciseView> exercises,
                                             Map<Long, List<ExerciseView>> previousBySession) {
        return WorkoutSessionView.builder()
                .id(ResourceIds.format(session.getId()))
                .start(session.getStart())
                .end(session.getEnd())
                .workoutRoutineId(ResourceIds.format(session.getWorkoutRoutineId()))
                .exercises(exercises)
                .prevExercises(previousBySession.getOrDefault(session.getId(), List.of()))
                .build();
    }

    static void validateTimes(Instant start, Instant end) {
        if (start == null) {
            throw new InvalidArgumentException("Session start is required");
        }
        if (end != null && end.isBefore(start)) {
            throw new InvalidArgumentException("Session end is before its start");
        }
    }
}
