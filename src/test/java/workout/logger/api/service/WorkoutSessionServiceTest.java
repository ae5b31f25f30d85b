package workout.logger.api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import workout.logger.api.dto.ExerciseInput;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.UpdateWorkoutSessionInput;
import workout.logger.api.dto.WorkoutSessionInput;
import workout.logger.api.dto.WorkoutSessionView;
import workout.logger.api.entity.Exercise;
import workout.logger.api.entity.WorkoutSession;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.PreviousExercisesKey;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.TestRequestContexts;
import workout.logger.api.repository.ExerciseRepository;
import workout.logger.api.repository.SetEntryRepository;
import workout.logger.api.repository.WorkoutSessionRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.OwnershipChain;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkoutSessionServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant START = Instant.parse("2024-03-01T08:00:00Z");
    private static final Instant END = Instant.parse("2024-03-01T09:15:00Z");
    private static final long USER_ID = 1L;

    @Mock
    private WorkoutSessionRepository workoutSessionRepository;

    @Mock
    private ExerciseRepository exerciseRepository;

    @Mock
    private SetEntryRepository setEntryRepository;

    @Mock
    private ExerciseService exerciseService;

    @Mock
    private AccessControlService accessControlService;

    private WorkoutSessionService workoutSessionService;

    @BeforeEach
    void setUp() {
        workoutSessionService = new WorkoutSessionService(workoutSessionRepository, exerciseRepository,
                setEntryRepository, exerciseService, accessControlService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void addWorkoutSession_ShouldCheckRoutineThenCreateEachExercise() {
        // Given
        RequestContext context = TestRequestContexts.forUser(USER_ID);
        when(workoutSessionRepository.save(any(WorkoutSession.class))).thenAnswer(invocation -> {
            WorkoutSession session = invocation.getArgument(0);
            session.setId(7L);
            return session;
        });
        ExerciseInput squat = new ExerciseInput("9", "easy", List.of());
        ExerciseView created = ExerciseView.builder().id("31").exerciseRoutineId("9").notes("easy").sets(List.of()).build();
        when(exerciseService.createExercise(context, 7L, squat)).thenReturn(created);

        // When
        WorkoutSessionView view = workoutSessionService.addWorkoutSession(context,
                new WorkoutSessionInput("5", START, END, List.of(squat)));

        // Then
        verify(accessControlService).verifyAccess(OwnershipChain.WORKOUT_ROUTINE, USER_ID, 5L);
        assertEquals("7", view.getId());
        assertEquals("5", view.getWorkoutRoutineId());
        assertEquals(List.of(created), view.getExercises());
    }

    @Test
    void addWorkoutSession_WithRoutineOfAnotherUser_ShouldNotSave() {
        // Given
        doThrow(new ResourceAccessDeniedException())
                .when(accessControlService).verifyAccess(OwnershipChain.WORKOUT_ROUTINE, USER_ID, 6L);

        // When / Then
        assertThrows(ResourceAccessDeniedException.class, () -> workoutSessionService.addWorkoutSession(
                TestRequestContexts.forUser(USER_ID), new WorkoutSessionInput("6", START, END, List.of())));
        verifyNoInteractions(workoutSessionRepository, exerciseService);
    }

    @Test
    void addWorkoutSession_WithEndBeforeStart_ShouldThrowInvalidArgument() {
        assertThrows(InvalidArgumentException.class, () -> workoutSessionService.addWorkoutSession(
                TestRequestContexts.forUser(USER_ID), new WorkoutSessionInput("5", END, START, List.of())));
        verifyNoInteractions(workoutSessionRepository);
    }

    @Test
    void addWorkoutSession_WithoutStart_ShouldThrowInvalidArgument() {
        assertThrows(InvalidArgumentException.class, () -> workoutSessionService.addWorkoutSession(
                TestRequestContexts.forUser(USER_ID), new WorkoutSessionInput("5", null, END, List.of())));
        verifyNoInteractions(workoutSessionRepository);
    }

    @Test
    void getWorkoutSessions_ShouldLoadExercisesOfAllSessionsInOneBatch() {
        // Given
        when(workoutSessionRepository.findByUserIdOrderByStartDesc(USER_ID))
                .thenReturn(List.of(session(9L), session(8L), session(7L)));
        List<List<Long>> batches = new ArrayList<>();
        RequestContext context = TestRequestContexts.forUser(USER_ID,
                keys -> Map.of(),
                keys -> {
                    batches.add(keys);
                    return Map.of(
                            9L, List.of(ExerciseView.from(exercise(33L, 9L))),
                            7L, List.of(ExerciseView.from(exercise(31L, 7L)), ExerciseView.from(exercise(32L, 7L))));
                },
                keys -> Map.of());
        when(exerciseService.attachSets(eq(context), anyList())).thenAnswer(invocation -> {
            List<ExerciseView> exercises = invocation.getArgument(1);
            return exercises.stream()
                    .map(exercise -> exercise.toBuilder().sets(List.of()).build())
                    .collect(Collectors.toList());
        });

        // When
        List<WorkoutSessionView> views = workoutSessionService.getWorkoutSessions(context);

        // Then
        assertEquals(List.of(List.of(9L, 8L, 7L)), batches);
        assertEquals(List.of("33"), exerciseIds(views.get(0)));
        assertEquals(List.of(), exerciseIds(views.get(1)));
        assertEquals(List.of("31", "32"), exerciseIds(views.get(2)));
        verify(exerciseService, times(1)).attachSets(eq(context), anyList());
        verifyNoInteractions(accessControlService);
    }

    @Test
    void getWorkoutSession_WhileOpen_ShouldHaveNoPreviousExercisesAndSkipTheirLoad() {
        // Given
        WorkoutSession open = session(7L);
        open.setEnd(null);
        when(workoutSessionRepository.findById(7L)).thenReturn(Optional.of(open));
        RequestContext context = TestRequestContexts.forUser(USER_ID,
                keys -> Map.of(), keys -> Map.of(), keys -> Map.of(),
                keys -> {
                    throw new AssertionError("open sessions have no history to load");
                });

        // When
        WorkoutSessionView view = workoutSessionService.getWorkoutSession(context, "7");

        // Then
        assertEquals(List.of(), view.getPrevExercises());
        assertNull(view.getEnd());
    }

    @Test
    void getWorkoutSession_WhenEnded_ShouldListExercisesOfEarlierSessionsOfItsRoutine() {
        // Given
        when(workoutSessionRepository.findById(7L)).thenReturn(Optional.of(session(7L)));
        List<List<PreviousExercisesKey>> batches = new ArrayList<>();
        RequestContext context = TestRequestContexts.forUser(USER_ID,
                keys -> Map.of(), keys -> Map.of(), keys -> Map.of(),
                keys -> {
                    batches.add(keys);
                    return Map.of(new PreviousExercisesKey(5L, START),
                            List.of(ExerciseView.from(exercise(21L, 3L)), ExerciseView.from(exercise(11L, 2L))));
                });

        // When
        WorkoutSessionView view = workoutSessionService.getWorkoutSession(context, "7");

        // Then
        assertEquals(List.of(List.of(new PreviousExercisesKey(5L, START))), batches);
        assertEquals(List.of("21", "11"),
                view.getPrevExercises().stream().map(ExerciseView::getId).collect(Collectors.toList()));
    }

    @Test
    void getWorkoutSessions_ShouldLoadPreviousExercisesOfEndedSessionsInOneBatch() {
        // Given
        Instant earlier = START.minusSeconds(86_400);
        WorkoutSession open = session(9L);
        open.setEnd(null);
        WorkoutSession yesterday = session(7L);
        yesterday.setStart(earlier);
        yesterday.setEnd(earlier.plusSeconds(3600));
        when(workoutSessionRepository.findByUserIdOrderByStartDesc(USER_ID))
                .thenReturn(List.of(open, session(8L), yesterday));
        List<List<PreviousExercisesKey>> batches = new ArrayList<>();
        RequestContext context = TestRequestContexts.forUser(USER_ID,
                keys -> Map.of(), keys -> Map.of(), keys -> Map.of(),
                keys -> {
                    batches.add(keys);
                    return Map.of(new PreviousExercisesKey(5L, START), List.of(ExerciseView.from(exercise(31L, 7L))));
                });

        // When
        List<WorkoutSessionView> views = workoutSessionService.getWorkoutSessions(context);

        // Then
        assertEquals(List.of(List.of(new PreviousExercisesKey(5L, START), new PreviousExercisesKey(5L, earlier))),
                batches);
        assertEquals(List.of(), views.get(0).getPrevExercises());
        assertEquals("31", views.get(1).getPrevExercises().get(0).getId());
        assertEquals(List.of(), views.get(2).getPrevExercises());
    }

    @Test
    void getWorkoutSessions_WithNoSessions_ShouldReturnEmptyList() {
        // Given
        when(workoutSessionRepository.findByUserIdOrderByStartDesc(USER_ID)).thenReturn(List.of());

        // When / Then
        assertEquals(List.of(), workoutSessionService.getWorkoutSessions(TestRequestContexts.forUser(USER_ID)));
        verifyNoInteractions(exerciseService);
    }

    @Test
    void updateWorkoutSession_WithEndBeforeStoredStart_ShouldThrowInvalidArgument() {
        // Given
        when(workoutSessionRepository.findById(7L)).thenReturn(Optional.of(session(7L)));

        // When / Then
        assertThrows(InvalidArgumentException.class, () -> workoutSessionService.updateWorkoutSession(
                TestRequestContexts.forUser(USER_ID), "7",
                new UpdateWorkoutSessionInput(null, START.minusSeconds(60))));
        verify(workoutSessionRepository, never()).save(any());
    }

    @Test
    void deleteWorkoutSession_ShouldSoftDeleteSetsExercisesAndSession() {
        // Given
        when(exerciseRepository.findIdsByWorkoutSessionId(7L)).thenReturn(List.of(31L, 32L));
        when(setEntryRepository.softDeleteByExerciseIdIn(List.of(31L, 32L), NOW)).thenReturn(5);
        when(exerciseRepository.softDeleteByWorkoutSessionId(7L, NOW)).thenReturn(2);
        when(workoutSessionRepository.softDeleteById(7L, NOW)).thenReturn(1);

        // When
        workoutSessionService.deleteWorkoutSession(TestRequestContexts.forUser(USER_ID), "7");

        // Then
        verify(accessControlService).verifyAccess(OwnershipChain.WORKOUT_SESSION, USER_ID, 7L);
        verify(setEntryRepository).softDeleteByExerciseIdIn(List.of(31L, 32L), NOW);
        verify(exerciseRepository).softDeleteByWorkoutSessionId(7L, NOW);
        verify(workoutSessionRepository).softDeleteById(7L, NOW);
    }

    @Test
    void deleteWorkoutSession_WithoutExercises_ShouldSkipSets() {
        // Given
        when(exerciseRepository.findIdsByWorkoutSessionId(7L)).thenReturn(List.of());
        when(workoutSessionRepository.softDeleteById(7L, NOW)).thenReturn(1);

        // When
        workoutSessionService.deleteWorkoutSession(TestRequestContexts.forUser(USER_ID), "7");

        // Then
        verifyNoInteractions(setEntryRepository);
    }

    @Test
    void deleteWorkoutSession_WhenNotOwned_ShouldNotTouchStorage() {
        // Given
        doThrow(new ResourceAccessDeniedException())
                .when(accessControlService).verifyAccess(OwnershipChain.WORKOUT_SESSION, USER_ID, 7L);

        // When / Then
        assertThrows(ResourceAccessDeniedException.class,
                () -> workoutSessionService.deleteWorkoutSession(TestRequestContexts.forUser(USER_ID), "7"));
        verifyNoInteractions(workoutSessionRepository, exerciseRepository, setEntryRepository);
    }

    private static List<String> exerciseIds(WorkoutSessionView view) {
        return view.getExercises().stream().map(ExerciseView::getId).collect(Collectors.toList());
    }

    private static WorkoutSession session(long id) {
        WorkoutSession session = new WorkoutSession();
        session.setId(id);
        session.setUserId(USER_ID);
        session.setWorkoutRoutineId(5L);
        session.setStart(START);
        session.setEnd(END);
        return session;
    }

    private static Exercise exercise(long id, long workoutSessionId) {
        Exercise exercise = new Exercise();
        exercise.setId(id);
        exercise.setWorkoutSessionId(workoutSessionId);
        exercise.setExerciseRoutineId(9L);
        return exercise;
    }
}
