package workout.logger.api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import workout.logger.api.dto.ExerciseInput;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.SetEntryInput;
import workout.logger.api.dto.SetEntryView;
import workout.logger.api.dto.UpdateExerciseInput;
import workout.logger.api.entity.Exercise;
import workout.logger.api.entity.SetEntry;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.TestRequestContexts;
import workout.logger.api.repository.ExerciseRepository;
import workout.logger.api.repository.SetEntryRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.OwnershipChain;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExerciseServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final long USER_ID = 1L;

    @Mock
    private ExerciseRepository exerciseRepository;

    @Mock
    private SetEntryRepository setEntryRepository;

    @Mock
    private SetEntryService setEntryService;

    @Mock
    private AccessControlService accessControlService;

    private ExerciseService exerciseService;

    @BeforeEach
    void setUp() {
        exerciseService = new ExerciseService(exerciseRepository, setEntryRepository, setEntryService,
                accessControlService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void addExercise_ShouldCheckSessionAndReferencedExerciseRoutine() {
        // Given
        when(exerciseRepository.save(any(Exercise.class))).thenAnswer(invocation -> {
            Exercise exercise = invocation.getArgument(0);
            exercise.setId(31L);
            return exercise;
        });
        SetEntryInput set = new SetEntryInput(60.0, 8);
        when(setEntryService.createSetEntry(31L, set)).thenReturn(setEntry(101L, 31L));

        // When
        ExerciseView view = exerciseService.addExercise(TestRequestContexts.forUser(USER_ID), "7",
                new ExerciseInput("9", "felt strong", List.of(set)));

        // Then
        verify(accessControlService).verifyAccess(OwnershipChain.WORKOUT_SESSION, USER_ID, 7L);
        verify(accessControlService).verifyAccess(OwnershipChain.EXERCISE_ROUTINE, USER_ID, 9L);
        assertEquals("31", view.getId());
        assertEquals("9", view.getExerciseRoutineId());
        assertEquals("101", view.getSets().get(0).getId());
    }

    @Test
    void addExercise_WithForeignExerciseRoutine_ShouldNotSave() {
        // Given
        lenient().doThrow(new ResourceAccessDeniedException())
                .when(accessControlService).verifyAccess(OwnershipChain.EXERCISE_ROUTINE, USER_ID, 10L);

        // When / Then
        assertThrows(ResourceAccessDeniedException.class, () -> exerciseService.addExercise(
                TestRequestContexts.forUser(USER_ID), "7", new ExerciseInput("10", null, List.of())));
        verify(accessControlService).verifyAccess(OwnershipChain.WORKOUT_SESSION, USER_ID, 7L);
        verifyNoInteractions(exerciseRepository, setEntryService);
    }

    @Test
    void addExercise_WithMissingExerciseRoutineId_ShouldThrowInvalidArgument() {
        assertThrows(InvalidArgumentException.class, () -> exerciseService.addExercise(
                TestRequestContexts.forUser(USER_ID), "7", new ExerciseInput(null, null, List.of())));
        verifyNoInteractions(exerciseRepository);
    }

    @Test
    void getExercises_ShouldLoadSetsOfAllExercisesInOneBatch() {
        // Given
        when(exerciseRepository.findByWorkoutSessionIdOrderByIdAsc(7L))
                .thenReturn(List.of(exercise(31L), exercise(32L)));
        List<List<Long>> batches = new ArrayList<>();
        RequestContext context = TestRequestContexts.forUser(USER_ID,
                keys -> Map.of(),
                keys -> Map.of(),
                keys -> {
                    batches.add(keys);
                    return Map.of(32L, List.of(SetEntryView.from(setEntry(101L, 32L))));
                });

        // When
        List<ExerciseView> views = exerciseService.getExercises(context, "7");

        // Then
        assertEquals(List.of(List.of(31L, 32L)), batches);
        assertEquals(List.of(), views.get(0).getSets());
        assertEquals("101", views.get(1).getSets().get(0).getId());
        verify(setEntryRepository, never()).findByExerciseIdOrderByIdAsc(anyLong());
    }

    @Test
    void attachSets_WithNoExercises_ShouldNotLoad() {
        // Given
        RequestContext context = TestRequestContexts.forUser(USER_ID,
                keys -> Map.of(),
                keys -> Map.of(),
                keys -> {
                    throw new AssertionError("unexpected batch " + keys);
                });

        // When / Then
        assertEquals(List.of(), exerciseService.attachSets(context, List.of()));
    }

    @Test
    void updateExercise_ShouldReplaceNotes() {
        // Given
        Exercise exercise = exercise(31L);
        when(exerciseRepository.findById(31L)).thenReturn(Optional.of(exercise));
        when(exerciseRepository.save(exercise)).thenReturn(exercise);
        when(setEntryRepository.findByExerciseIdOrderByIdAsc(31L)).thenReturn(List.of());

        // When
        ExerciseView view = exerciseService.updateExercise(TestRequestContexts.forUser(USER_ID), "31",
                new UpdateExerciseInput("grip slipped"));

        // Then
        verify(accessControlService).verifyAccess(OwnershipChain.EXERCISE, USER_ID, 31L);
        assertEquals("grip slipped", view.getNotes());
    }

    @Test
    void deleteExercise_ShouldSoftDeleteExerciseAndItsSets() {
        // Given
        when(setEntryRepository.softDeleteByExerciseIdIn(List.of(31L), NOW)).thenReturn(3);
        when(exerciseRepository.softDeleteById(31L, NOW)).thenReturn(1);

        // When
        exerciseService.deleteExercise(TestRequestContexts.forUser(USER_ID), "31");

        // Then
        verify(setEntryRepository).softDeleteByExerciseIdIn(List.of(31L), NOW);
        verify(exerciseRepository).softDeleteById(31L, NOW);
    }

    private static Exercise exercise(long id) {
        Exercise exercise = new Exercise();
        exercise.setId(id);
        exercise.setWorkoutSessionId(7L);
        exercise.setExerciseRoutineId(9L);
        return exercise;
    }

    private static SetEntry setEntry(long id, long exerciseId) {
        SetEntry setEntry = new SetEntry();
        setEntry.setId(id);
        setEntry.setExerciseId(exerciseId);
        setEntry.setWeight(60.0);
        setEntry.setReps(8);
        return setEntry;
    }
}
