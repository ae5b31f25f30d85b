package workout.logger.api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import workout.logger.api.dto.ExerciseRoutineInput;
import workout.logger.api.dto.ExerciseRoutineView;
import workout.logger.api.entity.ExerciseRoutine;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.TestRequestContexts;
import workout.logger.api.repository.ExerciseRoutineRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.OwnershipChain;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExerciseRoutineServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final long USER_ID = 1L;

    @Mock
    private ExerciseRoutineRepository exerciseRoutineRepository;

    @Mock
    private AccessControlService accessControlService;

    private ExerciseRoutineService exerciseRoutineService;

    @BeforeEach
    void setUp() {
        exerciseRoutineService = new ExerciseRoutineService(exerciseRoutineRepository, accessControlService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void addExerciseRoutine_ShouldCheckWorkoutRoutineAndSave() {
        // Given
        when(exerciseRoutineRepository.save(any(ExerciseRoutine.class))).thenAnswer(invocation -> {
            ExerciseRoutine exerciseRoutine = invocation.getArgument(0);
            exerciseRoutine.setId(9L);
            return exerciseRoutine;
        });

        // When
        ExerciseRoutineView view = exerciseRoutineService.addExerciseRoutine(TestRequestContexts.forUser(USER_ID), "5",
                new ExerciseRoutineInput("Overhead press", 4, 6));

        // Then
        verify(accessControlService).verifyAccess(OwnershipChain.WORKOUT_ROUTINE, USER_ID, 5L);
        assertEquals("9", view.getId());
        assertEquals(4, view.getSets());
        assertEquals(6, view.getReps());
    }

    @Test
    void addExerciseRoutine_WithNegativeSets_ShouldThrowInvalidArgument() {
        assertThrows(InvalidArgumentException.class, () -> exerciseRoutineService.addExerciseRoutine(
                TestRequestContexts.forUser(USER_ID), "5", new ExerciseRoutineInput("Row", -1, 8)));
        verify(exerciseRoutineRepository, never()).save(any());
    }

    @Test
    void updateExerciseRoutine_ShouldKeepFieldsThatAreNotProvided() {
        // Given
        ExerciseRoutine exerciseRoutine = new ExerciseRoutine();
        exerciseRoutine.setId(9L);
        exerciseRoutine.setWorkoutRoutineId(5L);
        exerciseRoutine.setName("Bench press");
        exerciseRoutine.setSets(3);
        exerciseRoutine.setReps(8);
        when(exerciseRoutineRepository.findById(9L)).thenReturn(Optional.of(exerciseRoutine));
        when(exerciseRoutineRepository.save(exerciseRoutine)).thenReturn(exerciseRoutine);

        // When
        ExerciseRoutineView view = exerciseRoutineService.updateExerciseRoutine(TestRequestContexts.forUser(USER_ID), "9",
                new ExerciseRoutineInput(null, 5, null));

        // Then
        verify(accessControlService).verifyAccess(OwnershipChain.EXERCISE_ROUTINE, USER_ID, 9L);
        assertEquals("Bench press", view.getName());
        assertEquals(5, view.getSets());
        assertEquals(8, view.getReps());
    }

    @Test
    void deleteExerciseRoutine_WhenDeletedConcurrently_ShouldThrowAccessDenied() {
        // Given
        when(exerciseRoutineRepository.softDeleteById(9L, NOW)).thenReturn(0);

        // When / Then
        assertThrows(ResourceAccessDeniedException.class,
                () -> exerciseRoutineService.deleteExerciseRoutine(TestRequestContexts.forUser(USER_ID), "9"));
    }
}
