package workout.logger.api.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import workout.logger.api.dto.ExerciseRoutineInput;
import workout.logger.api.dto.ExerciseRoutineView;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.RequestContextFactory;
import workout.logger.api.security.PrincipalResolver;
import workout.logger.api.service.ExerciseRoutineService;

import java.util.List;

/**
 * Exercise routines are created and listed under their workout routine and edited by their own id.
 */
@RestController
@RequestMapping("/api")
public class ExerciseRoutineController {
    private final ExerciseRoutineService exerciseRoutineService;
    private final PrincipalResolver principalResolver;
    private final RequestContextFactory requestContextFactory;

    public ExerciseRoutineController(
            ExerciseRoutineService exerciseRoutineService,
            PrincipalResolver principalResolver,
            RequestContextFactory requestContextFactory) {
        this.exerciseRoutineService = exerciseRoutineService;
        this.principalResolver = principalResolver;
        this.requestContextFactory = requestContextFactory;
    }

    @PostMapping("/workout-routines/{workoutRoutineId}/exercise-routines")
    public ResponseEntity<ExerciseRoutineView> addExerciseRoutine(@PathVariable("workoutRoutineId") String workoutRoutineId,
                                                                  @RequestBody ExerciseRoutineInput input,
                                                                  Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(exerciseRoutineService.addExerciseRoutine(context, workoutRoutineId, input));
        }
    }

    @GetMapping("/workout-routines/{workoutRoutineId}/exercise-routines")
    public List<ExerciseRoutineView> getExerciseRoutines(@PathVariable("workoutRoutineId") String workoutRoutineId,
                                                         Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return exerciseRoutineService.getExerciseRoutines(context, workoutRoutineId);
        }
    }

    @PutMapping("/exercise-routines/{id}")
    public ExerciseRoutineView updateExerciseRoutine(@PathVariable("id") String id,
                                                     @RequestBody ExerciseRoutineInput input,
                                                     Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return exerciseRoutineService.updateExerciseRoutine(context, id, input);
        }
    }

    @DeleteMapping("/exercise-routines/{id}")
    public ResponseEntity<Void> deleteExerciseRoutine(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            exerciseRoutineService.deleteExerciseRoutine(context, id);
            return ResponseEntity.noContent().build();
        }
    }
}
