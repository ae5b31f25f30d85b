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
import workout.logger.api.dto.ExerciseInput;
import workout.logger.api.dto.ExerciseView;
import workout.logger.api.dto.UpdateExerciseInput;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.RequestContextFactory;
import workout.logger.api.security.PrincipalResolver;
import workout.logger.api.service.ExerciseService;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ExerciseController {
    private final ExerciseService exerciseService;
    private final PrincipalResolver principalResolver;
    private final RequestContextFactory requestContextFactory;

    public ExerciseController(
            ExerciseService exerciseService,
            PrincipalResolver principalResolver,
            RequestContextFactory requestContextFactory) {
        this.exerciseService = exerciseService;
        this.principalResolver = principalResolver;
        this.requestContextFactory = requestContextFactory;
    }

    @PostMapping("/workout-sessions/{workoutSessionId}/exercises")
    public ResponseEntity<ExerciseView> addExercise(@PathVariable("workoutSessionId") String workoutSessionId,
                                                    @RequestBody ExerciseInput input,
                                                    Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(exerciseService.addExercise(context, workoutSessionId, input));
        }
    }

    @GetMapping("/workout-sessions/{workoutSessionId}/exercises")
    public List<ExerciseView> getExercises(@PathVariable("workoutSessionId") String workoutSessionId,
                                           Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return exerciseService.getExercises(context, workoutSessionId);
        }
    }

    @GetMapping("/exercises/{id}")
    public ExerciseView getExercise(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return exerciseService.getExercise(context, id);
        }
    }

    @PutMapping("/exercises/{id}")
    public ExerciseView updateExercise(@PathVariable("id") String id,
                                       @RequestBody UpdateExerciseInput input,
                                       Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return exerciseService.updateExercise(context, id, input);
        }
    }

    @DeleteMapping("/exercises/{id}")
    public ResponseEntity<Void> deleteExercise(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            exerciseService.deleteExercise(context, id);
            return ResponseEntity.noContent().build();
        }
    }
}
