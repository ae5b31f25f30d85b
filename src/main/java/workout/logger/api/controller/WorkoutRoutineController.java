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
import workout.logger.api.dto.UpdateWorkoutRoutineInput;
import workout.logger.api.dto.WorkoutRoutineInput;
import workout.logger.api.dto.WorkoutRoutineView;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.RequestContextFactory;
import workout.logger.api.security.PrincipalResolver;
import workout.logger.api.service.WorkoutRoutineService;

import java.util.List;

@RestController
@RequestMapping("/api/workout-routines")
public class WorkoutRoutineController {
    private final WorkoutRoutineService workoutRoutineService;
    private final PrincipalResolver principalResolver;
    private final RequestContextFactory requestContextFactory;

    public WorkoutRoutineController(
            WorkoutRoutineService workoutRoutineService,
            PrincipalResolver principalResolver,
            RequestContextFactory requestContextFactory) {
        this.workoutRoutineService = workoutRoutineService;
        this.principalResolver = principalResolver;
        this.requestContextFactory = requestContextFactory;
    }

    @PostMapping
    public ResponseEntity<WorkoutRoutineView> createWorkoutRoutine(@RequestBody WorkoutRoutineInput input,
                                                                   Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(workoutRoutineService.createWorkoutRoutine(context, input));
        }
    }

    @GetMapping
    public List<WorkoutRoutineView> getWorkoutRoutines(Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return workoutRoutineService.getWorkoutRoutines(context);
        }
    }

    @GetMapping("/{id}")
    public WorkoutRoutineView getWorkoutRoutine(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return workoutRoutineService.getWorkoutRoutine(context, id);
        }
    }

    @PutMapping("/{id}")
    public WorkoutRoutineView updateWorkoutRoutine(@PathVariable("id") String id,
                                                   @RequestBody UpdateWorkoutRoutineInput input,
                                                   Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return workoutRoutineService.updateWorkoutRoutine(context, id, input);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteWorkoutRoutine(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            workoutRoutineService.deleteWorkoutRoutine(context, id);
            return ResponseEntity.noContent().build();
        }
    }
}
