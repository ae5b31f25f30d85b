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
import workout.logger.api.dto.UpdateWorkoutSessionInput;
import workout.logger.api.dto.WorkoutSessionInput;
import workout.logger.api.dto.WorkoutSessionView;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.RequestContextFactory;
import workout.logger.api.security.PrincipalResolver;
import workout.logger.api.service.WorkoutSessionService;

import java.util.List;

@RestController
@RequestMapping("/api/workout-sessions")
public class WorkoutSessionController {
    private final WorkoutSessionService workoutSessionService;
    private final PrincipalResolver principalResolver;
    private final RequestContextFactory requestContextFactory;

    public WorkoutSessionController(
            WorkoutSessionService workoutSessionService,
            PrincipalResolver principalResolver,
            RequestContextFactory requestContextFactory) {
        this.workoutSessionService = workoutSessionService;
        this.principalResolver = principalResolver;
        this.requestContextFactory = requestContextFactory;
    }

    @PostMapping
    public ResponseEntity<WorkoutSessionView> addWorkoutSession(@RequestBody WorkoutSessionInput input,
                                                                Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(workoutSessionService.addWorkoutSession(context, input));
        }
    }

    @GetMapping
    public List<WorkoutSessionView> getWorkoutSessions(Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return workoutSessionService.getWorkoutSessions(context);
        }
    }

    @GetMapping("/{id}")
    public WorkoutSessionView getWorkoutSession(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return workoutSessionService.getWorkoutSession(context, id);
        }
    }

    @PutMapping("/{id}")
    public WorkoutSessionView updateWorkoutSession(@PathVariable("id") String id,
                                                   @RequestBody UpdateWorkoutSessionInput input,
                                                   Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return workoutSessionService.updateWorkoutSession(context, id, input);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteWorkoutSession(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            workoutSessionService.deleteWorkoutSession(context, id);
            return ResponseEntity.noContent().build();
        }
    }
}
