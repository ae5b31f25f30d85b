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
import workout.logger.api.dto.SetEntryInput;
import workout.logger.api.dto.SetEntryView;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.loader.RequestContextFactory;
import workout.logger.api.security.PrincipalResolver;
import workout.logger.api.service.SetEntryService;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SetEntryController {
    private final SetEntryService setEntryService;
    private final PrincipalResolver principalResolver;
    private final RequestContextFactory requestContextFactory;

    public SetEntryController(
            SetEntryService setEntryService,
            PrincipalResolver principalResolver,
            RequestContextFactory requestContextFactory) {
        this.setEntryService = setEntryService;
        this.principalResolver = principalResolver;
        this.requestContextFactory = requestContextFactory;
    }

    @PostMapping("/exercises/{exerciseId}/sets")
    public ResponseEntity<SetEntryView> addSet(@PathVariable("exerciseId") String exerciseId,
                                               @RequestBody SetEntryInput input,
                                               Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return ResponseEntity.status(HttpStatus.CREATED).body(setEntryService.addSet(context, exerciseId, input));
        }
    }

    @GetMapping("/exercises/{exerciseId}/sets")
    public List<SetEntryView> getSets(@PathVariable("exerciseId") String exerciseId, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return setEntryService.getSets(context, exerciseId);
        }
    }

    @PutMapping("/sets/{id}")
    public SetEntryView updateSet(@PathVariable("id") String id,
                                  @RequestBody SetEntryInput input,
                                  Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            return setEntryService.updateSet(context, id, input);
        }
    }

    @DeleteMapping("/sets/{id}")
    public ResponseEntity<Void> deleteSet(@PathVariable("id") String id, Authentication authentication) {
        try (RequestContext context = requestContextFactory.open(principalResolver.resolve(authentication))) {
            setEntryService.deleteSet(context, id);
            return ResponseEntity.noContent().build();
        }
    }
}
