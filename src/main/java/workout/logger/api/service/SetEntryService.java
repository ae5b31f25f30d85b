package workout.logger.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import workout.logger.api.dto.SetEntryInput;
import workout.logger.api.dto.SetEntryView;
import workout.logger.api.entity.SetEntry;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;
import workout.logger.api.loader.RequestContext;
import workout.logger.api.repository.SetEntryRepository;
import workout.logger.api.security.AccessControlService;
import workout.logger.api.security.ResourceIds;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static workout.logger.api.security.OwnershipChain.EXERCISE;
import static workout.logger.api.security.OwnershipChain.SET_ENTRY;

@Slf4j
@Service
public class SetEntryService {
    private final SetEntryRepository setEntryRepository;
    private final AccessControlService accessControlService;
    private final Clock clock;

    public SetEntryService(SetEntryRepository setEntryRepository, AccessControlService accessControlService, Clock clock) {
        this.setEntryRepository = setEntryRepository;
        this.accessControlService = accessControlService;
        this.clock = clock;
    }

    @Transactional
    public SetEntryView addSet(RequestContext context, String exerciseId, SetEntryInput input) {
        long parentId = ResourceIds.parse(EXERCISE, exerciseId);
        accessControlService.verifyAccess(EXERCISE, context.getUserId(), parentId);

        SetEntry saved = createSetEntry(parentId, input);
        log.info("User {} added set {} to exercise {}", context.getUserId(), saved.getId(), parentId);
        return SetEntryView.from(saved);
    }

    @Transactional(readOnly = true)
    public List<SetEntryView> getSets(RequestContext context, String exerciseId) {
        long parentId = ResourceIds.parse(EXERCISE, exerciseId);
        accessControlService.verifyAccess(EXERCISE, context.getUserId(), parentId);

        return setEntryRepository.findByExerciseIdOrderByIdAsc(parentId).stream()
                .map(SetEntryView::from)
                .collect(Collectors.toList());
    }

    /**
     * Applies the non-null fields of {@code input}.
     */
    @Transactional
    public SetEntryView updateSet(RequestContext context, String setId, SetEntryInput input) {
        long id = ResourceIds.parse(SET_ENTRY, setId);
        accessControlService.verifyAccess(SET_ENTRY, context.getUserId(), id);

        SetEntry setEntry = setEntryRepository.findById(id).orElseThrow(ResourceAccessDeniedException::new);
        if (input.getWeight() != null) {
            setEntry.setWeight(requireWeight(input.getWeight()));
        }
        if (input.getReps() != null) {
            setEntry.setReps(ExerciseRoutineService.requireNonNegative("reps", input.getReps()));
        }

        log.info("User {} updated set {}", context.getUserId(), id);
        return SetEntryView.from(setEntryRepository.save(setEntry));
    }

    @Transactional
    public void deleteSet(RequestContext context, String setId) {
        long id = ResourceIds.parse(SET_ENTRY, setId);
        accessControlService.verifyAccess(SET_ENTRY, context.getUserId(), id);

        if (setEntryRepository.softDeleteById(id, Instant.now(clock)) == 0) {
            throw new ResourceAccessDeniedException();
        }
        log.info("User {} deleted set {}", context.getUserId(), id);
    }

    /**
     * Persists a set under an exercise the caller has already been checked against.
     */
    public SetEntry createSetEntry(long exerciseId, SetEntryInput input) {
        SetEntry setEntry = new SetEntry();
        setEntry.setExerciseId(exerciseId);
        setEntry.setWeight(requireWeight(input.getWeight() == null ? 0.0 : input.getWeight()));
        setEntry.setReps(ExerciseRoutineService.requireNonNegative("reps", input.getReps() == null ? 0 : input.getReps()));
        return setEntryRepository.save(setEntry);
    }

    private static double requireWeight(double weight) {
        if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new InvalidArgumentException("Invalid weight");
        }
        return weight;
    }
}
