package workout.logger.api.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import workout.logger.api.exception.BackendException;
import workout.logger.api.exception.InvalidArgumentException;
import workout.logger.api.exception.ResourceAccessDeniedException;

import java.util.List;

/**
 * Proves that a principal owns a resource, directly or through its parents.
 * Each check is one read that filters by the resource id and the owner at once,
 * so a missing, deleted or foreign resource all produce the same denial.
 */
@Slf4j
@Service
public class AccessControlService {
    private final JdbcTemplate jdbcTemplate;

    public AccessControlService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns normally when {@code principal} owns the resource.
     *
     * @throws InvalidArgumentException if {@code resourceId} is not a positive integer
     * @throws ResourceAccessDeniedException if the ownership chain does not resolve to the principal
     * @throws BackendException if the read itself fails
     */
    public void verifyAccess(OwnershipChain chain, Principal principal, String resourceId) {
        verifyAccess(chain, principal.getId(), resourceId);
    }

    public void verifyAccess(OwnershipChain chain, long principalId, String resourceId) {
        verifyAccess(chain, principalId, ResourceIds.parse(chain, resourceId));
    }

    public void verifyAccess(OwnershipChain chain, long principalId, long id) {
        if (id <= 0) {
            throw new InvalidArgumentException("Invalid " + chain.getResourceName() + " ID");
        }
        if (principalId <= 0) {
            throw new InvalidArgumentException("Invalid principal ID");
        }

        List<Long> rows;
        try {
            rows = jdbcTemplate.queryForList(chain.getAccessQuery(), Long.class, id, principalId);
        } catch (DataAccessException e) {
            log.error("Access check on {} {} for user {} failed: {}",
                    chain.getResourceName(), id, principalId, e.getMessage(), e);
            throw new BackendException("Failed to verify access to " + chain.getResourceName(), e);
        }

        if (rows.isEmpty()) {
            log.debug("User {} denied access to {} {}", principalId, chain.getResourceName(), id);
            throw new ResourceAccessDeniedException();
        }
    }
}
