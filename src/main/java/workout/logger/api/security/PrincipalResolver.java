package workout.logger.api.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import workout.logger.api.exception.UnauthorizedException;
import workout.logger.api.service.UserService;

/**
 * Turns a validated bearer token into a {@link Principal}.
 * The token carries the numeric user id in the {@code id} claim and the email as subject.
 */
@Component
public class PrincipalResolver {
    static final String ID_CLAIM = "id";

    private final UserService userService;

    public PrincipalResolver(UserService userService) {
        this.userService = userService;
    }

    public Principal resolve(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof Jwt)) {
            throw new UnauthorizedException("No bearer token on request");
        }
        Jwt jwt = (Jwt) authentication.getPrincipal();

        long id = readId(jwt.getClaim(ID_CLAIM));
        String email = jwt.getSubject();
        if (email == null || email.isBlank()) {
            throw new UnauthorizedException("Token has no subject");
        }

        Principal principal = new Principal(id, email);
        userService.getOrCreateUser(principal);
        return principal;
    }

    private long readId(Object claim) {
        long id;
        if (claim instanceof Number) {
            id = ((Number) claim).longValue();
        } else if (claim instanceof String) {
            try {
                id = Long.parseLong((String) claim);
            } catch (NumberFormatException e) {
                throw new UnauthorizedException("Token id claim is not numeric");
            }
        } else {
            throw new UnauthorizedException("Token has no id claim");
        }
        if (id <= 0) {
            throw new UnauthorizedException("Token id claim is not positive");
        }
        return id;
    }
}
