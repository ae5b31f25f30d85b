package workout.logger.api.security;

import lombok.Value;

/**
 * The authenticated caller. Only {@code id} takes part in ownership checks.
 */
@Value
public class Principal {
    long id;
    String email;
}
