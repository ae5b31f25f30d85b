package workout.logger.api.exception;

/**
 * Raised when an ownership chain does not resolve to the caller.
 * The message is the same whether the resource is missing, deleted or owned by someone else.
 */
public class ResourceAccessDeniedException extends ApiException {
    public static final String MESSAGE = "Access Denied";

    public ResourceAccessDeniedException() {
        super(ErrorKind.ACCESS_DENIED, MESSAGE);
    }
}
