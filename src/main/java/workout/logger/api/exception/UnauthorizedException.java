package workout.logger.api.exception;

/**
 * The request carried no usable principal. Raised by principal resolution, outside the ownership checks.
 */
public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String message) {
        super(message);
    }
}
