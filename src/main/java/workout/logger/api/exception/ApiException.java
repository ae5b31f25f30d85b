package workout.logger.api.exception;

/**
 * Base type for the failures the access control service and the batch loaders report.
 * All of them are ordinary results for the caller; none should bring the process down.
 */
public abstract class ApiException extends RuntimeException {
    private final ErrorKind kind;

    protected ApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
