package workout.logger.api.exception;

public class BackendException extends ApiException {
    public BackendException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_ERROR, message, cause);
    }
}
