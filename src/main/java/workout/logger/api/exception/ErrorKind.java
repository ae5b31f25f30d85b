package workout.logger.api.exception;

public enum ErrorKind {
    INVALID_ARGUMENT,
    ACCESS_DENIED,
    BACKEND_ERROR,
    CANCELLED
}
