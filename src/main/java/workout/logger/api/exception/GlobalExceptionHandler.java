package workout.logger.api.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import workout.logger.api.dto.ErrorResponse;

import java.time.Clock;
import java.time.Instant;

/**
 * Maps the error taxonomy onto HTTP responses.
 * Denials and backend failures never carry detail to the client; backend detail goes to the log.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    static final String OPERATION_FAILED = "Operation Failed";
    static final String REQUEST_CANCELLED = "Request Cancelled";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(InvalidArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(ResourceAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(ResourceAccessDeniedException e) {
        return build(HttpStatus.FORBIDDEN, e.getKind().name(), ResourceAccessDeniedException.MESSAGE);
    }

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<ErrorResponse> handleBackend(BackendException e) {
        log.error("Backend failure: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getKind().name(), OPERATION_FAILED);
    }

    // Storage failures that escape a service without being wrapped
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Data access failure: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.BACKEND_ERROR.name(), OPERATION_FAILED);
    }

    @ExceptionHandler(LoadCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(LoadCancelledException e) {
        log.debug("Request cancelled: {}", e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, e.getKind().name(), REQUEST_CANCELLED);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        log.debug("Unauthorized request: {}", e.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Unauthorized");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT.name(), "Malformed request body");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .errorCode(errorCode)
                .message(message)
                .timestamp(Instant.now(clock))
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
