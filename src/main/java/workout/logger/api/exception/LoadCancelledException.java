package workout.logger.api.exception;

public class LoadCancelledException extends ApiException {
    public LoadCancelledException(String loaderName) {
        super(ErrorKind.CANCELLED, "Load cancelled for loader " + loaderName);
    }
}
