package cz.vut.fit.shroudinger.errors;

/**
 * Terminal resolution error: every eligible upstream server has been tried, or none was eligible.
 */
public class ResolutionFailureException extends ShroudingerException {
    public ResolutionFailureException(String message) {
        super(ErrorKind.RESOLUTION_FAILURE, message, null, false);
    }

    public ResolutionFailureException(String message, Throwable lastCause) {
        super(ErrorKind.RESOLUTION_FAILURE, message, lastCause, false);
    }
}
