package cz.vut.fit.shroudinger.errors;

/**
 * Malformed input. Thrown on the hot path, so the stack trace is not captured.
 */
public class ValidationException extends ShroudingerException {
    public ValidationException(String reason) {
        super(ErrorKind.VALIDATION, reason, null, false);
    }
}
