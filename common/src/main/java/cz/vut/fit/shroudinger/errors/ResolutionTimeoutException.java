package cz.vut.fit.shroudinger.errors;

public class ResolutionTimeoutException extends ShroudingerException {
    public ResolutionTimeoutException(String message) {
        super(ErrorKind.RESOLUTION_TIMEOUT, message, null, false);
    }
}
