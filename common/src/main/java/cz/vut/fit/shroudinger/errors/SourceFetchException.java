package cz.vut.fit.shroudinger.errors;

public class SourceFetchException extends ShroudingerException {
    public SourceFetchException(String message) {
        super(ErrorKind.SOURCE_FETCH, message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_FETCH, message, cause);
    }
}
