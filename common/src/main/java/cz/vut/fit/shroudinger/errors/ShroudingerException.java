package cz.vut.fit.shroudinger.errors;

import org.jetbrains.annotations.NotNull;

/**
 * The base of the checked exceptions raised by the resolver core. Messages are fixed strings and never
 * contain a domain name or any other query content.
 */
public class ShroudingerException extends Exception {
    private final ErrorKind _kind;

    public ShroudingerException(@NotNull ErrorKind kind, @NotNull String message) {
        super(message);
        _kind = kind;
    }

    public ShroudingerException(@NotNull ErrorKind kind, @NotNull String message, Throwable cause) {
        super(message, cause);
        _kind = kind;
    }

    protected ShroudingerException(@NotNull ErrorKind kind, @NotNull String message, Throwable cause,
                                   boolean writableStackTrace) {
        super(message, cause, false, writableStackTrace);
        _kind = kind;
    }

    public @NotNull ErrorKind getKind() {
        return _kind;
    }
}
