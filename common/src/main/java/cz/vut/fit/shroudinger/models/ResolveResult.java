package cz.vut.fit.shroudinger.models;

import cz.vut.fit.shroudinger.errors.ErrorKind;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of a resolution.
 *
 * @param blocked  True if the name was blocked; no upstream query was made.
 * @param category The category of the blocking rule.
 * @param response The DNS response in wire format, or null if blocked or failed.
 * @param error    The error kind, or null on success.
 * @param cached   True if the response was served from the anonymous cache.
 */
public record ResolveResult(boolean blocked,
                            @Nullable Category category,
                            byte @Nullable [] response,
                            @Nullable ErrorKind error,
                            boolean cached) {

    public static ResolveResult blocked(Category category) {
        return new ResolveResult(true, category, null, null, false);
    }

    public static ResolveResult resolved(byte[] response, boolean cached) {
        return new ResolveResult(false, null, response, null, cached);
    }

    public static ResolveResult failed(ErrorKind error) {
        return new ResolveResult(false, null, null, error, false);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
