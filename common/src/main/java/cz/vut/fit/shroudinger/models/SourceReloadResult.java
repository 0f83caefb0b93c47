package cz.vut.fit.shroudinger.models;

import cz.vut.fit.shroudinger.errors.ErrorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-source outcome of a reload, relative to the previous successful load of the same source.
 *
 * @param sourceName   The source name.
 * @param added        Domains that the source did not contain before.
 * @param removed      Domains that the source no longer contains.
 * @param updated      Domains whose rule changed (match type, action or category).
 * @param rejected     Lines dropped because of a validation error.
 * @param error        The error kind if the source failed to load, otherwise null.
 * @param errorMessage A domain-free description of the failure.
 */
public record SourceReloadResult(@NotNull String sourceName,
                                 int added,
                                 int removed,
                                 int updated,
                                 int rejected,
                                 @Nullable ErrorKind error,
                                 @Nullable String errorMessage) {

    public static SourceReloadResult failed(String sourceName, ErrorKind error, String message) {
        return new SourceReloadResult(sourceName, 0, 0, 0, 0, error, message);
    }

    public boolean hasChanges() {
        return added != 0 || removed != 0 || updated != 0;
    }
}
