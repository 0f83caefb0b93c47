package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

/**
 * Retrieves the raw content of a blocklist source.
 */
public interface SourceFetcher {
    @NotNull String fetch(@NotNull SourceConfig source) throws SourceFetchException;
}
