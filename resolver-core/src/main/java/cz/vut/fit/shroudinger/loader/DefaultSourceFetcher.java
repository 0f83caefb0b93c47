package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Dispatches to the HTTP or the file fetcher based on the scheme of the source origin.
 */
public class DefaultSourceFetcher implements SourceFetcher {
    private final SourceFetcher _http;
    private final SourceFetcher _file;

    public DefaultSourceFetcher(@NotNull SourceFetcher http, @NotNull SourceFetcher file) {
        _http = http;
        _file = file;
    }

    @Override
    public @NotNull String fetch(@NotNull SourceConfig source) throws SourceFetchException {
        var origin = source.origin().toLowerCase(Locale.ROOT);
        if (origin.startsWith("http://") || origin.startsWith("https://"))
            return _http.fetch(source);
        return _file.fetch(source);
    }
}
