package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Retries a failed fetch with an exponential backoff: the n-th retry waits {@code backoff * 2^(n-1)}.
 */
public class RetryingSourceFetcher implements SourceFetcher {
    public static final String COMPONENT_NAME = "source-fetcher";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RetryingSourceFetcher.class);

    private final SourceFetcher _delegate;
    private final int _attempts;
    private final Duration _backoff;

    public RetryingSourceFetcher(@NotNull SourceFetcher delegate, int attempts, @NotNull Duration backoff) {
        _delegate = delegate;
        _attempts = Math.max(1, attempts);
        _backoff = backoff;
    }

    @Override
    public @NotNull String fetch(@NotNull SourceConfig source) throws SourceFetchException {
        SourceFetchException last = null;
        for (int attempt = 1; attempt <= _attempts; attempt++) {
            try {
                return _delegate.fetch(source);
            } catch (SourceFetchException e) {
                last = e;
                if (attempt == _attempts)
                    break;

                var wait = _backoff.multipliedBy(1L << (attempt - 1));
                Logger.warn("Fetching source {} failed (attempt {}/{}): {}; retrying in {} ms",
                        source.name(), attempt, _attempts, e.getMessage(), wait.toMillis());
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SourceFetchException("Fetch interrupted", ie);
                }
            }
        }
        throw last;
    }
}
