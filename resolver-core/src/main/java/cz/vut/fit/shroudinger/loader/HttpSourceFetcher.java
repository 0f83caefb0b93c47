package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads {@code http://} and {@code https://} sources.
 */
public class HttpSourceFetcher implements SourceFetcher {
    private final HttpClient _client;
    private final Duration _timeout;

    public HttpSourceFetcher(@NotNull Duration timeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build(), timeout);
    }

    public HttpSourceFetcher(@NotNull HttpClient client, @NotNull Duration timeout) {
        _client = client;
        _timeout = timeout;
    }

    @Override
    public @NotNull String fetch(@NotNull SourceConfig source) throws SourceFetchException {
        final URI uri;
        try {
            uri = URI.create(source.origin());
        } catch (IllegalArgumentException e) {
            throw new SourceFetchException("Invalid source URL", e);
        }

        var request = HttpRequest.newBuilder(uri)
                .timeout(_timeout)
                .header("Accept", "text/plain, */*")
                .GET()
                .build();

        try {
            var response = _client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200)
                throw new SourceFetchException("Unexpected HTTP status " + response.statusCode());
            return response.body();
        } catch (IOException e) {
            throw new SourceFetchException("Download failed: " + e.getClass().getSimpleName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Download interrupted", e);
        }
    }
}
