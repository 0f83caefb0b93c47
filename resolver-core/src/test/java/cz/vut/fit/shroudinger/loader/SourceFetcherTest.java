package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.errors.ErrorKind;
import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.models.Category;
import cz.vut.fit.shroudinger.models.SourceConfig;
import cz.vut.fit.shroudinger.models.SourceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class SourceFetcherTest {

    private static SourceConfig sourceAt(String origin) {
        return new SourceConfig("list", origin, SourceFormat.PLAIN_DOMAINS, Category.ADS, 1, true);
    }

    @Test
    void testFileFetcherReadsPathAndUri(@TempDir Path directory) throws Exception {
        var file = directory.resolve("list.txt");
        Files.writeString(file, "ads.example.com\n");
        var fetcher = new FileSourceFetcher();

        assertEquals("ads.example.com\n", fetcher.fetch(sourceAt(file.toString())));
        assertEquals("ads.example.com\n", fetcher.fetch(sourceAt(file.toUri().toString())));
    }

    @Test
    void testFileFetcherMissingFile(@TempDir Path directory) {
        var fetcher = new FileSourceFetcher();
        var e = assertThrows(SourceFetchException.class,
                () -> fetcher.fetch(sourceAt(directory.resolve("missing.txt").toString())));
        assertEquals(ErrorKind.SOURCE_FETCH, e.getKind());
    }

    @Test
    void testFileFetcherRejectsMalformedOrigin() {
        var fetcher = new FileSourceFetcher();
        // Opaque file URI, Path.of refuses it
        var e = assertThrows(SourceFetchException.class, () -> fetcher.fetch(sourceAt("file:lists/x.txt")));
        assertEquals(ErrorKind.SOURCE_FETCH, e.getKind());
        assertEquals("Invalid source path", e.getMessage());
    }

    @Test
    void testHttpFetcherReturnsBody() throws Exception {
        HttpClient client = mock(HttpClient.class);
        HttpResponse<Object> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("0.0.0.0 ads.example.com\n");
        when(client.send(any(HttpRequest.class), any())).thenReturn(response);

        var fetcher = new HttpSourceFetcher(client, Duration.ofSeconds(5));
        assertEquals("0.0.0.0 ads.example.com\n", fetcher.fetch(sourceAt("https://lists.example.org/hosts")));
    }

    @Test
    void testHttpFetcherRejectsErrorStatus() throws Exception {
        HttpClient client = mock(HttpClient.class);
        HttpResponse<Object> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(404);
        when(client.send(any(HttpRequest.class), any())).thenReturn(response);

        var fetcher = new HttpSourceFetcher(client, Duration.ofSeconds(5));
        var e = assertThrows(SourceFetchException.class,
                () -> fetcher.fetch(sourceAt("https://lists.example.org/hosts")));
        assertEquals("Unexpected HTTP status 404", e.getMessage());
    }

    @Test
    void testHttpFetcherWrapsIOException() throws Exception {
        HttpClient client = mock(HttpClient.class);
        when(client.send(any(HttpRequest.class), any())).thenThrow(new IOException("reset"));

        var fetcher = new HttpSourceFetcher(client, Duration.ofSeconds(5));
        var e = assertThrows(SourceFetchException.class,
                () -> fetcher.fetch(sourceAt("https://lists.example.org/hosts")));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testDefaultFetcherDispatchesOnScheme() throws Exception {
        var http = mock(SourceFetcher.class);
        var file = mock(SourceFetcher.class);
        var fetcher = new DefaultSourceFetcher(http, file);

        var remote = sourceAt("HTTPS://lists.example.org/hosts");
        var local = sourceAt("/etc/shroudinger/custom.txt");
        when(http.fetch(remote)).thenReturn("remote");
        when(file.fetch(local)).thenReturn("local");

        assertEquals("remote", fetcher.fetch(remote));
        assertEquals("local", fetcher.fetch(local));
    }

    @Test
    void testRetriesWithBackoffThenSucceeds() throws Exception {
        var delegate = mock(SourceFetcher.class);
        var source = sourceAt("https://lists.example.org/hosts");
        when(delegate.fetch(source))
                .thenThrow(new SourceFetchException("Unexpected HTTP status 503"))
                .thenThrow(new SourceFetchException("Unexpected HTTP status 503"))
                .thenReturn("ok");

        var fetcher = new RetryingSourceFetcher(delegate, 3, Duration.ofMillis(1));
        assertEquals("ok", fetcher.fetch(source));
        verify(delegate, times(3)).fetch(source);
    }

    @Test
    void testGivesUpAfterLastAttempt() throws Exception {
        var delegate = mock(SourceFetcher.class);
        var source = sourceAt("https://lists.example.org/hosts");
        var failure = new SourceFetchException("Unexpected HTTP status 500");
        when(delegate.fetch(source)).thenThrow(failure);

        var fetcher = new RetryingSourceFetcher(delegate, 2, Duration.ofMillis(1));
        assertSame(failure, assertThrows(SourceFetchException.class, () -> fetcher.fetch(source)));
        verify(delegate, times(2)).fetch(source);
    }
}
