package cz.vut.fit.shroudinger.pool;

import com.google.common.net.HostAndPort;
import cz.vut.fit.shroudinger.models.ServerConfig;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends DNS-over-HTTPS queries (RFC 8484) as {@code POST} requests with an {@code application/dns-message} body.
 * <p>
 * The underlying HTTP/2 connections are multiplexed and kept alive by the shared {@link HttpClient}; a connection
 * handed out by this connector is a handle bound to one server endpoint.
 */
public class DoHConnector implements UpstreamConnector {
    static final String DNS_MESSAGE = "application/dns-message";

    private final HttpClient _client;

    public DoHConnector(@NotNull Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(connectTimeout)
                .build());
    }

    public DoHConnector(@NotNull HttpClient client) {
        _client = client;
    }

    static URI endpointOf(ServerConfig server) {
        var authority = server.port() == 443
                ? HostAndPort.fromHost(server.hostname())
                : HostAndPort.fromParts(server.hostname(), server.port());
        return URI.create("https://" + authority + server.path());
    }

    @Override
    public @NotNull UpstreamConnection open(@NotNull ServerConfig server, @NotNull Duration connectTimeout)
            throws IOException {
        try {
            return new DoHConnection(_client, endpointOf(server));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid DoH endpoint", e);
        }
    }

    static final class DoHConnection implements UpstreamConnection {
        private final HttpClient _client;
        private final URI _endpoint;
        private final AtomicReference<CompletableFuture<HttpResponse<byte[]>>> _pending = new AtomicReference<>();
        private volatile boolean _closed;

        DoHConnection(HttpClient client, URI endpoint) {
            _client = client;
            _endpoint = endpoint;
        }

        @Override
        public byte @NotNull [] exchange(byte @NotNull [] query, @NotNull Duration timeout) throws IOException {
            if (_closed)
                throw new IOException("Connection closed");

            var request = HttpRequest.newBuilder(_endpoint)
                    .timeout(timeout)
                    .header("Content-Type", DNS_MESSAGE)
                    .header("Accept", DNS_MESSAGE)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(query))
                    .build();

            var future = _client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
            _pending.set(future);
            if (_closed)
                future.cancel(true);
            try {
                var response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                if (response.statusCode() != 200)
                    throw new IOException("Unexpected HTTP status " + response.statusCode());
                return response.body();
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new HttpTimeoutException("DoH request timed out");
            } catch (CancellationException e) {
                throw new IOException("DoH request aborted", e);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new IOException("DoH request interrupted", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof IOException io)
                    throw io;
                throw new IOException("DoH request failed", e.getCause());
            } finally {
                _pending.compareAndSet(future, null);
            }
        }

        @Override
        public boolean isOpen() {
            return !_closed;
        }

        @Override
        public void abort() {
            close();
        }

        @Override
        public void close() {
            _closed = true;
            var pending = _pending.getAndSet(null);
            if (pending != null)
                pending.cancel(true);
        }
    }
}
