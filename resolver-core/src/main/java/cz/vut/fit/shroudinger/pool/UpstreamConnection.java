package cz.vut.fit.shroudinger.pool;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * An open channel to an upstream encrypted DNS server.
 */
public interface UpstreamConnection extends Closeable {
    /**
     * Sends a query in wire format and waits for the response.
     *
     * @param query   The query message.
     * @param timeout How long to wait for the response.
     * @return The response message in wire format.
     * @throws IOException if the exchange failed or timed out.
     */
    byte @NotNull [] exchange(byte @NotNull [] query, @NotNull Duration timeout) throws IOException;

    boolean isOpen();

    /**
     * Closes the connection from another thread, interrupting a running exchange. Never throws.
     */
    void abort();

    @Override
    void close();
}
