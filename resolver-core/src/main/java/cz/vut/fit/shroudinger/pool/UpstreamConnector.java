package cz.vut.fit.shroudinger.pool;

import cz.vut.fit.shroudinger.models.ServerConfig;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens connections of one transport protocol.
 */
public interface UpstreamConnector {
    @NotNull UpstreamConnection open(@NotNull ServerConfig server, @NotNull Duration connectTimeout)
            throws IOException;
}
