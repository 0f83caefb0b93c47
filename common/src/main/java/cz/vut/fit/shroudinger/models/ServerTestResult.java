package cz.vut.fit.shroudinger.models;

import cz.vut.fit.shroudinger.errors.ErrorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of a connectivity test of one upstream server. The queried name is not part of the result.
 *
 * @param server        The server name.
 * @param protocol      The transport used for the test.
 * @param success       True if the server returned a valid answer to the test query.
 * @param latencyMicros The time from opening the connection to receiving the answer, or until the failure.
 * @param error         The error kind, or null on success.
 */
public record ServerTestResult(@NotNull String server,
                               @NotNull Protocol protocol,
                               boolean success,
                               long latencyMicros,
                               @Nullable ErrorKind error) {

    public static ServerTestResult succeeded(ServerConfig server, long latencyMicros) {
        return new ServerTestResult(server.name(), server.protocol(), true, latencyMicros, null);
    }

    public static ServerTestResult failed(ServerConfig server, long latencyMicros, ErrorKind error) {
        return new ServerTestResult(server.name(), server.protocol(), false, latencyMicros, error);
    }
}
