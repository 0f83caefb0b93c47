package cz.vut.fit.shroudinger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import cz.vut.fit.shroudinger.errors.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An externally supplied encrypted upstream resolver definition.
 *
 * @param name     A unique server name, used in logs and statistics.
 * @param address  The IP address or host name to connect to.
 * @param port     The port; {@code 0} selects the default port of the protocol.
 * @param protocol The encrypted transport.
 * @param priority Higher priority servers are tried first.
 * @param hostname The TLS server name to verify; defaults to the address.
 * @param path     The DoH request path; defaults to {@code /dns-query}.
 */
public record ServerConfig(@NotNull String name,
                           @NotNull String address,
                           int port,
                           @NotNull Protocol protocol,
                           int priority,
                           @NotNull String hostname,
                           @NotNull String path) {

    public static final String DEFAULT_DOH_PATH = "/dns-query";

    @JsonCreator
    public static ServerConfig of(@JsonProperty("name") String name,
                                  @JsonProperty("address") String address,
                                  @JsonProperty("port") int port,
                                  @JsonProperty("protocol") Protocol protocol,
                                  @JsonProperty("priority") int priority,
                                  @JsonProperty("hostname") @Nullable String hostname,
                                  @JsonProperty("path") @Nullable String path) {
        return new ServerConfig(name, address, port, protocol, priority, hostname, path);
    }

    public static ServerConfig of(String name, String address, Protocol protocol, int priority) {
        return of(name, address, 0, protocol, priority, null, null);
    }

    public ServerConfig {
        if (name == null || name.isBlank())
            throw new ConfigurationException("A server must have a name");
        if (address == null || address.isBlank())
            throw new ConfigurationException("Server " + name + " has no address");
        if (protocol == null)
            throw new ConfigurationException("Server " + name + " has no protocol");
        if (port < 0 || port > 65535)
            throw new ConfigurationException("Server " + name + " has an invalid port");

        if (port == 0)
            port = protocol.defaultPort();
        if (hostname == null || hostname.isBlank())
            hostname = address;
        if (path == null || path.isBlank())
            path = DEFAULT_DOH_PATH;
    }
}
