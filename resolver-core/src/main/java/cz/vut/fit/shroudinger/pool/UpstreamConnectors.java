package cz.vut.fit.shroudinger.pool;

import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.models.Protocol;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * The connectors of the supported transports. DNS-over-QUIC has no connector.
 */
public final class UpstreamConnectors {
    private UpstreamConnectors() {
    }

    public static Map<Protocol, UpstreamConnector> defaults(@NotNull Properties properties) {
        var connectTimeout = Common.getMillis(properties, ResolverConfig.CONNECT_TIMEOUT_MS_CONFIG,
                ResolverConfig.CONNECT_TIMEOUT_MS_DEFAULT);

        var connectors = new EnumMap<Protocol, UpstreamConnector>(Protocol.class);
        connectors.put(Protocol.DOT, new DoTConnector());
        connectors.put(Protocol.DOH, new DoHConnector(connectTimeout));
        return connectors;
    }
}
