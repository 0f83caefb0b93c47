package cz.vut.fit.shroudinger.models;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Service status for health endpoints.
 *
 * @param ready          True once the first snapshot has been published.
 * @param totalEntries   The number of entries in the current snapshot.
 * @param activeSources  The number of enabled sources in the last reload.
 * @param lastReload     When the current snapshot was built, or null.
 * @param uptime         Time since the core was started.
 * @param healthyServers Servers whose circuit is not open.
 * @param totalServers   All configured servers.
 * @param cachedEntries  Responses currently held by the cache.
 */
public record CoreStatus(boolean ready,
                         long totalEntries,
                         int activeSources,
                         @Nullable Instant lastReload,
                         Duration uptime,
                         int healthyServers,
                         int totalServers,
                         int cachedEntries) {
}
