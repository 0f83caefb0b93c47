package cz.vut.fit.shroudinger.stats;

import cz.vut.fit.shroudinger.models.CircuitState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single anonymous statistics event. The type carries no free-form text, so an event cannot hold a domain name.
 *
 * @param type          The event type.
 * @param stage         The stage, for {@link EventType#STAGE_LATENCY} events.
 * @param state         The target state, for {@link EventType#CIRCUIT_TRANSITION} events.
 * @param durationNanos The stage duration, for {@link EventType#STAGE_LATENCY} events.
 */
public record StatsEvent(@NotNull EventType type,
                         @Nullable Stage stage,
                         @Nullable CircuitState state,
                         long durationNanos) {

    public static StatsEvent of(@NotNull EventType type) {
        return new StatsEvent(type, null, null, 0);
    }

    public static StatsEvent latency(@NotNull Stage stage, long durationNanos) {
        return new StatsEvent(EventType.STAGE_LATENCY, stage, null, durationNanos);
    }

    public static StatsEvent transition(@NotNull CircuitState state) {
        return new StatsEvent(EventType.CIRCUIT_TRANSITION, null, state, 0);
    }
}
