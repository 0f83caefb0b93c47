package cz.vut.fit.shroudinger.stats;

import cz.vut.fit.shroudinger.models.Category;
import cz.vut.fit.shroudinger.models.CircuitState;
import cz.vut.fit.shroudinger.models.ServerHealthView;
import cz.vut.fit.shroudinger.models.StatsSnapshot;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Collects anonymous aggregate counters from all components.
 * <p>
 * Recording never blocks: every counter is a {@link LongAdder}. The snapshot-derived maps are replaced
 * as a whole when a new blocklist snapshot is published.
 */
public class StatsAggregator {
    private final EnumMap<EventType, LongAdder> _counters = new EnumMap<>(EventType.class);
    private final EnumMap<Stage, LongAdder> _stageTotals = new EnumMap<>(Stage.class);
    private final EnumMap<Stage, LongAdder> _stageCounts = new EnumMap<>(Stage.class);
    private final EnumMap<CircuitState, LongAdder> _transitions = new EnumMap<>(CircuitState.class);
    private final Clock _clock;

    private volatile Map<String, Integer> _perSourceCounts = Map.of();
    private volatile Map<Category, Integer> _categoryCounts = Map.of();
    private volatile Supplier<List<ServerHealthView>> _healthSupplier = List::of;

    public StatsAggregator() {
        this(Clock.systemUTC());
    }

    public StatsAggregator(Clock clock) {
        _clock = clock;
        for (var type : EventType.values())
            _counters.put(type, new LongAdder());
        for (var stage : Stage.values()) {
            _stageTotals.put(stage, new LongAdder());
            _stageCounts.put(stage, new LongAdder());
        }
        for (var state : CircuitState.values())
            _transitions.put(state, new LongAdder());
    }

    public void record(@NotNull StatsEvent event) {
        switch (event.type()) {
            case STAGE_LATENCY -> {
                if (event.stage() == null)
                    return;
                _stageTotals.get(event.stage()).add(Math.max(0, event.durationNanos()));
                _stageCounts.get(event.stage()).increment();
            }
            case CIRCUIT_TRANSITION -> {
                if (event.state() != null)
                    _transitions.get(event.state()).increment();
            }
            default -> _counters.get(event.type()).increment();
        }
    }

    public void record(@NotNull EventType type) {
        record(StatsEvent.of(type));
    }

    public void recordLatency(@NotNull Stage stage, long durationNanos) {
        record(StatsEvent.latency(stage, durationNanos));
    }

    /**
     * Replaces the per-source and per-category entry counts. Called when a snapshot is published.
     */
    public void updateSnapshotCounts(@NotNull Map<String, Integer> perSourceCounts,
                                     @NotNull Map<Category, Integer> categoryCounts) {
        _perSourceCounts = Collections.unmodifiableMap(new TreeMap<>(perSourceCounts));
        var categories = new EnumMap<Category, Integer>(Category.class);
        categories.putAll(categoryCounts);
        _categoryCounts = Collections.unmodifiableMap(categories);
    }

    public void setHealthSupplier(@NotNull Supplier<List<ServerHealthView>> healthSupplier) {
        _healthSupplier = healthSupplier;
    }

    public long count(@NotNull EventType type) {
        return _counters.get(type).sum();
    }

    public long transitions(@NotNull CircuitState state) {
        return _transitions.get(state).sum();
    }

    public long meanLatencyMicros(@NotNull Stage stage) {
        var count = _stageCounts.get(stage).sum();
        if (count == 0)
            return 0;
        return _stageTotals.get(stage).sum() / count / 1000;
    }

    public StatsSnapshot snapshot() {
        var stageLatency = new LinkedHashMap<String, Long>();
        for (var stage : Stage.values())
            stageLatency.put(stage.label(), meanLatencyMicros(stage));

        var transitions = new EnumMap<CircuitState, Long>(CircuitState.class);
        for (var entry : _transitions.entrySet())
            transitions.put(entry.getKey(), entry.getValue().sum());

        return new StatsSnapshot(
                count(EventType.LOOKUP),
                count(EventType.BLOCKED),
                count(EventType.CACHE_HIT),
                count(EventType.CACHE_MISS),
                meanLatencyMicros(Stage.TOTAL),
                Collections.unmodifiableMap(stageLatency),
                count(EventType.RESOLUTION_FAILURE),
                count(EventType.RESOLUTION_TIMEOUT),
                _perSourceCounts,
                _categoryCounts,
                Collections.unmodifiableMap(transitions),
                List.copyOf(_healthSupplier.get()),
                _clock.instant());
    }
}
