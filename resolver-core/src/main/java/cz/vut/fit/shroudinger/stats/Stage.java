package cz.vut.fit.shroudinger.stats;

/**
 * Processing stages whose latency is tracked.
 */
public enum Stage {
    CHECK("check"),
    CACHE("cache"),
    UPSTREAM("upstream"),
    TOTAL("total");

    private final String _label;

    Stage(String label) {
        _label = label;
    }

    public String label() {
        return _label;
    }
}
