package cz.vut.fit.shroudinger.matching;

import cz.vut.fit.shroudinger.models.BlocklistEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A trie of suffix rules keyed on domain labels from the top-level label inward:
 * {@code a.b.com} is stored on the path {@code com -> b -> a}.
 * <p>
 * A lookup returns the deepest terminal node on the path of the queried name, so a rule for
 * {@code ads.example.com} shadows a rule for {@code example.com} for all names under {@code ads.example.com}.
 */
public final class SuffixTrie {
    private static final class Node {
        private Map<String, Node> _children;
        private BlocklistEntry _terminal;

        Node child(String label) {
            return _children == null ? null : _children.get(label);
        }

        Node childOrCreate(String label) {
            if (_children == null)
                _children = new HashMap<>(4);
            return _children.computeIfAbsent(label, unused -> new Node());
        }
    }

    private final Node _root = new Node();
    private int _terminalCount;

    void insert(@NotNull BlocklistEntry entry) {
        var node = _root;
        for (var label : entry.reversedLabels()) {
            node = node.childOrCreate(label);
        }

        if (node._terminal == null)
            _terminalCount++;
        node._terminal = entry;
    }

    /**
     * Walks the labels of a normalised name from the top-level label inward.
     *
     * @param domain the normalised name
     * @return the rule of the deepest terminal ancestor (the name itself included), or null if there is none
     */
    public @Nullable BlocklistEntry findDeepestTerminal(@NotNull String domain) {
        var node = _root;
        BlocklistEntry deepest = null;

        int end = domain.length();
        while (end > 0) {
            int start = domain.lastIndexOf('.', end - 1) + 1;
            node = node.child(domain.substring(start, end));
            if (node == null)
                break;
            if (node._terminal != null)
                deepest = node._terminal;

            end = start - 1;
        }

        return deepest;
    }

    public int size() {
        return _terminalCount;
    }
}
