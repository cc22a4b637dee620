package org.pragmatica.scad.query;

import org.pragmatica.scad.tree.SyntaxNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query results for one syntax tree, keyed by the literal query text.
 *
 * <p>The cache is bound to a single root. {@link #rebind} must be called whenever a new tree is
 * produced; it drops every cached result so nothing leaks from one tree into another.
 * At most {@code capacity} results are kept; the least recently used one is evicted first.
 */
public final class QueryCache {
    public static final int DEFAULT_CAPACITY = 100;

    private final Map<String, List<SyntaxNode>> results;
    private final boolean enabled;
    private final int capacity;
    private SyntaxNode root;
    private int hits;
    private int misses;

    public QueryCache(SyntaxNode root) {
        this(root, true);
    }

    public QueryCache(SyntaxNode root, boolean enabled) {
        this(root, enabled, DEFAULT_CAPACITY);
    }

    public QueryCache(SyntaxNode root, boolean enabled, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Query cache capacity must be positive, got " + capacity);
        }
        this.root = root;
        this.enabled = enabled;
        this.capacity = capacity;
        this.results = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<SyntaxNode>> eldest) {
                return size() > QueryCache.this.capacity;
            }
        };
    }

    public record Stats(int hits, int misses, int size) {}

    public SyntaxNode root() {
        return root;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Nodes captured by the query over the bound root, computed on first use.
     */
    public List<SyntaxNode> nodes(String query) {
        var cached = enabled ? results.get(query) : null;
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        var computed = List.copyOf(Query.compile(query).nodes(root));
        if (enabled) {
            results.put(query, computed);
        }
        return computed;
    }

    public void rebind(SyntaxNode newRoot) {
        this.root = newRoot;
        invalidate();
    }

    public void invalidate() {
        results.clear();
        hits = 0;
        misses = 0;
    }

    public Stats stats() {
        return new Stats(hits, misses, results.size());
    }
}
