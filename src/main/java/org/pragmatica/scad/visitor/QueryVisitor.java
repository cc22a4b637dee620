package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.query.Query;
import org.pragmatica.scad.query.QueryCache;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds CST nodes with structural queries instead of walking the whole tree.
 *
 * <p>Results are cached per query text in a {@link QueryCache} tied to the current tree. AST nodes for
 * matches are always built by the held {@link CompositeVisitor}.
 */
public final class QueryVisitor {
    private final QueryCache cache;
    private final CompositeVisitor visitor;
    private final ErrorHandler errorHandler;

    public QueryVisitor(SyntaxNode root, CompositeVisitor visitor, ErrorHandler errorHandler) {
        this(new QueryCache(root), visitor, errorHandler);
    }

    public QueryVisitor(QueryCache cache, CompositeVisitor visitor, ErrorHandler errorHandler) {
        this.cache = cache;
        this.visitor = visitor;
        this.errorHandler = errorHandler;
    }

    public List<SyntaxNode> findNodesByType(String type) {
        return executeQuery("(" + type + ") @node");
    }

    /**
     * Nodes of any of the given types, in document order.
     */
    public List<SyntaxNode> findNodesByTypes(List<String> types) {
        var result = new ArrayList<SyntaxNode>();
        for (var type : types) {
            for (var node : findNodesByType(type)) {
                if (result.stream().noneMatch(existing -> existing == node)) {
                    result.add(node);
                }
            }
        }
        result.sort(Comparator.comparingInt(SyntaxNode::startIndex));
        return result;
    }

    public List<SyntaxNode> executeQuery(String query) {
        errorHandler.logDebug("Executing query: " + query);
        return cache.nodes(query);
    }

    /**
     * Run a query under a single node. Not cached.
     */
    public List<SyntaxNode> executeQueryOnNode(SyntaxNode node, String query) {
        return Query.compile(query).nodes(node);
    }

    public AstNode visitNode(SyntaxNode node) {
        return visitor.visitNode(node);
    }

    /**
     * AST for each node, skipping nodes the composite does not handle.
     */
    public List<AstNode> buildAst(List<SyntaxNode> nodes) {
        return nodes.stream()
                    .map(visitor::visitNode)
                    .filter(Objects::nonNull)
                    .toList();
    }

    public List<AstNode> findAstByType(String type) {
        return buildAst(findNodesByType(type));
    }

    public void rebind(SyntaxNode newRoot) {
        cache.rebind(newRoot);
    }

    public void clearQueryCache() {
        cache.invalidate();
    }

    public QueryCache.Stats cacheStats() {
        return cache.stats();
    }

    public CompositeVisitor visitor() {
        return visitor;
    }
}
