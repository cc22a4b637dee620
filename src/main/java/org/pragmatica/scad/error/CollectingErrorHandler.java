package org.pragmatica.scad.error;

import org.pragmatica.scad.error.ParseError.Severity;
import org.pragmatica.scad.tree.SourceLocation;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default error handler: forwards everything to SLF4J and keeps errors and warnings as {@link ParseError}s.
 */
public final class CollectingErrorHandler implements ErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(CollectingErrorHandler.class);

    private final List<ParseError> diagnostics = new ArrayList<>();
    private final Severity minLogSeverity;

    public CollectingErrorHandler() {
        this(Severity.HINT);
    }

    /**
     * @param minLogSeverity least severe level still forwarded to the logger; collection is unaffected
     */
    public CollectingErrorHandler(Severity minLogSeverity) {
        this.minLogSeverity = minLogSeverity;
    }

    @Override
    public void logError(String message, SyntaxNode node) {
        diagnostics.add(ParseError.error(message, spanOf(node)));
        if (enabled(Severity.ERROR)) {
            log.error("{} [{}]", message, describe(node));
        }
    }

    @Override
    public void logWarning(String message, SyntaxNode node) {
        diagnostics.add(ParseError.warning(message, spanOf(node)));
        if (enabled(Severity.WARNING)) {
            log.warn("{} [{}]", message, describe(node));
        }
    }

    @Override
    public void logInfo(String message) {
        if (enabled(Severity.INFO)) {
            log.info(message);
        }
    }

    @Override
    public void logDebug(String message) {
        if (enabled(Severity.HINT)) {
            log.debug(message);
        }
    }

    @Override
    public List<ParseError> diagnostics() {
        return List.copyOf(diagnostics);
    }

    @Override
    public void clear() {
        diagnostics.clear();
    }

    private boolean enabled(Severity severity) {
        return severity.ordinal() <= minLogSeverity.ordinal();
    }

    private static SourceSpan spanOf(SyntaxNode node) {
        var span = SourceSpan.of(node);
        return span == null ? SourceSpan.at(SourceLocation.START) : span;
    }

    private static String describe(SyntaxNode node) {
        return node == null ? "no node" : node.type() + " at " + node.startPosition();
    }
}
