package org.pragmatica.scad.error;

import org.pragmatica.scad.tree.SyntaxNode;

import java.util.List;

/**
 * Diagnostic sink injected into every visitor. Reporting never interrupts traversal.
 */
public interface ErrorHandler {

    void logError(String message, SyntaxNode node);

    void logWarning(String message, SyntaxNode node);

    void logInfo(String message);

    void logDebug(String message);

    /**
     * Errors and warnings reported so far, in reporting order.
     */
    List<ParseError> diagnostics();

    default boolean hasDiagnostics() {
        return !diagnostics().isEmpty();
    }

    default long errorCount() {
        return diagnostics().stream()
                            .filter(ParseError::isError)
                            .count();
    }

    void clear();
}
