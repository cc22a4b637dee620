package org.pragmatica.scad.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.scad.tree.CstNode;
import org.pragmatica.scad.tree.NodeTypes;
import org.pragmatica.scad.tree.SourceLocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CollectingErrorHandlerTest {

    @Test
    void logErrorAndWarning_areCollectedInOrder() {
        var handler = new CollectingErrorHandler();

        handler.logWarning("first", CstNode.leaf(NodeTypes.IDENTIFIER, "a"));
        handler.logError("second", null);
        handler.logInfo("not collected");
        handler.logDebug("not collected either");

        assertThat(handler.diagnostics()).extracting(ParseError::message).containsExactly("first", "second");
        assertEquals(1, handler.errorCount());
        assertTrue(handler.hasDiagnostics());
    }

    @Test
    void logError_withoutNode_usesStartOfSource() {
        var handler = new CollectingErrorHandler(ParseError.Severity.ERROR);

        handler.logError("detached", null);

        assertEquals(SourceLocation.START, handler.diagnostics().get(0).span().start());
    }

    @Test
    void clear_dropsDiagnostics() {
        var handler = new CollectingErrorHandler();
        handler.logError("gone", null);

        handler.clear();

        assertFalse(handler.hasDiagnostics());
    }

    @Test
    void diagnostics_returnsSnapshot() {
        var handler = new CollectingErrorHandler();
        var before = handler.diagnostics();

        handler.logError("later", null);

        assertTrue(before.isEmpty());
    }
}
