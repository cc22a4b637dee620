package org.pragmatica.scad.ast;

import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.Optional;

/**
 * Recoverable construction failure. Usable wherever an expression is expected.
 *
 * @param errorCode        stable code
 * @param message          human readable description
 * @param originalNodeType type of the CST node that could not be converted
 * @param cstNodeText      text of that node
 * @param span             where the failure was detected
 * @param cause            underlying failure, if this one wraps another
 */
public record ErrorNode(ErrorCode errorCode,
                        String message,
                        String originalNodeType,
                        String cstNodeText,
                        SourceSpan span,
                        Optional<ErrorNode> cause) implements Expression {

    public static ErrorNode of(ErrorCode errorCode, String message, SyntaxNode node) {
        return new ErrorNode(errorCode, message, node.type(), node.text(), SourceSpan.of(node), Optional.empty());
    }

    public static ErrorNode of(ErrorCode errorCode, String message, SyntaxNode node, ErrorNode cause) {
        return new ErrorNode(errorCode, message, node.type(), node.text(), SourceSpan.of(node), Optional.of(cause));
    }

    @Override
    public String type() {
        return "error";
    }

    @Override
    public String expressionType() {
        return "error";
    }
}
