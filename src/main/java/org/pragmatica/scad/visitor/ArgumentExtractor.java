package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.scad.tree.NodeTypes.ARGUMENT;
import static org.pragmatica.scad.tree.NodeTypes.ARGUMENTS;

/**
 * Turns an {@code argument_list} into call {@link Parameter}s in source order.
 */
public final class ArgumentExtractor {
    private ArgumentExtractor() {}

    public static List<Parameter> extract(SyntaxNode argumentList, ExpressionVisitor expressions,
                                          ErrorHandler errorHandler) {
        var result = new ArrayList<Parameter>();
        if (argumentList == null || argumentList.isMissing()) {
            return result;
        }
        var container = FieldReader.firstOfType(argumentList, ARGUMENTS);
        for (var argument : FieldReader.childrenOfType(container == null ? argumentList : container, ARGUMENT)) {
            result.add(extractArgument(argument, expressions, errorHandler));
        }
        return result;
    }

    private static Parameter extractArgument(SyntaxNode argument, ExpressionVisitor expressions,
                                             ErrorHandler errorHandler) {
        var nameNode = FieldReader.field(argument, "name");
        var valueNode = FieldReader.fieldOrPositional(argument, "value", nameNode == null ? 0 : 1);
        var name = nameNode == null || nameNode.isMissing()
                   ? Optional.<String>empty()
                   : Optional.of(nameNode.text());
        return new Parameter(name, value(argument, valueNode, expressions, errorHandler));
    }

    private static Expression value(SyntaxNode argument, SyntaxNode valueNode, ExpressionVisitor expressions,
                                    ErrorHandler errorHandler) {
        if (valueNode == null || valueNode.isMissing()) {
            errorHandler.logError("Argument has no value: " + argument.text(), argument);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Argument has no value", argument);
        }
        var value = expressions.visitExpression(valueNode);
        if (value == null) {
            errorHandler.logError("Cannot convert argument value '" + valueNode.text() + "'", valueNode);
            return ErrorNode.of(ErrorCode.UNPARSABLE_EXPRESSION,
                                "Unsupported argument value of type " + valueNode.type(), valueNode);
        }
        return value;
    }
}
