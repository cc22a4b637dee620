package org.pragmatica.scad.ast;

import org.pragmatica.scad.tree.SourceSpan;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expression nodes. All share the {@code "expression"} tag and are told apart by {@link #expressionType()}.
 */
public sealed interface Expression extends AstNode
permits Expression.Literal, Expression.Identifier, Expression.Binary, Expression.Unary, Expression.Ternary,
        Expression.RangeExpression, Expression.FunctionCall, Expression.Vector, Expression.Index,
        Expression.Member, Expression.LetExpression, Expression.ListComprehension, Expression.FunctionLiteral,
        Expression.EchoExpression, Expression.AssertExpression, Expression.Each, ErrorNode {

    @Override
    default String type() {
        return "expression";
    }

    String expressionType();

    static Map<String, Expression> orderedCopy(Map<String, Expression> assignments) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    record Literal(Kind kind, Object value, SourceSpan span) implements Expression {
        public enum Kind {
            NUMBER,
            STRING,
            BOOLEAN,
            UNDEF
        }

        public static Literal number(double value, SourceSpan span) {
            return new Literal(Kind.NUMBER, value, span);
        }

        public static Literal string(String value, SourceSpan span) {
            return new Literal(Kind.STRING, value, span);
        }

        public static Literal bool(boolean value, SourceSpan span) {
            return new Literal(Kind.BOOLEAN, value, span);
        }

        public static Literal undef(SourceSpan span) {
            return new Literal(Kind.UNDEF, null, span);
        }

        @Override
        public String expressionType() {
            return "literal";
        }
    }

    /**
     * Variable reference. Special variables keep their {@code $} prefix.
     */
    record Identifier(String name, SourceSpan span) implements Expression {
        @Override
        public String expressionType() {
            return "identifier";
        }
    }

    enum BinaryOperator {
        OR("||"),
        AND("&&"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        POWER("^");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<BinaryOperator> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(symbol))
                         .findFirst();
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right, SourceSpan span) implements Expression {
        @Override
        public String expressionType() {
            return "binary";
        }
    }

    enum UnaryOperator {
        NOT("!"),
        NEGATE("-"),
        PLUS("+");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<UnaryOperator> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(op -> op.symbol.equals(symbol))
                         .findFirst();
        }
    }

    record Unary(UnaryOperator operator, Expression operand, SourceSpan span) implements Expression {
        @Override
        public String expressionType() {
            return "unary";
        }
    }

    record Ternary(Expression condition, Expression thenBranch, Expression elseBranch, SourceSpan span)
    implements Expression {
        @Override
        public String expressionType() {
            return "ternary";
        }
    }

    /**
     * {@code [start:end]} or {@code [start:step:end]}.
     */
    record RangeExpression(Expression start, Optional<Expression> step, Expression end, SourceSpan span)
    implements Expression {
        @Override
        public String expressionType() {
            return "range_expression";
        }
    }

    record FunctionCall(String name, List<Parameter> arguments, SourceSpan span) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String expressionType() {
            return "function_call";
        }
    }

    record Vector(List<Expression> elements, SourceSpan span) implements Expression {
        public Vector {
            elements = List.copyOf(elements);
        }

        @Override
        public String expressionType() {
            return "vector";
        }
    }

    record Index(Expression target, Expression index, SourceSpan span) implements Expression {
        @Override
        public String expressionType() {
            return "index";
        }
    }

    record Member(Expression target, String member, SourceSpan span) implements Expression {
        @Override
        public String expressionType() {
            return "member";
        }
    }

    record LetExpression(Map<String, Expression> assignments, Expression body, SourceSpan span)
    implements Expression {
        public LetExpression {
            assignments = orderedCopy(assignments);
        }

        @Override
        public String expressionType() {
            return "let_expression";
        }
    }

    record ListComprehension(List<LoopVariable> variables,
                             Optional<Expression> condition,
                             Expression body,
                             SourceSpan span) implements Expression {
        public ListComprehension {
            variables = List.copyOf(variables);
        }

        @Override
        public String expressionType() {
            return "list_comprehension";
        }
    }

    record FunctionLiteral(List<ModuleParameter> parameters, Expression body, SourceSpan span)
    implements Expression {
        public FunctionLiteral {
            parameters = List.copyOf(parameters);
        }

        @Override
        public String expressionType() {
            return "function_literal";
        }
    }

    record EchoExpression(List<Parameter> arguments, Optional<Expression> body, SourceSpan span)
    implements Expression {
        public EchoExpression {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String expressionType() {
            return "echo_expression";
        }
    }

    record AssertExpression(Expression condition,
                            Optional<Expression> message,
                            Optional<Expression> body,
                            SourceSpan span) implements Expression {
        @Override
        public String expressionType() {
            return "assert_expression";
        }
    }

    /**
     * {@code each} inside a vector or list comprehension: splices the elements of its operand.
     */
    record Each(Expression expression, SourceSpan span) implements Expression {
        @Override
        public String type() {
            return "each";
        }

        @Override
        public String expressionType() {
            return "each";
        }
    }
}
