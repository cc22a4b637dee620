package org.pragmatica.scad.tree;

import java.util.Set;

/**
 * Node type names of the OpenSCAD grammar.
 */
public final class NodeTypes {
    public static final String SOURCE_FILE = "source_file";
    public static final String STATEMENT = "statement";
    public static final String BLOCK = "block";
    public static final String COMMENT = "comment";

    public static final String ASSIGNMENT_STATEMENT = "assignment_statement";
    public static final String MODULE_DEFINITION = "module_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATIONS = "parameter_declarations";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String MODULE_INSTANTIATION = "module_instantiation";
    public static final String MODIFIER = "modifier";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String ARGUMENTS = "arguments";
    public static final String ARGUMENT = "argument";
    public static final String INCLUDE_STATEMENT = "include_statement";
    public static final String USE_STATEMENT = "use_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_ASSIGNMENT = "for_assignment";
    public static final String LET_STATEMENT = "let_statement";
    public static final String ECHO_STATEMENT = "echo_statement";
    public static final String ASSERT_STATEMENT = "assert_statement";

    public static final String NUMBER = "number";
    public static final String STRING = "string";
    public static final String ANGLE_BRACKET_STRING = "angle_bracket_string";
    public static final String BOOLEAN = "boolean";
    public static final String UNDEF = "undef";
    public static final String IDENTIFIER = "identifier";
    public static final String SPECIAL_VARIABLE = "special_variable";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String UNARY_EXPRESSION = "unary_expression";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String INDEX_EXPRESSION = "index_expression";
    public static final String MEMBER_EXPRESSION = "member_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String RANGE_EXPRESSION = "range_expression";
    public static final String VECTOR_EXPRESSION = "vector_expression";
    public static final String EACH_EXPRESSION = "each_expression";
    public static final String LET_EXPRESSION = "let_expression";
    public static final String LET_ASSIGNMENT = "let_assignment";
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String LIST_COMPREHENSION_FOR = "list_comprehension_for";
    public static final String FUNCTION_LITERAL = "function_literal";
    public static final String ECHO_EXPRESSION = "echo_expression";
    public static final String ASSERT_EXPRESSION = "assert_expression";

    public static final Set<String> EXPRESSIONS = Set.of(
        NUMBER, STRING, BOOLEAN, UNDEF, IDENTIFIER, SPECIAL_VARIABLE,
        BINARY_EXPRESSION, UNARY_EXPRESSION, CONDITIONAL_EXPRESSION, CALL_EXPRESSION,
        INDEX_EXPRESSION, MEMBER_EXPRESSION, PARENTHESIZED_EXPRESSION, RANGE_EXPRESSION,
        VECTOR_EXPRESSION, EACH_EXPRESSION, LET_EXPRESSION, LIST_COMPREHENSION,
        FUNCTION_LITERAL, ECHO_EXPRESSION, ASSERT_EXPRESSION);

    /**
     * Statement-level constructs that can never stand in for a range bound.
     */
    public static final Set<String> FORBIDDEN_IN_RANGE = Set.of(
        IF_STATEMENT, FOR_STATEMENT, "while_statement", "do_statement",
        MODULE_DEFINITION, FUNCTION_DEFINITION,
        INCLUDE_STATEMENT, "import_statement", USE_STATEMENT);

    public static final Set<String> RESERVED_KEYWORDS = Set.of("if", "else", "for", "module", "include", "use");

    private NodeTypes() {}

    public static boolean isExpression(String type) {
        return EXPRESSIONS.contains(type);
    }
}
