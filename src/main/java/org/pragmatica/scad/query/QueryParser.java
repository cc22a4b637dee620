package org.pragmatica.scad.query;

import org.pragmatica.scad.error.ParserException;
import org.pragmatica.scad.query.Pattern.Alternation;
import org.pragmatica.scad.query.Pattern.ChildPattern;
import org.pragmatica.scad.query.Pattern.Guarded;
import org.pragmatica.scad.query.Pattern.NodePattern;
import org.pragmatica.scad.query.Pattern.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Parser for the S-expression query language.
 *
 * <pre>
 * query     := (pattern | predicate)*
 * pattern   := '(' (type | '_') (child | predicate)* ')' capture?
 *            | '(' pattern predicate* ')'
 *            | '[' pattern+ ']' capture?
 *            | '_' capture?
 * child     := (field ':')? pattern
 * predicate := '(' '#eq?' | '#not-eq?' | '#match?' capture (capture | string) ')'
 * capture   := '@' name
 * </pre>
 *
 * A predicate at the top level applies to the pattern before it.
 */
final class QueryParser {
    private final String input;
    private int pos;

    private QueryParser(String input) {
        this.input = input;
    }

    static List<Pattern> parse(String query) {
        return new QueryParser(query).parseQuery();
    }

    private List<Pattern> parseQuery() {
        var patterns = new ArrayList<Pattern>();
        skipWhitespace();
        while (!isAtEnd()) {
            if (startsPredicate()) {
                if (patterns.isEmpty()) {
                    throw error("Predicate without a preceding pattern");
                }
                var last = patterns.remove(patterns.size() - 1);
                patterns.add(guard(last, List.of(parsePredicate())));
            } else {
                patterns.add(parsePattern());
            }
            skipWhitespace();
        }
        if (patterns.isEmpty()) {
            throw error("Empty query");
        }
        return patterns;
    }

    private Pattern parsePattern() {
        skipWhitespace();
        if (isAtEnd()) {
            throw error("Unexpected end of query");
        }
        char c = peek();
        if (c == '[') {
            return parseAlternation();
        }
        if (c == '_') {
            pos++;
            return new NodePattern(Pattern.WILDCARD, List.of(), parseCapture());
        }
        if (c != '(') {
            throw error("Expected '(' or '['");
        }
        pos++;
        skipWhitespace();
        if (!isAtEnd() && (peek() == '(' || peek() == '[')) {
            return parseGroup();
        }
        var type = readName();
        if (type.isEmpty()) {
            throw error("Expected node type");
        }
        var children = new ArrayList<ChildPattern>();
        var predicates = new ArrayList<Predicate>();
        skipWhitespace();
        while (!isAtEnd() && peek() != ')') {
            if (startsPredicate()) {
                predicates.add(parsePredicate());
            } else {
                children.add(parseChild());
            }
            skipWhitespace();
        }
        expect(')');
        var pattern = new NodePattern(type, children, parseCapture());
        return guard(pattern, predicates);
    }

    private Pattern parseGroup() {
        var inner = parsePattern();
        var predicates = new ArrayList<Predicate>();
        skipWhitespace();
        while (!isAtEnd() && peek() != ')') {
            if (!startsPredicate()) {
                throw error("Only predicates may follow a grouped pattern");
            }
            predicates.add(parsePredicate());
            skipWhitespace();
        }
        expect(')');
        return guard(inner, predicates);
    }

    private Pattern parseAlternation() {
        expect('[');
        var alternatives = new ArrayList<Pattern>();
        skipWhitespace();
        while (!isAtEnd() && peek() != ']') {
            alternatives.add(parsePattern());
            skipWhitespace();
        }
        expect(']');
        if (alternatives.isEmpty()) {
            throw error("Empty alternation");
        }
        return new Alternation(alternatives, parseCapture());
    }

    private ChildPattern parseChild() {
        int save = pos;
        var name = readName();
        skipWhitespace();
        if (!name.isEmpty() && !isAtEnd() && peek() == ':') {
            pos++;
            return new ChildPattern(Optional.of(name), parsePattern());
        }
        pos = save;
        return new ChildPattern(Optional.empty(), parsePattern());
    }

    private Predicate parsePredicate() {
        expect('(');
        expect('#');
        var name = readName();
        var kind = switch (name) {
            case "eq?" -> Predicate.Kind.EQ;
            case "not-eq?" -> Predicate.Kind.NOT_EQ;
            case "match?" -> Predicate.Kind.MATCH;
            default -> throw error("Unknown predicate '#" + name + "'");
        };
        skipWhitespace();
        var capture = parseCapture().orElseThrow(() -> error("Predicate needs a capture"));
        skipWhitespace();
        Predicate predicate;
        if (!isAtEnd() && peek() == '@') {
            if (kind == Predicate.Kind.MATCH) {
                throw error("#match? needs a string pattern");
            }
            predicate = new Predicate(kind, capture, parseCapture().orElseThrow(), true, Optional.empty());
        } else {
            var argument = readString();
            var regex = kind == Predicate.Kind.MATCH
                        ? Optional.of(compileRegex(argument))
                        : Optional.<java.util.regex.Pattern>empty();
            predicate = new Predicate(kind, capture, argument, false, regex);
        }
        skipWhitespace();
        expect(')');
        return predicate;
    }

    private Optional<String> parseCapture() {
        skipWhitespace();
        if (isAtEnd() || peek() != '@') {
            return Optional.empty();
        }
        pos++;
        var name = readName();
        if (name.isEmpty()) {
            throw error("Expected capture name after '@'");
        }
        return Optional.of(name);
    }

    private String readString() {
        expect('"');
        var sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = input.charAt(pos++);
            if (c == '\\' && !isAtEnd()) {
                c = input.charAt(pos++);
            }
            sb.append(c);
        }
        expect('"');
        return sb.toString();
    }

    private String readName() {
        int start = pos;
        while (!isAtEnd() && isNameChar(peek())) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private boolean startsPredicate() {
        int i = pos;
        if (i >= input.length() || input.charAt(i) != '(') {
            return false;
        }
        i++;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() && input.charAt(i) == '#';
    }

    private void expect(char c) {
        skipWhitespace();
        if (isAtEnd() || peek() != c) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
        if (!isAtEnd() && peek() == ';') {
            while (!isAtEnd() && peek() != '\n') {
                pos++;
            }
            skipWhitespace();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private java.util.regex.Pattern compileRegex(String regex) {
        try {
            return java.util.regex.Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ParserException("Invalid regular expression in query '" + input + "': " + regex, e);
        }
    }

    private ParserException error(String message) {
        return new ParserException("Invalid query at offset " + pos + ": " + message + " in '" + input + "'");
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '?' || c == '.';
    }

    private static Pattern guard(Pattern pattern, List<Predicate> predicates) {
        if (predicates.isEmpty()) {
            return pattern;
        }
        if (pattern instanceof Guarded guarded) {
            var all = new ArrayList<>(guarded.predicates());
            all.addAll(predicates);
            return new Guarded(guarded.pattern(), all);
        }
        return new Guarded(pattern, predicates);
    }
}
