package org.pragmatica.scad;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.error.CollectingErrorHandler;
import org.pragmatica.scad.error.ParseError;
import org.pragmatica.scad.error.ParseError.Severity;
import org.pragmatica.scad.error.ParserException;
import org.pragmatica.scad.outline.OutlineExtractor;
import org.pragmatica.scad.outline.OutlineSymbol;
import org.pragmatica.scad.parser.CstParser;
import org.pragmatica.scad.parser.ParseResult;
import org.pragmatica.scad.parser.ParserConfig;
import org.pragmatica.scad.parser.SyntaxTree;
import org.pragmatica.scad.query.QueryCache;
import org.pragmatica.scad.visitor.AstGenerator;
import org.pragmatica.scad.visitor.QueryVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for parsing OpenSCAD source into a syntax tree and an AST.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = OpenScadParser.create();
 * var result = parser.parse("cube(10);");
 *
 * if (!result.success()) {
 *     System.err.println(result.formatErrors("model.scad"));
 * }
 * }</pre>
 *
 * <p>Every parse gets its own error handler and visitor graph. The most recent tree stays available
 * for {@link #query()} and {@link #outline()}. Instances are not thread-safe.
 */
public final class OpenScadParser {
    private final ParserConfig config;
    private final QueryCache queryCache;
    private SyntaxTree lastTree;
    private QueryVisitor queryVisitor;

    private OpenScadParser(ParserConfig config) {
        this.config = config;
        this.queryCache = new QueryCache(null, config.queryCacheEnabled(), config.queryCacheSize());
    }

    public static OpenScadParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static OpenScadParser create(ParserConfig config) {
        return new OpenScadParser(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Produce the syntax tree only. The tree becomes the target of later queries.
     */
    public SyntaxTree parseCst(String source) {
        var tree = CstParser.parse(source, config);
        lastTree = tree;
        queryCache.rebind(tree.root());
        queryVisitor = null;
        return tree;
    }

    /**
     * Parse source and build its AST.
     */
    public ParseResult parse(String source) {
        var tree = parseCst(source);
        var handler = new CollectingErrorHandler(config.minLogSeverity());
        var generator = new AstGenerator(handler);
        var ast = generator.generate(tree.root());
        queryVisitor = new QueryVisitor(queryCache, generator.visitor(), handler);

        var errors = new ArrayList<ParseError>(tree.syntaxErrors());
        errors.addAll(handler.diagnostics());
        boolean success = !tree.hasErrors() && !handler.hasDiagnostics();
        return new ParseResult(ast, errors, success, tree);
    }

    public List<AstNode> parseAst(String source) {
        return parse(source).ast();
    }

    public Optional<SyntaxTree> lastTree() {
        return Optional.ofNullable(lastTree);
    }

    /**
     * Query access to the most recently parsed tree.
     *
     * @throws ParserException if nothing was parsed yet
     */
    public QueryVisitor query() {
        var tree = requireTree("query");
        if (queryVisitor == null) {
            var handler = new CollectingErrorHandler(config.minLogSeverity());
            queryVisitor = new QueryVisitor(queryCache, AstGenerator.defaultVisitor(handler), handler);
        }
        if (queryCache.root() != tree.root()) {
            queryCache.rebind(tree.root());
        }
        return queryVisitor;
    }

    /**
     * @throws ParserException if nothing was parsed yet
     */
    public List<OutlineSymbol> outline() {
        return OutlineExtractor.extract(requireTree("outline").root());
    }

    private SyntaxTree requireTree(String operation) {
        if (lastTree == null) {
            throw new ParserException("Cannot run " + operation + " before a source was parsed");
        }
        return lastTree;
    }

    public static final class Builder {
        private boolean captureComments = ParserConfig.DEFAULT.captureComments();
        private Severity minLogSeverity = ParserConfig.DEFAULT.minLogSeverity();
        private boolean queryCacheEnabled = ParserConfig.DEFAULT.queryCacheEnabled();
        private int queryCacheSize = ParserConfig.DEFAULT.queryCacheSize();

        private Builder() {}

        public Builder captureComments(boolean capture) {
            this.captureComments = capture;
            return this;
        }

        public Builder minLogSeverity(Severity severity) {
            this.minLogSeverity = severity;
            return this;
        }

        public Builder queryCache(boolean enabled) {
            this.queryCacheEnabled = enabled;
            return this;
        }

        public Builder queryCacheSize(int size) {
            this.queryCacheSize = size;
            return this;
        }

        public OpenScadParser build() {
            return new OpenScadParser(new ParserConfig(captureComments, minLogSeverity, queryCacheEnabled,
                                                       queryCacheSize));
        }
    }
}
