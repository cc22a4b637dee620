package org.pragmatica.scad.parser;

import org.pragmatica.scad.error.ParseError.Severity;
import org.pragmatica.scad.query.QueryCache;

/**
 * Parser configuration options.
 *
 * @param captureComments   keep comments as {@code comment} nodes in statement lists
 * @param minLogSeverity    least severe diagnostic level forwarded to the logger
 * @param queryCacheEnabled cache structural query results per parsed tree
 * @param queryCacheSize    most query results kept before the least recently used is evicted
 */
public record ParserConfig(boolean captureComments, Severity minLogSeverity, boolean queryCacheEnabled,
                           int queryCacheSize) {
    public static final ParserConfig DEFAULT = new ParserConfig(true, Severity.WARNING, true,
                                                                QueryCache.DEFAULT_CAPACITY);
}
