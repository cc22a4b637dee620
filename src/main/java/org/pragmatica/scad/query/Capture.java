package org.pragmatica.scad.query;

import org.pragmatica.scad.tree.SyntaxNode;

/**
 * A node captured under a name by a query match.
 */
public record Capture(String name, SyntaxNode node) {}
