package org.pragmatica.scad.ast;

/**
 * One {@code name = range} clause of a for loop or list comprehension.
 */
public record LoopVariable(String variable, Expression range) {}
