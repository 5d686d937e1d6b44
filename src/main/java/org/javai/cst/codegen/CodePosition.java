package org.javai.cst.codegen;

/**
 * A point in generated source.
 *
 * @param line one-based line number
 * @param column zero-based column
 * @param offset zero-based character offset
 */
public record CodePosition(int line, int column, int offset) {
}
