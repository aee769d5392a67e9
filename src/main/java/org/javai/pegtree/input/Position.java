package org.javai.pegtree.input;

import java.util.Objects;

/**
 * A location in a parse input.
 *
 * @param offset index into the backing text of the input
 * @param line 1-based line number
 * @param column 1-based column number
 * @param source name of the input source, e.g. a file name
 */
public record Position(int offset, int line, int column, String source) {

	public Position {
		Objects.requireNonNull(source, "source must not be null");
		if (offset < 0) {
			throw new IllegalArgumentException("offset must not be negative: " + offset);
		}
		if (line < 1 || column < 1) {
			throw new IllegalArgumentException("line and column are 1-based: " + line + ":" + column);
		}
	}

	@Override
	public String toString() {
		return source + ":" + line + ":" + column + "(" + offset + ")";
	}
}
