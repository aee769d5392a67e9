package org.javai.pegtree.input;

import java.util.Objects;

/**
 * Rewindable cursor over a string, tracking line and column as it advances.
 *
 * A line feed starts a new line, which covers both LF and CRLF line endings.
 * Offsets are always indices into the full backing text, so an input created
 * over a sub-range (see {@link #subInput}) reports the same positions as the
 * input the range was captured from.
 */
public final class ParseInput {

	private final String text;
	private final String source;
	private final int begin;
	private final int end;

	private int offset;
	private int line;
	private int column;

	/**
	 * Creates an input over the whole of {@code text}.
	 *
	 * @param text the text to parse
	 * @param source name of the source, used in positions and error messages
	 */
	public ParseInput(String text, String source) {
		this(text, source, 0, text.length(), 1, 1);
	}

	private ParseInput(String text, String source, int begin, int end, int line, int column) {
		this.text = Objects.requireNonNull(text, "text must not be null");
		this.source = Objects.requireNonNull(source, "source must not be null");
		if (begin < 0 || begin > end || end > text.length()) {
			throw new IllegalArgumentException(
					"Invalid range [" + begin + ", " + end + ") for text of length " + text.length());
		}
		this.begin = begin;
		this.end = end;
		this.offset = begin;
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates an input over the span between two positions of the same text.
	 * The new input starts at {@code begin}'s line and column.
	 */
	public static ParseInput subInput(String text, Position begin, Position end) {
		Objects.requireNonNull(begin, "begin must not be null");
		Objects.requireNonNull(end, "end must not be null");
		return new ParseInput(text, begin.source(), begin.offset(), end.offset(), begin.line(), begin.column());
	}

	public String text() {
		return text;
	}

	public String source() {
		return source;
	}

	public Position position() {
		return new Position(offset, line, column, source);
	}

	public int offset() {
		return offset;
	}

	/**
	 * Number of characters left before the end of the input.
	 */
	public int size() {
		return end - offset;
	}

	public boolean isEof() {
		return offset >= end;
	}

	public char peek() {
		return peek(0);
	}

	/**
	 * Returns the character {@code ahead} positions past the cursor.
	 *
	 * @throws IllegalStateException if that would read past the end of the input
	 */
	public char peek(int ahead) {
		if (ahead < 0 || offset + ahead >= end) {
			throw new IllegalStateException("Cannot read " + ahead + " past " + position() + ": end of input");
		}
		return text.charAt(offset + ahead);
	}

	public boolean startsWith(String expected) {
		return expected.length() <= size() && text.startsWith(expected, offset);
	}

	/**
	 * Advances the cursor by {@code count} characters.
	 */
	public void bump(int count) {
		if (count < 0 || count > size()) {
			throw new IllegalArgumentException("Cannot advance " + count + " characters, " + size() + " remaining");
		}
		for (int i = 0; i < count; i++) {
			if (text.charAt(offset++) == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
		}
	}

	/**
	 * Moves the cursor back to a position previously returned by {@link #position()}.
	 *
	 * @throws IllegalArgumentException if the position lies outside this input's range
	 *         or belongs to another source
	 */
	public void rewind(Position mark) {
		Objects.requireNonNull(mark, "mark must not be null");
		if (mark.offset() < begin || mark.offset() > end || !mark.source().equals(source)) {
			throw new IllegalArgumentException("Position " + mark + " does not belong to this input");
		}
		offset = mark.offset();
		line = mark.line();
		column = mark.column();
	}

	@Override
	public String toString() {
		return "ParseInput[" + position() + ", " + size() + " remaining]";
	}
}
