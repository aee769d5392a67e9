package org.javai.pegtree.peg;

import org.javai.pegtree.input.Position;

/**
 * Raised when matching must stop instead of backtracking, e.g. when a
 * {@link Rules#must} rule fails. Unwinds to the nearest guarded rule, or out of
 * the parse if there is none.
 */
public class PegParseException extends RuntimeException {

	private final transient Position position;

	public PegParseException(String message, Position position) {
		super(position + ": " + message);
		this.position = position;
	}

	public Position position() {
		return position;
	}
}
