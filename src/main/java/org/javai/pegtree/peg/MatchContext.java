package org.javai.pegtree.peg;

import java.util.Objects;
import org.javai.pegtree.input.ParseInput;
import org.javai.pegtree.input.Position;

/**
 * A single match run: the input being consumed and the control observing it.
 */
public final class MatchContext {

	private final ParseInput input;
	private final Control control;

	public MatchContext(ParseInput input, Control control) {
		this.input = Objects.requireNonNull(input, "input must not be null");
		this.control = Objects.requireNonNull(control, "control must not be null");
	}

	public ParseInput input() {
		return input;
	}

	/**
	 * Attempts {@code rule} at the current position. On failure the input is
	 * rewound to where the attempt started.
	 */
	public boolean match(Rule rule) {
		Position mark = input.position();
		boolean result = control.match(rule, this);
		if (!result) {
			input.rewind(mark);
		}
		return result;
	}
}
