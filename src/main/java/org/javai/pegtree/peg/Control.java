package org.javai.pegtree.peg;

import org.javai.pegtree.input.ParseInput;

/**
 * Hooks invoked around every rule attempt.
 *
 * The default {@link #match} notifies {@link #start}, runs the rule body and then
 * notifies either {@link #success} or {@link #failure}. Controls that need to wrap
 * the whole attempt override {@code match} itself.
 */
public interface Control {

	/**
	 * Control with no side effects.
	 */
	Control NORMAL = new Control() {
	};

	default void start(Rule rule, ParseInput input) {
	}

	default void success(Rule rule, ParseInput input) {
	}

	default void failure(Rule rule, ParseInput input) {
	}

	default boolean match(Rule rule, MatchContext context) {
		start(rule, context.input());
		boolean result = rule.match(context);
		if (result) {
			success(rule, context.input());
		} else {
			failure(rule, context.input());
		}
		return result;
	}
}
