package org.javai.pegtree.peg;

import java.util.List;

/**
 * A unit of a PEG grammar, attempted against the input at the current position.
 *
 * Implementations match their own body only; every sub-rule must be attempted
 * through {@link MatchContext#match(Rule)} so that the installed {@link Control}
 * sees it and the input is rewound when it fails.
 */
public interface Rule {

	/**
	 * Stable identifier of this rule. Used as the node type in parse trees and
	 * as the key for tree selection.
	 */
	String id();

	/**
	 * Attempts the body of this rule.
	 *
	 * @param context the running match
	 * @return true if the rule matched
	 * @throws PegParseException if matching aborts with a parse error
	 */
	boolean match(MatchContext context);

	/**
	 * The rules this rule attempts directly.
	 */
	default List<Rule> subRules() {
		return List.of();
	}

	/**
	 * True for rules that recover from a {@link PegParseException} raised inside
	 * their body, turning it into an ordinary failure.
	 */
	default boolean isGuarded() {
		return false;
	}
}
