package org.javai.pegtree.peg;

import java.util.List;
import java.util.Objects;

/**
 * A rule with an author-assigned identifier and a body defined separately, so
 * that rules can refer to each other recursively.
 *
 * <pre>
 * NamedRule expr = Rules.named("expr");
 * NamedRule paren = Rules.named("paren").define(Rules.seq(Rules.one('('), expr, Rules.one(')')));
 * expr.define(Rules.sor(paren, Rules.range('a', 'z')));
 * </pre>
 *
 * Attempting a named rule is a single rule attempt: the body's own notifications
 * are not issued, only those of the body's sub-rules.
 */
public final class NamedRule implements Rule {

	private final String id;
	private Rule body;

	NamedRule(String id) {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Rule id must not be blank");
		}
		this.id = id;
	}

	/**
	 * Sets the body of this rule.
	 *
	 * @return this rule
	 * @throws IllegalStateException if the body has already been defined
	 */
	public NamedRule define(Rule body) {
		Objects.requireNonNull(body, "body must not be null");
		if (this.body != null) {
			throw new IllegalStateException("Rule '" + id + "' is already defined");
		}
		this.body = body;
		return this;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public boolean match(MatchContext context) {
		return body().match(context);
	}

	@Override
	public List<Rule> subRules() {
		return body().subRules();
	}

	@Override
	public boolean isGuarded() {
		return body().isGuarded();
	}

	private Rule body() {
		if (body == null) {
			throw new IllegalStateException("Rule '" + id + "' is used before being defined");
		}
		return body;
	}

	@Override
	public String toString() {
		return id;
	}
}
