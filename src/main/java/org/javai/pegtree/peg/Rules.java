package org.javai.pegtree.peg;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.pegtree.input.ParseInput;

/**
 * Factory for the primitive rules and combinators of a grammar.
 *
 * Each combinator gets a generated identifier describing its structure, e.g.
 * {@code seq<one<'('>, expr, one<')'>>}. Grammars name the rules they care about
 * with {@link #named(String)}.
 */
public final class Rules {

	private Rules() {
		// Utility class - no instantiation
	}

	public static NamedRule named(String id) {
		return new NamedRule(id);
	}

	/**
	 * Matches one character from {@code chars}.
	 */
	public static Rule one(char... chars) {
		if (chars.length == 0) {
			throw new IllegalArgumentException("one() needs at least one character");
		}
		String id = "one<" + joinChars(chars) + ">";
		char[] accepted = chars.clone();
		return new Primitive(id, input -> {
			if (input.isEof()) {
				return 0;
			}
			char c = input.peek();
			for (char a : accepted) {
				if (a == c) {
					return 1;
				}
			}
			return 0;
		});
	}

	/**
	 * Matches one character between {@code lo} and {@code hi} inclusive.
	 */
	public static Rule range(char lo, char hi) {
		if (lo > hi) {
			throw new IllegalArgumentException("Empty range '" + lo + "'-'" + hi + "'");
		}
		return new Primitive("range<'" + lo + "', '" + hi + "'>", input -> {
			if (input.isEof()) {
				return 0;
			}
			char c = input.peek();
			return c >= lo && c <= hi ? 1 : 0;
		});
	}

	/**
	 * Matches {@code text} literally.
	 */
	public static Rule string(String text) {
		if (text == null || text.isEmpty()) {
			throw new IllegalArgumentException("string() needs a non-empty literal");
		}
		return new Primitive("string<\"" + text + "\">", input -> input.startsWith(text) ? text.length() : 0);
	}

	/**
	 * Matches any single character.
	 */
	public static Rule any() {
		return new Primitive("any", input -> input.isEof() ? 0 : 1);
	}

	/**
	 * Matches the end of the input without consuming anything.
	 */
	public static Rule eof() {
		return new Rule() {
			@Override
			public String id() {
				return "eof";
			}

			@Override
			public boolean match(MatchContext context) {
				return context.input().isEof();
			}
		};
	}

	public static Rule seq(Rule... rules) {
		return new Seq(compositeId("seq", rules), List.of(rules));
	}

	/**
	 * Ordered choice: the first alternative that matches wins.
	 */
	public static Rule sor(Rule... rules) {
		return new Sor(compositeId("sor", rules), List.of(rules));
	}

	/**
	 * Zero or more repetitions of the given sequence.
	 */
	public static Rule star(Rule... rules) {
		return new Star(compositeId("star", rules), asOne(rules));
	}

	/**
	 * One or more repetitions of the given sequence.
	 */
	public static Rule plus(Rule... rules) {
		return new Plus(compositeId("plus", rules), asOne(rules));
	}

	public static Rule opt(Rule... rules) {
		return new Opt(compositeId("opt", rules), asOne(rules));
	}

	/**
	 * Like {@link #seq}, but instead of failing raises a {@link PegParseException}
	 * naming the first rule that did not match.
	 */
	public static Rule must(Rule... rules) {
		return new Must(compositeId("must", rules), List.of(rules));
	}

	/**
	 * Always raises a {@link PegParseException} with {@code message}.
	 */
	public static Rule raise(String message) {
		return new Rule() {
			@Override
			public String id() {
				return "raise<" + message + ">";
			}

			@Override
			public boolean match(MatchContext context) {
				throw new PegParseException(message, context.input().position());
			}
		};
	}

	/**
	 * Matches the given sequence, converting a {@link PegParseException} raised
	 * anywhere inside it into an ordinary failure.
	 */
	public static Rule tryCatch(Rule... rules) {
		return new TryCatch(compositeId("try_catch", rules), asOne(rules));
	}

	private static Rule asOne(Rule... rules) {
		if (rules.length == 0) {
			throw new IllegalArgumentException("At least one rule is required");
		}
		return rules.length == 1 ? rules[0] : seq(rules);
	}

	private static String compositeId(String name, Rule... rules) {
		if (rules.length == 0) {
			throw new IllegalArgumentException(name + "() needs at least one rule");
		}
		return Arrays.stream(rules)
				.map(Rule::id)
				.collect(Collectors.joining(", ", name + "<", ">"));
	}

	private static String joinChars(char[] chars) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < chars.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append('\'').append(chars[i]).append('\'');
		}
		return sb.toString();
	}

	/**
	 * Measures how many characters a primitive accepts at the cursor; zero means no match.
	 */
	@FunctionalInterface
	private interface Scanner {
		int scan(ParseInput input);
	}

	private record Primitive(String id, Scanner scanner) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			int count = scanner.scan(context.input());
			if (count == 0) {
				return false;
			}
			context.input().bump(count);
			return true;
		}

		@Override
		public String toString() {
			return id;
		}
	}

	private record Seq(String id, List<Rule> subRules) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			for (Rule rule : subRules) {
				if (!context.match(rule)) {
					return false;
				}
			}
			return true;
		}
	}

	private record Sor(String id, List<Rule> subRules) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			for (Rule rule : subRules) {
				if (context.match(rule)) {
					return true;
				}
			}
			return false;
		}
	}

	private record Star(String id, Rule rule) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			while (true) {
				int before = context.input().offset();
				if (!context.match(rule) || context.input().offset() == before) {
					return true;
				}
			}
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}
	}

	private record Plus(String id, Rule rule) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			if (!context.match(rule)) {
				return false;
			}
			while (true) {
				int before = context.input().offset();
				if (!context.match(rule) || context.input().offset() == before) {
					return true;
				}
			}
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}
	}

	private record Opt(String id, Rule rule) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			context.match(rule);
			return true;
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}
	}

	private record Must(String id, List<Rule> subRules) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			for (Rule rule : subRules) {
				if (!context.match(rule)) {
					throw new PegParseException("expected " + rule.id(), context.input().position());
				}
			}
			return true;
		}
	}

	private record TryCatch(String id, Rule rule) implements Rule {
		@Override
		public boolean match(MatchContext context) {
			try {
				return context.match(rule);
			} catch (PegParseException e) {
				// recovered here: the abort is an ordinary failure of this rule
				return false;
			}
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}

		@Override
		public boolean isGuarded() {
			return true;
		}
	}
}
