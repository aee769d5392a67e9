package org.javai.pegtree.tree;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.javai.pegtree.input.ParseInput;
import org.javai.pegtree.peg.Control;
import org.javai.pegtree.peg.MatchContext;
import org.javai.pegtree.peg.PegParseException;
import org.javai.pegtree.peg.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for parsing an input into a parse tree.
 *
 * Example usage:
 *
 * <pre>
 * NamedRule digit = Rules.named("digit").define(Rules.range('0', '9'));
 * Rule number = Rules.plus(digit);
 *
 * Optional&lt;ParseTreeNode&gt; root = ParseTrees.parse(number, "123", "example", TreeSelection.of("digit"));
 * // root holds three "digit" nodes
 * </pre>
 */
public final class ParseTrees {

	private static final Logger logger = LoggerFactory.getLogger(ParseTrees.class);

	private ParseTrees() {
		// Utility class - no instantiation
	}

	/**
	 * Parses {@code text} starting at {@code startRule}.
	 *
	 * @param source name of the input, reported in positions
	 */
	public static Optional<ParseTreeNode> parse(Rule startRule, String text, String source, TreeSelection selection) {
		return parse(startRule, new ParseInput(text, source), selection);
	}

	public static Optional<ParseTreeNode> parse(Rule startRule, ParseInput input, TreeSelection selection) {
		return parse(startRule, input, selection, Control.NORMAL, ParseTreeNode::new);
	}

	/**
	 * Parses {@code input} starting at {@code startRule}, building the tree from
	 * nodes created by {@code nodeFactory}.
	 *
	 * @param delegate control whose hooks are notified of every rule attempt
	 * @return the root of the tree, or empty if the start rule did not match; a
	 *         partial tree is never returned
	 * @throws PegParseException if a parse error raised while matching is not
	 *         recovered by a guarded rule
	 */
	public static Optional<ParseTreeNode> parse(Rule startRule, ParseInput input, TreeSelection selection,
			Control delegate, Supplier<? extends ParseTreeNode> nodeFactory) {
		Objects.requireNonNull(startRule, "startRule must not be null");
		Objects.requireNonNull(input, "input must not be null");
		ParseTreeControl control = new ParseTreeControl(selection, delegate, nodeFactory);
		MatchContext context = new MatchContext(input, control);
		if (!context.match(startRule)) {
			logger.debug("Rule {} did not match {}", startRule.id(), input.source());
			return Optional.empty();
		}
		ParseTreeNode root = control.finish();
		logger.debug("Parsed {} up to {} with {} top-level node(s)", input.source(), input.position(),
				root.children().size());
		return Optional.of(root);
	}
}
