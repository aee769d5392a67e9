package org.javai.pegtree.tree;

import java.util.Objects;
import java.util.function.Supplier;
import org.javai.pegtree.input.ParseInput;
import org.javai.pegtree.peg.Control;
import org.javai.pegtree.peg.MatchContext;
import org.javai.pegtree.peg.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a parse tree while the grammar is matched.
 *
 * Every rule attempt is wrapped as follows:
 * <ul>
 * <li>a selected rule pushes a frame started at the current position; on success
 * the frame is popped, finished, transformed and attached to the new top frame,
 * on failure it is popped and dropped;</li>
 * <li>an unselected rule pushes a placeholder frame; on success the placeholder's
 * children are spliced, in order, onto the new top frame, on failure it is
 * dropped;</li>
 * <li>an unselected rule from which no selected rule is reachable is passed
 * through untouched (if pruning is enabled in the selection);</li>
 * <li>a guarded rule runs against an isolated frame stack, so that frames left
 * behind by a parse error raised inside it never reach the live stack.</li>
 * </ul>
 * The depth of the frame stack is the same after a rule attempt as before it.
 *
 * A control builds one tree; use a new instance for each parse.
 */
public class ParseTreeControl implements Control {

	private static final Logger logger = LoggerFactory.getLogger(ParseTreeControl.class);

	private final TreeSelection selection;
	private final Control delegate;
	private final FrameStack stack;
	private final SelectionAnalysis analysis;

	public ParseTreeControl(TreeSelection selection) {
		this(selection, Control.NORMAL, ParseTreeNode::new);
	}

	/**
	 * @param selection which rules produce nodes
	 * @param delegate control whose hooks run for every rule attempt, inside the tree handling
	 * @param nodeFactory creates the nodes of the tree, including the root
	 */
	public ParseTreeControl(TreeSelection selection, Control delegate, Supplier<? extends ParseTreeNode> nodeFactory) {
		this.selection = Objects.requireNonNull(selection, "selection must not be null");
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
		this.stack = new FrameStack(nodeFactory);
		this.analysis = selection.pruneUnselectedLeaves() ? new SelectionAnalysis(selection) : null;
	}

	@Override
	public boolean match(Rule rule, MatchContext context) {
		boolean selected = selection.isSelected(rule.id());
		if (!selected && analysis != null && analysis.isUnselectedLeaf(rule)) {
			return delegate.match(rule, context);
		}
		if (rule.isGuarded()) {
			return matchGuarded(rule, context, selected);
		}
		return selected ? matchSelected(rule, context) : matchUnselected(rule, context);
	}

	/**
	 * Current number of frames, including the root.
	 */
	public int depth() {
		return stack.depth();
	}

	/**
	 * Hands over the root of the tree once the start rule has matched.
	 *
	 * @throws IllegalStateException if frames other than the root are still on the stack
	 */
	public ParseTreeNode finish() {
		if (stack.depth() != 1) {
			throw new IllegalStateException("Expected only the root frame, found " + stack.depth() + " frames");
		}
		return stack.top();
	}

	private boolean matchSelected(Rule rule, MatchContext context) {
		ParseInput input = context.input();
		stack.push();
		stack.top().start(rule.id(), input);
		boolean result = delegate.match(rule, context);
		ParseTreeNode node = stack.pop();
		if (result) {
			finishNode(rule, node, input);
		} else {
			node.failure(input);
		}
		return result;
	}

	private boolean matchUnselected(Rule rule, MatchContext context) {
		stack.push();
		boolean result = delegate.match(rule, context);
		ParseTreeNode placeholder = stack.pop();
		if (result) {
			placeholder.spliceChildrenInto(stack.top());
		}
		return result;
	}

	private boolean matchGuarded(Rule rule, MatchContext context, boolean selected) {
		ParseInput input = context.input();
		FrameStack.Isolation isolation = stack.isolate();
		boolean result;
		try (isolation) {
			if (selected) {
				stack.top().start(rule.id(), input);
			}
			result = delegate.match(rule, context);
		}
		if (!result) {
			logger.trace("Guarded rule {} failed at {}; discarding its isolated frames", rule.id(), input.position());
			if (selected) {
				isolation.frame().failure(input);
			}
			return false;
		}
		if (isolation.depth() != 1) {
			throw new IllegalStateException("Guarded rule " + rule.id() + " left " + isolation.depth()
					+ " frames on its isolated stack, expected 1");
		}
		ParseTreeNode frame = isolation.frame();
		if (selected) {
			finishNode(rule, frame, input);
		} else {
			frame.spliceChildrenInto(stack.top());
		}
		return true;
	}

	private void finishNode(Rule rule, ParseTreeNode node, ParseInput input) {
		node.success(input);
		ParseTreeNode transformed = selection.transformFor(rule.id()).apply(node);
		if (transformed == null) {
			return;
		}
		if (transformed.isRoot()) {
			throw new IllegalStateException("Transform for rule " + rule.id() + " returned a node that was never started");
		}
		stack.top().appendChild(transformed);
	}
}
