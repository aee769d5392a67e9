package org.javai.pegtree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.pegtree.input.ParseInput;
import org.javai.pegtree.input.Position;

/**
 * A node of a concrete syntax tree built by {@link ParseTreeControl}.
 *
 * The root node has an empty type and no position. Every other node is
 * initialized by {@link #start} when its rule is entered and completed by
 * {@link #success} when the rule matched; a node whose rule failed is discarded.
 * A node owns its children: a child is attached to exactly one parent.
 *
 * Subclasses may override the lifecycle methods to collect additional data, and
 * are supplied to the parse through a node factory.
 */
public class ParseTreeNode {

	private final List<ParseTreeNode> children = new ArrayList<>();
	private final List<ParseTreeNode> childrenView = Collections.unmodifiableList(children);

	private String type = "";
	private String source = "";
	private String text;
	private Position begin;
	private Position end;
	private boolean succeeded;
	private ParseTreeNode parent;

	/**
	 * Initializes this node for an attempt of rule {@code ruleId} at the current
	 * position of {@code input}.
	 *
	 * @throws IllegalStateException if the node was already started or has children
	 */
	public void start(String ruleId, ParseInput input) {
		if (ruleId == null || ruleId.isEmpty()) {
			throw new IllegalArgumentException("Rule id must not be empty");
		}
		if (begin != null || !children.isEmpty()) {
			throw new IllegalStateException("Node " + this + " has already been started");
		}
		this.type = ruleId;
		this.source = input.source();
		this.text = input.text();
		this.begin = input.position();
	}

	/**
	 * Records the end of the match at the current position of {@code input}.
	 *
	 * @throws IllegalStateException if the node was not started or already succeeded
	 */
	public void success(ParseInput input) {
		if (begin == null) {
			throw new IllegalStateException("Node succeeded before being started");
		}
		if (succeeded) {
			throw new IllegalStateException("Node " + this + " has already succeeded");
		}
		this.succeeded = true;
		this.end = input.position();
	}

	/**
	 * Called when the rule of this node failed, just before the node is discarded.
	 */
	public void failure(ParseInput input) {
	}

	/**
	 * Forgets the end of the captured span. Children are kept.
	 */
	public void removeContent() {
		end = null;
	}

	/**
	 * Appends {@code child} as the last child of this node.
	 *
	 * @throws IllegalArgumentException if the child already belongs to a node, or
	 *         is this node or one of its ancestors
	 */
	public void appendChild(ParseTreeNode child) {
		Objects.requireNonNull(child, "child must not be null");
		if (child.parent != null) {
			throw new IllegalArgumentException("Node " + child + " is already owned by another node");
		}
		for (ParseTreeNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
			if (ancestor == child) {
				throw new IllegalArgumentException("Node " + child + " cannot be appended below itself");
			}
		}
		child.parent = this;
		children.add(child);
	}

	/**
	 * Detaches and returns the child at {@code index}.
	 */
	public ParseTreeNode removeChild(int index) {
		ParseTreeNode child = children.remove(index);
		child.parent = null;
		return child;
	}

	/**
	 * Detaches all children, returning them in order. This node is left without children.
	 */
	public List<ParseTreeNode> takeChildren() {
		List<ParseTreeNode> taken = new ArrayList<>(children);
		children.clear();
		for (ParseTreeNode child : taken) {
			child.parent = null;
		}
		return taken;
	}

	/**
	 * Moves all children of this node, in order, to the end of {@code target}'s children.
	 */
	void spliceChildrenInto(ParseTreeNode target) {
		for (ParseTreeNode child : takeChildren()) {
			target.appendChild(child);
		}
	}

	public List<ParseTreeNode> children() {
		return childrenView;
	}

	public boolean isRoot() {
		return type.isEmpty();
	}

	public boolean isType(String ruleId) {
		return type.equals(ruleId);
	}

	/**
	 * Identifier of the rule that produced this node; empty for the root.
	 */
	public String type() {
		return type;
	}

	public String source() {
		return source;
	}

	public Position begin() {
		if (begin == null) {
			throw new IllegalStateException(parent == null ? "Root node has no position"
					: "Node has not been started and has no position");
		}
		return begin;
	}

	public Position end() {
		requireContent();
		return end;
	}

	/**
	 * True if the node succeeded and its content was not removed.
	 */
	public boolean hasContent() {
		return end != null;
	}

	/**
	 * The text matched by this node's rule.
	 */
	public String content() {
		requireContent();
		return text.substring(begin.offset(), end.offset());
	}

	/**
	 * A fresh input over this node's content, for a secondary parse of the captured span.
	 */
	public ParseInput asParseInput() {
		requireContent();
		return ParseInput.subInput(text, begin, end);
	}

	private void requireContent() {
		if (!hasContent()) {
			throw new IllegalStateException("Node " + this + " has no content");
		}
	}

	@Override
	public String toString() {
		if (isRoot()) {
			return "ROOT";
		}
		if (begin == null) {
			return type;
		}
		return type + (hasContent() ? " [" + begin + " .. " + end + "]" : " [" + begin + "]");
	}
}
