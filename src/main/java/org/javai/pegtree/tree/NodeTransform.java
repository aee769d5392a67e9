package org.javai.pegtree.tree;

/**
 * Finalizes a node whose rule matched, before it is attached to its parent.
 *
 * A transform may mutate the node, return a different node to attach in its
 * place (for instance one of its children, detached first), or return
 * {@code null} to drop it from the tree.
 */
@FunctionalInterface
public interface NodeTransform {

	ParseTreeNode apply(ParseTreeNode node);
}
