package org.javai.pegtree.tree;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The built-in node transforms.
 */
public enum TransformPolicy implements NodeTransform {

	/** Leaves the node unchanged. */
	KEEP("keep") {
		@Override
		public ParseTreeNode apply(ParseTreeNode node) {
			return node;
		}
	},

	/** Clears the node's content, keeping its children. */
	REMOVE_CONTENT("remove-content") {
		@Override
		public ParseTreeNode apply(ParseTreeNode node) {
			node.removeContent();
			return node;
		}
	},

	/** Replaces a node that has exactly one child with that child, otherwise removes content. */
	FOLD_ONE("fold-one") {
		@Override
		public ParseTreeNode apply(ParseTreeNode node) {
			if (node.children().size() == 1) {
				return node.removeChild(0);
			}
			node.removeContent();
			return node;
		}
	},

	/** Drops a node that has no children, otherwise removes content. */
	DISCARD_EMPTY("discard-empty") {
		@Override
		public ParseTreeNode apply(ParseTreeNode node) {
			if (node.children().isEmpty()) {
				return null;
			}
			node.removeContent();
			return node;
		}
	};

	private final String configName;

	TransformPolicy(String configName) {
		this.configName = configName;
	}

	/**
	 * Name of the policy in configuration files, e.g. {@code fold-one}.
	 */
	public String configName() {
		return configName;
	}

	/**
	 * Looks up a policy by its configuration name.
	 *
	 * @throws IllegalArgumentException if no policy has that name
	 */
	public static TransformPolicy fromConfigName(String name) {
		for (TransformPolicy policy : values()) {
			if (policy.configName.equals(name)) {
				return policy;
			}
		}
		throw new IllegalArgumentException("Unknown transform policy '" + name + "', expected one of "
				+ Arrays.stream(values()).map(TransformPolicy::configName).collect(Collectors.joining(", ")));
	}
}
