package org.javai.pegtree.tree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which rules produce nodes in the parse tree, and how each such node is
 * finalized.
 *
 * A selection is fixed before parsing starts. Rules that are not selected still
 * contribute the nodes of their selected descendants, which are attached to the
 * nearest selected ancestor instead.
 *
 * <pre>
 * TreeSelection selection = TreeSelection.builder()
 *     .store("number", "identifier")
 *     .foldOne("expr")
 *     .discardEmpty("arguments")
 *     .build();
 * </pre>
 */
public final class TreeSelection {

	private final Map<String, NodeTransform> transforms;
	private final boolean storeAll;
	private final boolean pruneUnselectedLeaves;

	private TreeSelection(Map<String, NodeTransform> transforms, boolean storeAll, boolean pruneUnselectedLeaves) {
		this.transforms = Map.copyOf(transforms);
		this.storeAll = storeAll;
		this.pruneUnselectedLeaves = pruneUnselectedLeaves;
	}

	/**
	 * Selects every rule, including anonymous combinators, with no transform.
	 */
	public static TreeSelection storeAll() {
		return new Builder().storeAll(true).build();
	}

	/**
	 * Selects the given rules with no transform.
	 */
	public static TreeSelection of(String... ruleIds) {
		return new Builder().store(ruleIds).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isSelected(String ruleId) {
		return storeAll || transforms.containsKey(ruleId);
	}

	/**
	 * The transform for a selected rule; {@link TransformPolicy#KEEP} when none was registered.
	 */
	public NodeTransform transformFor(String ruleId) {
		return transforms.getOrDefault(ruleId, TransformPolicy.KEEP);
	}

	public boolean isStoreAll() {
		return storeAll;
	}

	/**
	 * Whether rules that can never produce a node may skip frame handling altogether.
	 */
	public boolean pruneUnselectedLeaves() {
		return pruneUnselectedLeaves;
	}

	/**
	 * Rules selected explicitly. Empty for a store-all selection with no registrations.
	 */
	public Set<String> selectedRules() {
		return transforms.keySet();
	}

	@Override
	public String toString() {
		return "TreeSelection[storeAll=" + storeAll + ", rules=" + transforms.keySet() + "]";
	}

	public static final class Builder {

		private final Map<String, NodeTransform> transforms = new LinkedHashMap<>();
		private boolean storeAll;
		private boolean pruneUnselectedLeaves = true;

		private Builder() {
		}

		public Builder store(String... ruleIds) {
			return apply(TransformPolicy.KEEP, ruleIds);
		}

		public Builder removeContent(String... ruleIds) {
			return apply(TransformPolicy.REMOVE_CONTENT, ruleIds);
		}

		public Builder foldOne(String... ruleIds) {
			return apply(TransformPolicy.FOLD_ONE, ruleIds);
		}

		public Builder discardEmpty(String... ruleIds) {
			return apply(TransformPolicy.DISCARD_EMPTY, ruleIds);
		}

		/**
		 * Selects the given rules with a custom transform.
		 *
		 * @throws IllegalArgumentException if one of the rules is already selected
		 */
		public Builder apply(NodeTransform transform, String... ruleIds) {
			Objects.requireNonNull(transform, "transform must not be null");
			for (String ruleId : ruleIds) {
				if (ruleId == null || ruleId.isEmpty()) {
					throw new IllegalArgumentException("Rule id must not be empty");
				}
				if (transforms.putIfAbsent(ruleId, transform) != null) {
					throw new IllegalArgumentException("Rule '" + ruleId + "' is selected more than once");
				}
			}
			return this;
		}

		/**
		 * Selects every rule. Rules registered explicitly keep their transform.
		 */
		public Builder storeAll(boolean storeAll) {
			this.storeAll = storeAll;
			return this;
		}

		public Builder pruneUnselectedLeaves(boolean prune) {
			this.pruneUnselectedLeaves = prune;
			return this;
		}

		public TreeSelection build() {
			return new TreeSelection(transforms, storeAll, pruneUnselectedLeaves);
		}
	}
}
