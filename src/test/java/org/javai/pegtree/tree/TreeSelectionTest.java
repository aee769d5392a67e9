package org.javai.pegtree.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TreeSelectionTest {

	@Test
	void onlyListedRulesAreSelected() {
		TreeSelection selection = TreeSelection.of("number", "identifier");

		assertThat(selection.isSelected("number")).isTrue();
		assertThat(selection.isSelected("sum")).isFalse();
		assertThat(selection.transformFor("number")).isEqualTo(TransformPolicy.KEEP);
		assertThat(selection.selectedRules()).containsExactlyInAnyOrder("number", "identifier");
		assertThat(selection.pruneUnselectedLeaves()).isTrue();
	}

	@Test
	void builderAssignsTransforms() {
		NodeTransform custom = node -> node;
		TreeSelection selection = TreeSelection.builder()
				.foldOne("sum")
				.discardEmpty("arguments")
				.removeContent("block")
				.apply(custom, "call")
				.pruneUnselectedLeaves(false)
				.build();

		assertThat(selection.transformFor("sum")).isEqualTo(TransformPolicy.FOLD_ONE);
		assertThat(selection.transformFor("arguments")).isEqualTo(TransformPolicy.DISCARD_EMPTY);
		assertThat(selection.transformFor("block")).isEqualTo(TransformPolicy.REMOVE_CONTENT);
		assertThat(selection.transformFor("call")).isSameAs(custom);
		assertThat(selection.pruneUnselectedLeaves()).isFalse();
	}

	@Test
	void ruleCanOnlyBeSelectedOnce() {
		TreeSelection.Builder builder = TreeSelection.builder().store("sum");

		assertThatThrownBy(() -> builder.foldOne("sum"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'sum'");
	}

	@Test
	void storeAllSelectsEverything() {
		TreeSelection selection = TreeSelection.builder().storeAll(true).foldOne("sum").build();

		assertThat(selection.isSelected("anything")).isTrue();
		assertThat(selection.transformFor("anything")).isEqualTo(TransformPolicy.KEEP);
		assertThat(selection.transformFor("sum")).isEqualTo(TransformPolicy.FOLD_ONE);
	}
}
