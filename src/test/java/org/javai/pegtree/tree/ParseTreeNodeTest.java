package org.javai.pegtree.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.pegtree.input.ParseInput;
import org.junit.jupiter.api.Test;

class ParseTreeNodeTest {

	private static ParseTreeNode finished(String type, ParseInput input, int length) {
		ParseTreeNode node = new ParseTreeNode();
		node.start(type, input);
		input.bump(length);
		node.success(input);
		return node;
	}

	@Test
	void newNodeIsRoot() {
		ParseTreeNode root = new ParseTreeNode();

		assertThat(root.isRoot()).isTrue();
		assertThat(root.type()).isEmpty();
		assertThat(root.hasContent()).isFalse();
		assertThat(root.children()).isEmpty();
		assertThatThrownBy(root::begin).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void startAndSuccessCaptureSpan() {
		ParseInput input = new ParseInput("let x", "script");
		input.bump(4);

		ParseTreeNode node = finished("identifier", input, 1);

		assertThat(node.isRoot()).isFalse();
		assertThat(node.isType("identifier")).isTrue();
		assertThat(node.source()).isEqualTo("script");
		assertThat(node.begin().offset()).isEqualTo(4);
		assertThat(node.end().offset()).isEqualTo(5);
		assertThat(node.content()).isEqualTo("x");
	}

	@Test
	void startTwiceFails() {
		ParseInput input = new ParseInput("ab", "test");
		ParseTreeNode node = new ParseTreeNode();
		node.start("a", input);

		assertThatThrownBy(() -> node.start("a", input)).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void startAfterChildrenFails() {
		ParseInput input = new ParseInput("ab", "test");
		ParseTreeNode node = new ParseTreeNode();
		node.appendChild(finished("a", input, 1));

		assertThatThrownBy(() -> node.start("b", input)).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void successRequiresStartAndHappensOnce() {
		ParseInput input = new ParseInput("ab", "test");
		ParseTreeNode unstarted = new ParseTreeNode();

		assertThatThrownBy(() -> unstarted.success(input)).isInstanceOf(IllegalStateException.class);

		ParseTreeNode node = finished("a", input, 1);
		assertThatThrownBy(() -> node.success(input))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("already succeeded");
	}

	@Test
	void contentIsUnavailableBeforeSuccess() {
		ParseTreeNode node = new ParseTreeNode();
		node.start("a", new ParseInput("ab", "test"));

		assertThat(node.hasContent()).isFalse();
		assertThatThrownBy(node::content).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(node::asParseInput).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void removeContentKeepsBeginAndChildren() {
		ParseInput input = new ParseInput("abc", "test");
		ParseTreeNode parent = new ParseTreeNode();
		parent.start("word", input);
		parent.appendChild(finished("letter", input, 1));
		input.bump(2);
		parent.success(input);

		parent.removeContent();
		parent.removeContent();

		assertThat(parent.hasContent()).isFalse();
		assertThat(parent.begin().offset()).isZero();
		assertThat(parent.children()).hasSize(1);
		assertThatThrownBy(parent::end).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(parent::content).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void childHasSingleOwner() {
		ParseInput input = new ParseInput("ab", "test");
		ParseTreeNode child = finished("a", input, 1);
		ParseTreeNode first = new ParseTreeNode();
		ParseTreeNode second = new ParseTreeNode();
		first.appendChild(child);

		assertThatThrownBy(() -> second.appendChild(child)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> first.appendChild(first)).isInstanceOf(IllegalArgumentException.class);

		ParseTreeNode removed = first.removeChild(0);
		second.appendChild(removed);
		assertThat(first.children()).isEmpty();
		assertThat(second.children()).containsExactly(child);
	}

	@Test
	void ancestorCannotBeAppendedBelowDescendant() {
		ParseInput input = new ParseInput("ab", "test");
		ParseTreeNode root = new ParseTreeNode();
		ParseTreeNode child = finished("a", input, 1);
		ParseTreeNode grandchild = finished("b", input, 1);
		root.appendChild(child);
		child.appendChild(grandchild);

		assertThatThrownBy(() -> child.appendChild(root))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("below itself");
		assertThatThrownBy(() -> grandchild.appendChild(root)).isInstanceOf(IllegalArgumentException.class);
		assertThat(child.children()).containsExactly(grandchild);
		assertThat(grandchild.children()).isEmpty();
	}

	@Test
	void unstartedChildReportsMissingStart() {
		ParseTreeNode parent = new ParseTreeNode();
		ParseTreeNode child = new ParseTreeNode();
		parent.appendChild(child);

		assertThatThrownBy(child::begin)
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("not been started");
		assertThatThrownBy(parent::begin)
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Root node");
	}

	@Test
	void takeChildrenDrainsInOrder() {
		ParseInput input = new ParseInput("abc", "test");
		ParseTreeNode source = new ParseTreeNode();
		ParseTreeNode target = new ParseTreeNode();
		target.appendChild(finished("a", input, 1));
		source.appendChild(finished("b", input, 1));
		source.appendChild(finished("c", input, 1));

		source.spliceChildrenInto(target);

		assertThat(source.children()).isEmpty();
		assertThat(target.children()).extracting(ParseTreeNode::content).containsExactly("a", "b", "c");
	}

	@Test
	void childrenViewIsReadOnly() {
		ParseTreeNode node = new ParseTreeNode();

		assertThatThrownBy(() -> node.children().add(new ParseTreeNode()))
				.isInstanceOf(UnsupportedOperationException.class);
	}
}
