package org.javai.pegtree.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FrameStackTest {

	@Test
	void startsWithRootFrame() {
		FrameStack stack = new FrameStack(ParseTreeNode::new);

		assertThat(stack.depth()).isEqualTo(1);
		assertThat(stack.top().isRoot()).isTrue();
	}

	@Test
	void popReturnsTopFrame() {
		FrameStack stack = new FrameStack(ParseTreeNode::new);
		ParseTreeNode root = stack.top();
		stack.push();
		ParseTreeNode pushed = stack.top();

		assertThat(stack.pop()).isSameAs(pushed);
		assertThat(stack.top()).isSameAs(root);
	}

	@Test
	void popOnEmptyStackFails() {
		FrameStack stack = new FrameStack(ParseTreeNode::new);
		stack.pop();

		assertThatThrownBy(stack::pop)
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("empty");
		assertThatThrownBy(stack::top).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void factoryMustCreateNodes() {
		assertThatThrownBy(() -> new FrameStack(() -> null)).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void isolationInstallsFreshStackAndRestoresOnClose() {
		FrameStack stack = new FrameStack(ParseTreeNode::new);
		ParseTreeNode root = stack.top();
		stack.push();

		FrameStack.Isolation isolation = stack.isolate();
		ParseTreeNode placeholder = stack.top();
		assertThat(stack.depth()).isEqualTo(1);
		assertThat(placeholder).isNotSameAs(root);
		stack.push();
		isolation.close();

		assertThat(stack.depth()).isEqualTo(2);
		assertThat(isolation.depth()).isEqualTo(2);
		assertThat(isolation.frame()).isSameAs(placeholder);
		stack.pop();
		assertThat(stack.top()).isSameAs(root);
	}

	@Test
	void isolationRestoresWhenSubParseThrows() {
		FrameStack stack = new FrameStack(ParseTreeNode::new);
		ParseTreeNode root = stack.top();

		assertThatThrownBy(() -> {
			try (FrameStack.Isolation isolation = stack.isolate()) {
				stack.push();
				stack.push();
				throw new IllegalArgumentException("abort");
			}
		}).hasMessage("abort");

		assertThat(stack.depth()).isEqualTo(1);
		assertThat(stack.top()).isSameAs(root);
	}

	@Test
	void isolatedFrameIsUnavailableWhileOpen() {
		FrameStack stack = new FrameStack(ParseTreeNode::new);

		try (FrameStack.Isolation isolation = stack.isolate()) {
			assertThatThrownBy(isolation::frame)
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("still open");
		}
	}
}
