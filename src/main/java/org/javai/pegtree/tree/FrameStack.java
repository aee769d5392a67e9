package org.javai.pegtree.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The nodes under construction, one frame per rule attempt in progress.
 *
 * The bottom frame is the root of the tree being built. The top frame is where
 * the next finished node is attached.
 */
public final class FrameStack {

	private final Supplier<? extends ParseTreeNode> nodeFactory;
	private List<ParseTreeNode> frames = new ArrayList<>();

	/**
	 * Creates a stack holding a single root frame.
	 */
	public FrameStack(Supplier<? extends ParseTreeNode> nodeFactory) {
		this.nodeFactory = Objects.requireNonNull(nodeFactory, "nodeFactory must not be null");
		push();
	}

	/**
	 * Pushes a new, unstarted frame.
	 */
	public void push() {
		ParseTreeNode node = nodeFactory.get();
		if (node == null) {
			throw new IllegalStateException("Node factory returned null");
		}
		frames.add(node);
	}

	/**
	 * Removes the top frame and hands it to the caller.
	 *
	 * @throws IllegalStateException if the stack is empty
	 */
	public ParseTreeNode pop() {
		if (frames.isEmpty()) {
			throw new IllegalStateException("Frame stack is empty");
		}
		return frames.remove(frames.size() - 1);
	}

	/**
	 * @throws IllegalStateException if the stack is empty
	 */
	public ParseTreeNode top() {
		if (frames.isEmpty()) {
			throw new IllegalStateException("Frame stack is empty");
		}
		return frames.get(frames.size() - 1);
	}

	public int depth() {
		return frames.size();
	}

	/**
	 * Replaces the live frames with a fresh stack holding one placeholder frame.
	 * The live frames come back when the returned scope is closed, whatever
	 * happened in between, so use it in a try-with-resources block.
	 */
	public Isolation isolate() {
		Isolation isolation = new Isolation(frames);
		frames = new ArrayList<>();
		push();
		return isolation;
	}

	/**
	 * An isolated region of the stack, see {@link #isolate()}.
	 */
	public final class Isolation implements AutoCloseable {

		private final List<ParseTreeNode> saved;
		private List<ParseTreeNode> isolated;

		private Isolation(List<ParseTreeNode> saved) {
			this.saved = saved;
		}

		/**
		 * Restores the frames that were live before isolation. Idempotent.
		 */
		@Override
		public void close() {
			if (isolated == null) {
				isolated = frames;
				frames = saved;
			}
		}

		/**
		 * The placeholder frame the isolated stack was created with.
		 *
		 * @throws IllegalStateException if the scope is still open
		 */
		public ParseTreeNode frame() {
			return closedFrames().get(0);
		}

		/**
		 * Number of frames the isolated stack held when the scope was closed.
		 */
		public int depth() {
			return closedFrames().size();
		}

		private List<ParseTreeNode> closedFrames() {
			if (isolated == null) {
				throw new IllegalStateException("Isolation scope is still open");
			}
			return isolated;
		}
	}
}
