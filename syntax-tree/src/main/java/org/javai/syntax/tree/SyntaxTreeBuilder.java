package org.javai.syntax.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Event-style front end to {@link SyntaxFactory} for parsers that emit
 * start-node / token / finish-node events.
 * <p>
 * Example:
 * <pre>
 * SyntaxTreeBuilder builder = new SyntaxTreeBuilder();
 * builder.startNode(RustKinds.SOURCE_FILE);
 * builder.startNode(RustKinds.FN);
 * builder.token(RustKinds.FN_KW, "fn");
 * ...
 * builder.finishNode();
 * builder.finishNode();
 * SyntaxNode root = builder.finish();
 * </pre>
 * A {@link #checkpoint()} lets a Pratt parser wrap already emitted children in a node
 * started later, e.g. the left operand of a binary expression.
 * <p>
 * The builder is single-owner and not thread safe. The tree it returns is immutable and may
 * be handed to any number of readers.
 */
public final class SyntaxTreeBuilder {

	private final Deque<PendingNode> stack = new ArrayDeque<>();
	private final List<SyntaxElement> roots = new ArrayList<>();

	/**
	 * Position in the children of the currently open node.
	 */
	public record Checkpoint(int depth, int childIndex) {
	}

	public SyntaxTreeBuilder startNode(NodeKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		stack.push(new PendingNode(kind, new ArrayList<>()));
		return this;
	}

	public SyntaxTreeBuilder token(TokenKind kind, String text) {
		current().add(SyntaxFactory.buildToken(kind, text));
		return this;
	}

	public SyntaxTreeBuilder token(TokenKind kind) {
		current().add(SyntaxFactory.buildToken(kind));
		return this;
	}

	/**
	 * Attaches an already built subtree as the next child.
	 */
	public SyntaxTreeBuilder element(SyntaxElement element) {
		current().add(Objects.requireNonNull(element, "element must not be null"));
		return this;
	}

	public SyntaxTreeBuilder finishNode() {
		if (stack.isEmpty()) {
			throw new IllegalStateException("finishNode() without a matching startNode()");
		}
		PendingNode pending = stack.pop();
		current().add(SyntaxFactory.buildNode(pending.kind(), pending.children()));
		return this;
	}

	public Checkpoint checkpoint() {
		return new Checkpoint(stack.size(), current().size());
	}

	/**
	 * Opens a node that adopts every child emitted since the checkpoint.
	 */
	public SyntaxTreeBuilder startNodeAt(Checkpoint checkpoint, NodeKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		if (checkpoint.depth() != stack.size()) {
			throw new IllegalStateException("Checkpoint was taken at depth " + checkpoint.depth()
					+ " but the builder is at depth " + stack.size());
		}
		List<SyntaxElement> siblings = current();
		if (checkpoint.childIndex() > siblings.size()) {
			throw new IllegalStateException("Checkpoint is past the end of the current node");
		}
		List<SyntaxElement> adopted = new ArrayList<>(siblings.subList(checkpoint.childIndex(), siblings.size()));
		siblings.subList(checkpoint.childIndex(), siblings.size()).clear();
		stack.push(new PendingNode(kind, adopted));
		return this;
	}

	/**
	 * Returns the single completed root.
	 *
	 * @throws IllegalStateException if nodes are still open or there is not exactly one root
	 */
	public SyntaxNode finish() {
		if (!stack.isEmpty()) {
			throw new IllegalStateException(stack.size() + " node(s) still open, innermost " + stack.peek().kind());
		}
		if (roots.size() != 1 || !(roots.get(0) instanceof SyntaxNode root)) {
			throw new IllegalStateException("Expected exactly one root node but found " + roots);
		}
		return root;
	}

	private List<SyntaxElement> current() {
		return stack.isEmpty() ? roots : stack.peek().children();
	}

	private record PendingNode(NodeKind kind, List<SyntaxElement> children) {
	}
}
