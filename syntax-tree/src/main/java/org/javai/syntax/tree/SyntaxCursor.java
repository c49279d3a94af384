package org.javai.syntax.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A positioned view of one element of a tree: the element, its parent cursor and its
 * absolute offset from the root.
 * <p>
 * {@link SyntaxNode}s know neither their parent nor their position, which keeps them
 * shareable between trees. Cursors add both on demand, when a consumer needs ranges or
 * ancestors. Creating a cursor is cheap and cursors are immutable.
 */
public final class SyntaxCursor {

	private final SyntaxElement element;
	private final SyntaxCursor parent;
	private final int offset;
	private final int indexInParent;

	private SyntaxCursor(SyntaxElement element, SyntaxCursor parent, int offset, int indexInParent) {
		this.element = element;
		this.parent = parent;
		this.offset = offset;
		this.indexInParent = indexInParent;
	}

	/**
	 * A cursor on the root of a tree, at offset zero.
	 */
	public static SyntaxCursor root(SyntaxNode root) {
		return new SyntaxCursor(Objects.requireNonNull(root, "root must not be null"), null, 0, 0);
	}

	public SyntaxElement element() {
		return element;
	}

	public Optional<SyntaxNode> node() {
		return element.asNode();
	}

	public Optional<SyntaxToken> token() {
		return element.asToken();
	}

	public boolean isNode() {
		return element instanceof SyntaxNode;
	}

	public boolean isToken() {
		return element instanceof SyntaxToken;
	}

	public Optional<NodeKind> nodeKind() {
		return element instanceof SyntaxNode node ? Optional.of(node.kind()) : Optional.empty();
	}

	public Optional<TokenKind> tokenKind() {
		return element instanceof SyntaxToken token ? Optional.of(token.kind()) : Optional.empty();
	}

	public int offset() {
		return offset;
	}

	public TextRange range() {
		return TextRange.of(offset, element.textLength());
	}

	public String text() {
		return element.text();
	}

	public Optional<SyntaxCursor> parent() {
		return Optional.ofNullable(parent);
	}

	/**
	 * Index of this element among its parent's children, zero for the root.
	 */
	public int indexInParent() {
		return indexInParent;
	}

	/**
	 * Cursors on the children, with their absolute offsets.
	 */
	public List<SyntaxCursor> children() {
		if (!(element instanceof SyntaxNode node)) {
			return List.of();
		}
		List<SyntaxCursor> children = new ArrayList<>(node.children().size());
		int childOffset = offset;
		int index = 0;
		for (SyntaxElement child : node.children()) {
			children.add(new SyntaxCursor(child, this, childOffset, index++));
			childOffset += child.textLength();
		}
		return children;
	}

	/**
	 * Cursors on the child nodes only.
	 */
	public List<SyntaxCursor> childNodes() {
		return children().stream().filter(SyntaxCursor::isNode).toList();
	}

	/**
	 * Parent, grandparent and so on up to the root. Does not include this cursor.
	 */
	public Stream<SyntaxCursor> ancestors() {
		return Stream.iterate(parent, p -> p != null, SyntaxCursor::parentOrNull);
	}

	private SyntaxCursor parentOrNull() {
		return parent;
	}

	/**
	 * This cursor followed by all descendants, nodes and tokens, in pre-order.
	 */
	public Stream<SyntaxCursor> descendants() {
		return Stream.concat(Stream.of(this), children().stream().flatMap(SyntaxCursor::descendants));
	}

	/**
	 * Number of ancestors; zero for the root.
	 */
	public int depth() {
		return (int) ancestors().count();
	}

	/**
	 * The smallest node cursor in this subtree whose range covers the given range.
	 */
	public Optional<SyntaxCursor> coveringNode(TextRange range) {
		if (!isNode() || !range().contains(range)) {
			return Optional.empty();
		}
		for (SyntaxCursor child : childNodes()) {
			Optional<SyntaxCursor> inner = child.coveringNode(range);
			if (inner.isPresent()) {
				return inner;
			}
		}
		return Optional.of(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SyntaxCursor other)) {
			return false;
		}
		return element == other.element && offset == other.offset && indexInParent == other.indexInParent
				&& Objects.equals(parent, other.parent);
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(element) + offset;
	}

	@Override
	public String toString() {
		return element.kindName() + "@" + range();
	}
}
