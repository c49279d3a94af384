package org.javai.syntax.tree;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * An interior node of the concrete syntax tree.
 * <p>
 * A node is nothing more than a {@link NodeKind} and an ordered, immutable list of children.
 * It places no constraint on which children a node of a given kind may have: a parser that
 * recovers from an error can attach whatever it has to a node of the expected kind, and
 * the result is still a valid tree. Shape is interpreted lazily by the typed facade
 * ({@code org.javai.syntax.ast}), never enforced here.
 * <p>
 * Nodes are created only through {@link SyntaxFactory#buildNode}. Once built they never
 * change, so a tree can be read from any number of threads without coordination.
 * Equality is identity: two structurally identical nodes built separately are different
 * nodes.
 */
public final class SyntaxNode implements SyntaxElement {

	private final NodeKind kind;
	private final List<SyntaxElement> children;
	private final int textLength;

	SyntaxNode(NodeKind kind, List<? extends SyntaxElement> children) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.children = List.copyOf(children);
		int length = 0;
		for (SyntaxElement child : this.children) {
			length += child.textLength();
		}
		this.textLength = length;
	}

	public NodeKind kind() {
		return kind;
	}

	@Override
	public String kindName() {
		return kind.name();
	}

	/**
	 * The children in source order. The list is immutable, so it can be iterated any number of
	 * times and every iteration sees the same elements.
	 */
	public List<SyntaxElement> children() {
		return children;
	}

	/**
	 * The child nodes, skipping tokens. Restartable; each call to {@code iterator()} starts over.
	 */
	public Iterable<SyntaxNode> childNodes() {
		return () -> filtered(SyntaxNode.class);
	}

	/**
	 * The child tokens, skipping nodes. Restartable.
	 */
	public Iterable<SyntaxToken> childTokens() {
		return () -> filtered(SyntaxToken.class);
	}

	private <T extends SyntaxElement> Iterator<T> filtered(Class<T> type) {
		return children.stream().filter(type::isInstance).map(type::cast).iterator();
	}

	/**
	 * Returns the {@code n}-th (zero based) child node of the given kind.
	 */
	public Optional<SyntaxNode> nthChildOfKind(NodeKind childKind, int n) {
		Objects.requireNonNull(childKind, "childKind must not be null");
		return nthChildNode(childKind::equals, n);
	}

	/**
	 * Returns the {@code n}-th (zero based) child token of the given kind.
	 */
	public Optional<SyntaxToken> nthTokenOfKind(TokenKind tokenKind, int n) {
		Objects.requireNonNull(tokenKind, "tokenKind must not be null");
		return nthChildToken(tokenKind::equals, n);
	}

	/**
	 * Returns the {@code n}-th child node whose kind satisfies the predicate.
	 */
	public Optional<SyntaxNode> nthChildNode(Predicate<NodeKind> kindFilter, int n) {
		checkIndex(n);
		int seen = 0;
		for (SyntaxElement child : children) {
			if (child instanceof SyntaxNode node && kindFilter.test(node.kind)) {
				if (seen++ == n) {
					return Optional.of(node);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns the {@code n}-th child token whose kind satisfies the predicate.
	 */
	public Optional<SyntaxToken> nthChildToken(Predicate<TokenKind> kindFilter, int n) {
		checkIndex(n);
		int seen = 0;
		for (SyntaxElement child : children) {
			if (child instanceof SyntaxToken token && kindFilter.test(token.kind())) {
				if (seen++ == n) {
					return Optional.of(token);
				}
			}
		}
		return Optional.empty();
	}

	private static void checkIndex(int n) {
		if (n < 0) {
			throw new IndexOutOfBoundsException("Child index must not be negative: " + n);
		}
	}

	public Optional<SyntaxElement> firstChildOrToken() {
		return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
	}

	public Optional<SyntaxElement> lastChildOrToken() {
		return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
	}

	/**
	 * The first token in depth-first order, trivia included. Empty only for nodes that contain
	 * no tokens at all.
	 */
	public Optional<SyntaxToken> firstToken() {
		for (SyntaxElement child : children) {
			Optional<SyntaxToken> token = child instanceof SyntaxToken t ? Optional.of(t) : ((SyntaxNode) child).firstToken();
			if (token.isPresent()) {
				return token;
			}
		}
		return Optional.empty();
	}

	/**
	 * The last token in depth-first order, trivia included.
	 */
	public Optional<SyntaxToken> lastToken() {
		for (int i = children.size() - 1; i >= 0; i--) {
			SyntaxElement child = children.get(i);
			Optional<SyntaxToken> token = child instanceof SyntaxToken t ? Optional.of(t) : ((SyntaxNode) child).lastToken();
			if (token.isPresent()) {
				return token;
			}
		}
		return Optional.empty();
	}

	/**
	 * This node followed by all of its descendants, nodes and tokens, in pre-order.
	 */
	public Stream<SyntaxElement> descendants() {
		return Stream.concat(Stream.of(this), children.stream().flatMap(child ->
				child instanceof SyntaxNode node ? node.descendants() : Stream.of(child)));
	}

	/**
	 * This node followed by all descendant nodes in pre-order.
	 */
	public Stream<SyntaxNode> descendantNodes() {
		return descendants().filter(SyntaxNode.class::isInstance).map(SyntaxNode.class::cast);
	}

	/**
	 * All tokens of the subtree in source order.
	 */
	public List<SyntaxToken> tokens() {
		List<SyntaxToken> tokens = new ArrayList<>();
		collectTokens(tokens);
		return tokens;
	}

	private void collectTokens(List<SyntaxToken> out) {
		for (SyntaxElement child : children) {
			if (child instanceof SyntaxToken token) {
				out.add(token);
			} else {
				((SyntaxNode) child).collectTokens(out);
			}
		}
	}

	@Override
	public String text() {
		StringBuilder sb = new StringBuilder(textLength);
		for (SyntaxToken token : tokens()) {
			sb.append(token.text());
		}
		return sb.toString();
	}

	@Override
	public int textLength() {
		return textLength;
	}

	/**
	 * Renders the subtree one element per line with absolute offsets, e.g.
	 * <pre>
	 * FN@0..9
	 *   FN_KW@0..2 "fn"
	 * </pre>
	 */
	public String debugDump() {
		StringBuilder sb = new StringBuilder();
		dump(sb, 0, 0);
		return sb.toString();
	}

	private int dump(StringBuilder sb, int indent, int offset) {
		sb.append("  ".repeat(indent)).append(kind.name()).append('@')
				.append(offset).append("..").append(offset + textLength).append('\n');
		int childOffset = offset;
		for (SyntaxElement child : children) {
			if (child instanceof SyntaxNode node) {
				childOffset = node.dump(sb, indent + 1, childOffset);
			} else {
				SyntaxToken token = (SyntaxToken) child;
				sb.append("  ".repeat(indent + 1)).append(token.kind().name()).append('@')
						.append(childOffset).append("..").append(childOffset + token.textLength())
						.append(' ').append(SyntaxToken.quote(token.text())).append('\n');
				childOffset += token.textLength();
			}
		}
		return offset + textLength;
	}

	@Override
	public String toString() {
		return kind.name() + "@0.." + textLength;
	}
}
