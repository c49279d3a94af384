package org.javai.syntax.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxElement;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.javai.syntax.tree.TokenKind;

/**
 * Locates a single-valued field by the token that separates it from a neighbouring field of
 * overlapping kind, as {@code 'for'} separates {@code trait} from {@code self_ty} in
 * {@code ('!'? trait:Type 'for')? self_ty:Type}. An absent neighbour then does not shift the field.
 *
 * @param tokens the separator's kinds; the first child token of one of them is the anchor
 * @param side which side of the anchor the field lies on
 * @param index the field is the {@code index}-th matching child on that side
 * @param fallback which matching child to take, counting from the first, when the node has no
 *        anchor token; negative if the field cannot be present without it
 */
public record ChildAnchor(Set<TokenKind> tokens, Side side, int index, int fallback) {

	public enum Side {
		before,
		after
	}

	public ChildAnchor {
		tokens = Collections.unmodifiableSet(new LinkedHashSet<>(tokens));
		Objects.requireNonNull(side, "side must not be null");
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("an anchor needs at least one token kind");
		}
		if (index < 0) {
			throw new IllegalArgumentException("index must not be negative: " + index);
		}
	}

	public static ChildAnchor before(Set<TokenKind> tokens, int index, int fallback) {
		return new ChildAnchor(tokens, Side.before, index, fallback);
	}

	public static ChildAnchor after(Set<TokenKind> tokens, int index, int fallback) {
		return new ChildAnchor(tokens, Side.after, index, fallback);
	}

	/**
	 * Whether a node without the anchor token never has this field.
	 */
	public boolean requiresAnchor() {
		return fallback < 0;
	}

	/**
	 * The child node of {@code parent} this anchor designates among those {@code kindFilter} accepts.
	 */
	public Optional<SyntaxNode> locate(SyntaxNode parent, Predicate<NodeKind> kindFilter) {
		Objects.requireNonNull(parent, "parent must not be null");
		List<SyntaxElement> children = parent.children();
		int anchor = -1;
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) instanceof SyntaxToken token && tokens.contains(token.kind())) {
				anchor = i;
				break;
			}
		}
		if (anchor < 0) {
			return requiresAnchor() ? Optional.empty() : parent.nthChildNode(kindFilter, fallback);
		}
		int from = side == Side.before ? 0 : anchor + 1;
		int to = side == Side.before ? anchor : children.size();
		int seen = 0;
		for (int i = from; i < to; i++) {
			if (children.get(i) instanceof SyntaxNode node && kindFilter.test(node.kind()) && seen++ == index) {
				return Optional.of(node);
			}
		}
		return Optional.empty();
	}
}
