package org.javai.syntax.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.javai.syntax.tree.TokenKind;

/**
 * Lookups used by generated wrapper accessors.
 * <p>
 * Fields are found by kind, not by fixed child index, so children interleaved by error
 * recovery do not shift them. {@code position} selects the n-th matching child and is
 * non-zero only where several single-valued fields of one wrapper share a target kind. Where
 * a token separates such fields, a {@link ChildAnchor} locates them instead.
 */
public final class AstSupport {

	private AstSupport() {
	}

	public static <W extends AstNode> Optional<W> child(SyntaxNode parent, AstNodeType<W> type, int position) {
		Objects.requireNonNull(type, "type must not be null");
		return parent.nthChildNode(type::canCast, position).map(type::wrap);
	}

	/**
	 * The {@code position}-th child whose kind is in {@code slot}, if {@code type} accepts it.
	 * Used when earlier fields claim a wider set of kinds than this one, as in
	 * {@code 'if' condition:Expr then_branch:BlockExpr}.
	 */
	public static <W extends AstNode> Optional<W> child(SyntaxNode parent, AstNodeType<W> type, Set<NodeKind> slot,
			int position) {
		Objects.requireNonNull(type, "type must not be null");
		return parent.nthChildNode(slot::contains, position).flatMap(type::cast);
	}

	/**
	 * The child with a kind in {@code slot} that {@code anchor} designates, if {@code type} accepts it.
	 * Used where a separator token tells neighbouring fields apart, as in
	 * {@code start:Expr? op:('..' | '..=') end:Expr?}.
	 */
	public static <W extends AstNode> Optional<W> child(SyntaxNode parent, AstNodeType<W> type, Set<NodeKind> slot,
			ChildAnchor anchor) {
		Objects.requireNonNull(type, "type must not be null");
		return anchor.locate(parent, slot::contains).flatMap(type::cast);
	}

	public static <W extends AstNode> AstChildren<W> children(SyntaxNode parent, AstNodeType<W> type) {
		return new AstChildren<>(Objects.requireNonNull(parent, "parent must not be null"),
				Objects.requireNonNull(type, "type must not be null"));
	}

	public static Optional<SyntaxToken> token(SyntaxNode parent, TokenKind kind, int position) {
		return parent.nthTokenOfKind(kind, position);
	}

	public static Optional<SyntaxToken> token(SyntaxNode parent, Set<TokenKind> kinds, int position) {
		return parent.nthChildToken(kinds::contains, position);
	}

	public static List<SyntaxToken> tokens(SyntaxNode parent, TokenKind kind) {
		return tokens(parent, Set.of(kind));
	}

	public static List<SyntaxToken> tokens(SyntaxNode parent, Set<TokenKind> kinds) {
		return parent.children().stream()
				.filter(child -> child instanceof SyntaxToken token && kinds.contains(token.kind()))
				.map(SyntaxToken.class::cast)
				.toList();
	}
}
