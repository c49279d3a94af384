package org.javai.syntax.tree;

import java.util.List;
import java.util.Objects;

/**
 * The only write path into the syntax tree, used by the external lexer and parser.
 * <p>
 * Neither operation validates shape: any kind may be combined with any children, including
 * none at all. Malformed input is therefore always representable.
 */
public final class SyntaxFactory {

	private SyntaxFactory() {
	}

	/**
	 * Builds an immutable node from already built children. The children list is copied, so
	 * later changes to the caller's list are not observed.
	 *
	 * @throws NullPointerException if the kind, the list or any child is null
	 */
	public static SyntaxNode buildNode(NodeKind kind, List<? extends SyntaxElement> children) {
		Objects.requireNonNull(children, "children must not be null");
		return new SyntaxNode(kind, children);
	}

	public static SyntaxNode buildNode(NodeKind kind, SyntaxElement... children) {
		return buildNode(kind, List.of(children));
	}

	public static SyntaxToken buildToken(TokenKind kind, String text) {
		return new SyntaxToken(kind, text);
	}

	/**
	 * Builds a token of a keyword or punctuation kind using its fixed text.
	 *
	 * @throws IllegalArgumentException if the kind has no fixed text
	 */
	public static SyntaxToken buildToken(TokenKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		String text = kind.text()
				.orElseThrow(() -> new IllegalArgumentException("Token kind " + kind.name() + " has no fixed text"));
		return new SyntaxToken(kind, text);
	}
}
