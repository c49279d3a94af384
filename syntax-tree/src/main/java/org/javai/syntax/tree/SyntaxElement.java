package org.javai.syntax.tree;

import java.util.Optional;

/**
 * A child of a {@link SyntaxNode}: either another node or a token.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

	/**
	 * The source text covered by this element, reconstructed from its tokens.
	 */
	String text();

	/**
	 * Length of {@link #text()} without materializing it.
	 */
	int textLength();

	/**
	 * Name of the element's kind, for diagnostics.
	 */
	String kindName();

	default Optional<SyntaxNode> asNode() {
		return this instanceof SyntaxNode node ? Optional.of(node) : Optional.empty();
	}

	default Optional<SyntaxToken> asToken() {
		return this instanceof SyntaxToken token ? Optional.of(token) : Optional.empty();
	}

	/**
	 * True for whitespace and comment tokens.
	 */
	default boolean isTrivia() {
		return this instanceof SyntaxToken token && token.kind().trivia();
	}
}
