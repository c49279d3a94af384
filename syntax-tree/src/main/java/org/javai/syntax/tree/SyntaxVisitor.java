package org.javai.syntax.tree;

/**
 * Callbacks for {@link SyntaxWalker}. All methods default to doing nothing, so a visitor
 * only overrides what it needs.
 */
public interface SyntaxVisitor {

	/**
	 * Called before the node's children are visited.
	 *
	 * @return {@code false} to skip the node's children; {@link #leaveNode} is still called
	 */
	default boolean enterNode(SyntaxNode node) {
		return true;
	}

	/**
	 * Called after the node's children are visited.
	 */
	default void leaveNode(SyntaxNode node) {
	}

	default void visitToken(SyntaxToken token) {
	}
}
