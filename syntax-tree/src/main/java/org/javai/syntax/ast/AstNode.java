package org.javai.syntax.ast;

import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxNode;

/**
 * A typed view over one {@link SyntaxNode}.
 * <p>
 * Wrappers own no tree data. They hold a reference to the node and the guarantee, checked
 * once by {@link AstNodeType#cast}, that the node's kind is one the wrapper accepts. Every
 * accessor reads the underlying node on demand.
 */
public interface AstNode {

	/**
	 * The wrapped node (upcast). Never validates and never fails.
	 */
	SyntaxNode syntax();

	default NodeKind kind() {
		return syntax().kind();
	}

	default String text() {
		return syntax().text();
	}
}
