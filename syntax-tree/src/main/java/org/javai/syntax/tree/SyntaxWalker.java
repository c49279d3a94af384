package org.javai.syntax.tree;

import java.util.List;

/**
 * Depth-first traversal of syntax trees with a {@link SyntaxVisitor}.
 */
public final class SyntaxWalker {

	private SyntaxWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks the tree in source order: enter a node, visit its children, leave the node.
	 *
	 * @param root the root node to start traversal from
	 * @param visitor the visitor to notify
	 */
	public static void walk(SyntaxNode root, SyntaxVisitor visitor) {
		if (root == null) {
			return;
		}
		if (visitor.enterNode(root)) {
			for (SyntaxElement child : root.children()) {
				if (child instanceof SyntaxNode node) {
					walk(node, visitor);
				} else {
					visitor.visitToken((SyntaxToken) child);
				}
			}
		}
		visitor.leaveNode(root);
	}

	/**
	 * Walks several trees in order, e.g. the items of a file parsed piecewise.
	 */
	public static void walkAll(List<SyntaxNode> roots, SyntaxVisitor visitor) {
		if (roots == null) {
			return;
		}
		for (SyntaxNode root : roots) {
			walk(root, visitor);
		}
	}
}
