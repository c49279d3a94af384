package org.javai.syntax.rust.search;

import org.javai.syntax.rust.ast.Literal;
import org.javai.syntax.tree.NodeKind;

/**
 * Categories of code node a placeholder can be restricted to.
 */
public enum NodeCategory {

	LITERAL {
		@Override
		public boolean includes(NodeKind kind) {
			return Literal.TYPE.canCast(kind);
		}
	};

	public abstract boolean includes(NodeKind kind);
}
