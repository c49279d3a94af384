package org.javai.syntax.rust.search;

import java.util.Locale;
import java.util.Objects;

import org.javai.syntax.tree.SyntaxNode;

/**
 * A restriction on what a placeholder may bind to.
 */
public sealed interface Constraint {

	static Constraint kind(NodeCategory category) {
		return new Kind(category);
	}

	static Constraint not(Constraint constraint) {
		return new Not(constraint);
	}

	/**
	 * Whether {@code node} satisfies this constraint.
	 */
	default boolean test(SyntaxNode node) {
		if (this instanceof Kind kind) {
			return kind.category().includes(node.kind());
		}
		return !((Not) this).constraint().test(node);
	}

	/**
	 * The bound node must belong to {@code category}.
	 */
	record Kind(NodeCategory category) implements Constraint {

		public Kind {
			Objects.requireNonNull(category, "category must not be null");
		}

		@Override
		public String toString() {
			return "kind(" + category.name().toLowerCase(Locale.ROOT) + ")";
		}
	}

	/**
	 * The bound node must not satisfy {@code constraint}.
	 */
	record Not(Constraint constraint) implements Constraint {

		public Not {
			Objects.requireNonNull(constraint, "constraint must not be null");
		}

		@Override
		public String toString() {
			return "not(" + constraint + ")";
		}
	}
}
