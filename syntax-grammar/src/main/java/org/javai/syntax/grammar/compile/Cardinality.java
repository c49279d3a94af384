package org.javai.syntax.grammar.compile;

/**
 * How often a field may occur in a node.
 */
public enum Cardinality {
	one,
	optional,
	many;

	/**
	 * The more permissive of two cardinalities.
	 */
	public Cardinality max(Cardinality other) {
		return compareTo(other) >= 0 ? this : other;
	}

	/**
	 * Cardinality of a field reached through an option.
	 */
	public Cardinality optionally() {
		return this == one ? optional : this;
	}
}
