package org.javai.syntax.grammar.compile;

/**
 * Whether a definition is struct-like or a tagged union of other definitions.
 */
public enum DefinitionCategory {
	/**
	 * Fixed list of named fields.
	 */
	product,
	/**
	 * One of several definitions that share a grammatical position.
	 */
	sum
}
