package org.javai.syntax.grammar;

/**
 * A field can be reached with conflicting cardinalities, or a repetition or option is nested
 * directly inside another one.
 */
public class AmbiguousCardinalityException extends GrammarException {

	public AmbiguousCardinalityException(String message) {
		super(message);
	}
}
