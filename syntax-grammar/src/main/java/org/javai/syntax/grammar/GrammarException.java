package org.javai.syntax.grammar;

/**
 * A defect in a grammar, detected while reading or compiling it.
 * <p>
 * Grammar defects are fatal: no facade can be generated from a grammar that raised one.
 */
public class GrammarException extends RuntimeException {

	public GrammarException(String message) {
		super(message);
	}

	public GrammarException(String message, Throwable cause) {
		super(message, cause);
	}
}
