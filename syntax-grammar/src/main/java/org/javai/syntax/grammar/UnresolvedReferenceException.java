package org.javai.syntax.grammar;

/**
 * A rule refers to a definition or token that does not exist.
 */
public class UnresolvedReferenceException extends GrammarException {

	private final String definition;
	private final String reference;

	public UnresolvedReferenceException(String definition, String reference, String detail) {
		super("Unresolved reference '" + reference + "' in definition " + definition + ": " + detail);
		this.definition = definition;
		this.reference = reference;
	}

	public String definition() {
		return definition;
	}

	public String reference() {
		return reference;
	}
}
