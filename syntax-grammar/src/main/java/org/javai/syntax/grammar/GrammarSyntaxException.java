package org.javai.syntax.grammar;

/**
 * Exception thrown when grammar text is malformed.
 */
public class GrammarSyntaxException extends GrammarException {

	private final int line;
	private final int column;

	public GrammarSyntaxException(String message, int line, int column) {
		super(message + " at line " + line + ", column " + column);
		this.line = line;
		this.column = column;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
