package org.javai.syntax.grammar;

/**
 * A token of the grammar DSL.
 *
 * @param type the token type
 * @param value identifier name or unescaped literal text; the symbol itself otherwise
 * @param line 1-based line
 * @param column 1-based column
 */
public record GrammarToken(TokenType type, String value, int line, int column) {

	public enum TokenType {
		IDENT,    // Name, label, primitive
		LITERAL,  // 'text'
		EQ,       // =
		STAR,     // *
		QUESTION, // ?
		PIPE,     // |
		LPAREN,   // (
		RPAREN,   // )
		COLON,    // :
		EOF
	}

	public boolean isType(TokenType expectedType) {
		return type == expectedType;
	}

	@Override
	public String toString() {
		return switch (type) {
			case IDENT -> "IDENT(" + value + ")";
			case LITERAL -> "LITERAL('" + value + "')";
			default -> type.toString();
		};
	}
}
