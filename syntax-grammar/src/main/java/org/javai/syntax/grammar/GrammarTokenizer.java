package org.javai.syntax.grammar;

import java.util.ArrayList;
import java.util.List;

import org.javai.syntax.grammar.GrammarToken.TokenType;

/**
 * Tokenizer for the grammar DSL.
 * <p>
 * Recognises identifiers, quoted literals ({@code '::'}, with {@code \'} and {@code \\} escapes),
 * the operators {@code = * ? | ( ) :} and {@code //} line comments.
 */
public class GrammarTokenizer {

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public GrammarTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens, ending with an EOF token
	 * @throws GrammarSyntaxException on an unknown character or unterminated literal
	 */
	public List<GrammarToken> tokenize() {
		List<GrammarToken> tokens = new ArrayList<>();
		while (true) {
			skipWhitespaceAndComments();
			if (isAtEnd()) {
				break;
			}
			tokens.add(nextToken());
		}
		tokens.add(new GrammarToken(TokenType.EOF, "", line, column));
		return tokens;
	}

	private GrammarToken nextToken() {
		int startLine = line;
		int startColumn = column;
		char c = peek();
		TokenType symbol = switch (c) {
			case '=' -> TokenType.EQ;
			case '*' -> TokenType.STAR;
			case '?' -> TokenType.QUESTION;
			case '|' -> TokenType.PIPE;
			case '(' -> TokenType.LPAREN;
			case ')' -> TokenType.RPAREN;
			case ':' -> TokenType.COLON;
			default -> null;
		};
		if (symbol != null) {
			advance();
			return new GrammarToken(symbol, String.valueOf(c), startLine, startColumn);
		}
		if (c == '\'') {
			return scanLiteral();
		}
		if (isIdentifierStart(c)) {
			return scanIdentifier();
		}
		throw new GrammarSyntaxException("Unexpected character '" + c + "'", startLine, startColumn);
	}

	private GrammarToken scanLiteral() {
		int startLine = line;
		int startColumn = column;
		advance(); // opening '
		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '\'' && peek() != '\n') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				sb.append(advance());
			} else {
				sb.append(c);
			}
		}
		if (isAtEnd() || peek() != '\'') {
			throw new GrammarSyntaxException("Unterminated literal", startLine, startColumn);
		}
		advance(); // closing '
		if (sb.isEmpty()) {
			throw new GrammarSyntaxException("Empty literal", startLine, startColumn);
		}
		return new GrammarToken(TokenType.LITERAL, sb.toString(), startLine, startColumn);
	}

	private GrammarToken scanIdentifier() {
		int startLine = line;
		int startColumn = column;
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		return new GrammarToken(TokenType.IDENT, input.substring(start, pos), startLine, startColumn);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
				advance();
			} else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || (c >= '0' && c <= '9');
	}
}
