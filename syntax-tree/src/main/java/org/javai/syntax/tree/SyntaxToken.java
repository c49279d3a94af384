package org.javai.syntax.tree;

import java.util.Objects;

/**
 * A leaf of the syntax tree.
 *
 * @param kind the terminal category
 * @param text the exact source text of the token
 */
public record SyntaxToken(TokenKind kind, String text) implements SyntaxElement {

	public SyntaxToken {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}

	@Override
	public int textLength() {
		return text.length();
	}

	@Override
	public String kindName() {
		return kind.name();
	}

	@Override
	public String toString() {
		return kind.name() + " " + quote(text);
	}

	static String quote(String text) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
