package org.javai.syntax.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * Tag identifying the terminal category of a {@link SyntaxToken}.
 *
 * @param id stable numeric id, assigned by the grammar compiler
 * @param name constant-style name, e.g. {@code IDENT}, {@code FN_KW} or {@code L_PAREN}
 * @param fixedText the only text a token of this kind can have, or {@code null} for open
 * categories such as identifiers and literals
 * @param trivia whether tokens of this kind carry no syntax (whitespace, comments)
 */
public record TokenKind(int id, String name, String fixedText, boolean trivia) {

	public TokenKind {
		Objects.requireNonNull(name, "name must not be null");
		if (id < 0) {
			throw new IllegalArgumentException("Token kind id must not be negative: " + id);
		}
	}

	/**
	 * The fixed text of keyword and punctuation kinds.
	 */
	public Optional<String> text() {
		return Optional.ofNullable(fixedText);
	}

	@Override
	public String toString() {
		return name;
	}
}
