package org.javai.syntax.tree;

import java.util.Objects;

/**
 * Tag identifying the syntactic category of a {@link SyntaxNode}.
 * <p>
 * Node kinds and {@link TokenKind token kinds} are disjoint: they are distinct types, so a
 * node kind can never be confused with a token kind even when their ids coincide.
 *
 * @param id stable numeric id, assigned in definition order by the grammar compiler
 * @param name constant-style name, e.g. {@code FN} or {@code RECORD_EXPR}
 */
public record NodeKind(int id, String name) {

	public NodeKind {
		Objects.requireNonNull(name, "name must not be null");
		if (id < 0) {
			throw new IllegalArgumentException("Node kind id must not be negative: " + id);
		}
	}

	@Override
	public String toString() {
		return name;
	}
}
