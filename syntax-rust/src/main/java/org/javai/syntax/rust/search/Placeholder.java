package org.javai.syntax.rust.search;

import java.util.List;
import java.util.Objects;

/**
 * A named hole in a search pattern.
 * <p>
 * In the pattern tree a placeholder is written as an identifier whose text is {@link #ident()}.
 * Any pattern element that consists of nothing but that identifier, such as a path expression
 * {@code __placeholder_a}, stands for the placeholder and binds to whatever code node sits at the
 * same place.
 *
 * @param name the name used to look the binding up in a {@link Match}
 * @param ident the identifier text standing for the placeholder in the pattern
 * @param constraints restrictions the bound node has to satisfy, all of them
 */
public record Placeholder(String name, String ident, List<Constraint> constraints) {

	private static final String IDENT_PREFIX = "__placeholder_";

	public Placeholder {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(ident, "ident must not be null");
		if (name.isBlank()) {
			throw new IllegalArgumentException("Placeholder name must not be blank");
		}
		constraints = constraints != null ? List.copyOf(constraints) : List.of();
	}

	/**
	 * A placeholder written as {@code __placeholder_<name>} in the pattern.
	 */
	public static Placeholder of(String name, Constraint... constraints) {
		Objects.requireNonNull(name, "name must not be null");
		return new Placeholder(name, IDENT_PREFIX + name, List.of(constraints));
	}

	@Override
	public String toString() {
		return constraints.isEmpty() ? "$" + name : "${" + name + ":" + constraints + "}";
	}
}
