package org.javai.syntax.grammar;

import java.util.Objects;

/**
 * One grammar production: {@code Name = Rule}.
 */
public record Definition(String name, Rule rule) {

	public Definition {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(rule, "rule must not be null");
	}

	@Override
	public String toString() {
		return name + " =\n  " + rule;
	}
}
