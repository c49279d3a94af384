package org.javai.syntax.rust.search;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;

/**
 * A pattern to search for, with its placeholders.
 *
 * @param pattern the pattern tree, built from the same kinds as the code it is matched against
 * @param placeholders placeholders keyed by the identifier text standing for them
 * @param index position of the rule among the rules of one search; when two rules match the
 * same node the lower index wins
 */
public record SearchRule(SyntaxNode pattern, Map<String, Placeholder> placeholders, int index) {

	public SearchRule {
		Objects.requireNonNull(pattern, "pattern must not be null");
		placeholders = placeholders != null ? Map.copyOf(placeholders) : Map.of();
		if (index < 0) {
			throw new IllegalArgumentException("Rule index must not be negative: " + index);
		}
	}

	public static SearchRule of(int index, SyntaxNode pattern, Placeholder... placeholders) {
		Map<String, Placeholder> byIdent = new LinkedHashMap<>();
		for (Placeholder placeholder : placeholders) {
			if (byIdent.put(placeholder.ident(), placeholder) != null) {
				throw new IllegalArgumentException("Duplicate placeholder: " + placeholder.ident());
			}
		}
		return new SearchRule(pattern, byIdent, index);
	}

	/**
	 * The placeholder an identifier token of the pattern stands for, if any.
	 */
	public Optional<Placeholder> placeholder(SyntaxToken ident) {
		return Optional.ofNullable(placeholders.get(ident.text()));
	}

	public Collection<Placeholder> allPlaceholders() {
		return placeholders.values();
	}
}
