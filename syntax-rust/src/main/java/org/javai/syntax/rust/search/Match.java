package org.javai.syntax.rust.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.javai.syntax.tree.SyntaxCursor;
import org.javai.syntax.tree.SyntaxToken;
import org.javai.syntax.tree.TextRange;

/**
 * A place in the code where a {@link SearchRule} matched.
 *
 * @param range range of the matched node
 * @param matchedNode the matched code node
 * @param placeholderValues bindings keyed by placeholder name
 * @param ignoredComments comments in the code that the pattern had no counterpart for
 * @param ruleIndex index of the rule that matched
 * @param depth number of ancestors of the matched node
 */
public record Match(TextRange range, SyntaxCursor matchedNode, Map<String, PlaceholderMatch> placeholderValues,
					List<SyntaxToken> ignoredComments, int ruleIndex, int depth) {

	public Match {
		Objects.requireNonNull(range, "range must not be null");
		Objects.requireNonNull(matchedNode, "matchedNode must not be null");
		placeholderValues = placeholderValues != null ? Map.copyOf(placeholderValues) : Map.of();
		ignoredComments = ignoredComments != null ? List.copyOf(ignoredComments) : List.of();
	}

	public Optional<PlaceholderMatch> placeholder(String name) {
		return Optional.ofNullable(placeholderValues.get(name));
	}

	Match withPlaceholderValues(Map<String, PlaceholderMatch> values) {
		return new Match(range, matchedNode, values, ignoredComments, ruleIndex, depth);
	}

	/**
	 * This match followed by all matches nested in its placeholders, depth first.
	 */
	public List<Match> flatten() {
		List<Match> all = new ArrayList<>();
		all.add(this);
		placeholderValues.values().forEach(p -> p.innerMatches().forEach(inner -> all.addAll(inner.flatten())));
		return all;
	}
}
