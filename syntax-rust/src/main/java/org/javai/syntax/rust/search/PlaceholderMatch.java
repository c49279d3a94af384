package org.javai.syntax.rust.search;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.javai.syntax.tree.SyntaxCursor;
import org.javai.syntax.tree.TextRange;

/**
 * What a placeholder bound to in a match.
 *
 * @param node the bound code node; empty when the placeholder matched a run of tokens inside a
 * token tree
 * @param range the range of the bound code
 * @param innerMatches further matches found inside the bound code
 */
public record PlaceholderMatch(Optional<SyntaxCursor> node, TextRange range, List<Match> innerMatches) {

	public PlaceholderMatch {
		Objects.requireNonNull(node, "node must not be null");
		Objects.requireNonNull(range, "range must not be null");
		innerMatches = innerMatches != null ? List.copyOf(innerMatches) : List.of();
	}

	static PlaceholderMatch ofNode(SyntaxCursor node) {
		return new PlaceholderMatch(Optional.of(node), node.range(), List.of());
	}

	static PlaceholderMatch ofRange(TextRange range) {
		return new PlaceholderMatch(Optional.empty(), range, List.of());
	}

	PlaceholderMatch withInnerMatches(List<Match> matches) {
		return new PlaceholderMatch(node, range, matches);
	}

	/**
	 * The bound text, read from the code node or, for token runs, from {@code source}.
	 */
	public String text(CharSequence source) {
		return node.map(SyntaxCursor::text).orElseGet(() -> range.slice(source));
	}
}
