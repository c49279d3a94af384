package org.javai.syntax.rust.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.javai.syntax.tree.SyntaxCursor;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches a whole tree for the patterns of one or more rules.
 * <p>
 * Every node is tried against every rule. Matches are then arranged so that no two reported
 * matches overlap: a match inside the code bound to a placeholder of another match becomes an
 * inner match of that placeholder, and any other match inside an already matched node is
 * dropped. Shallower matches take precedence over deeper ones and, on the same node, the rule
 * with the lower index wins.
 */
public final class MatchFinder {

	private static final Logger logger = LoggerFactory.getLogger(MatchFinder.class);

	private static final Comparator<Match> BY_POSITION = Comparator.comparingInt((Match m) -> m.range().start())
			.thenComparingInt(Match::ruleIndex);

	private final List<Matcher> matchers = new ArrayList<>();
	private TextRange restrictRange;

	/**
	 * Adds a rule. Rules are tried in the order of their index.
	 *
	 * @throws IllegalArgumentException if a rule with the same index was already added
	 */
	public MatchFinder addRule(SearchRule rule) {
		Objects.requireNonNull(rule, "rule must not be null");
		if (matchers.stream().anyMatch(m -> m.rule().index() == rule.index())) {
			throw new IllegalArgumentException("Duplicate rule index: " + rule.index());
		}
		matchers.add(Matcher.forRule(rule));
		matchers.sort(Comparator.comparingInt(m -> m.rule().index()));
		return this;
	}

	/**
	 * Adds a rule with the next free index.
	 */
	public SearchRule addRule(SyntaxNode pattern, Placeholder... placeholders) {
		int index = matchers.stream().mapToInt(m -> m.rule().index() + 1).max().orElse(0);
		SearchRule rule = SearchRule.of(index, pattern, placeholders);
		addRule(rule);
		return rule;
	}

	/**
	 * Only report matches that lie entirely within {@code range}.
	 */
	public MatchFinder restrictTo(TextRange range) {
		this.restrictRange = Objects.requireNonNull(range, "range must not be null");
		return this;
	}

	public List<SearchRule> rules() {
		return matchers.stream().map(Matcher::rule).toList();
	}

	/**
	 * Top-level matches in source order, with nested matches attached to the placeholders that
	 * contain them.
	 */
	public List<Match> matches(SyntaxNode root) {
		Objects.requireNonNull(root, "root must not be null");
		List<Matcher> active = activeMatchers();
		List<Match> found = new ArrayList<>();
		int[] nodes = {0};
		SyntaxCursor.root(root).descendants()
				.filter(SyntaxCursor::isNode)
				.forEach(cursor -> {
					nodes[0]++;
					for (Matcher matcher : active) {
						matcher.tryMatch(cursor).ifPresent(found::add);
					}
				});
		List<Match> nested = nestAndRemoveCollisions(found);
		logger.debug("Tried {} rule(s) on {} node(s): {} candidate match(es), {} after nesting", active.size(),
				nodes[0], found.size(), nested.size());
		return nested;
	}

	/**
	 * All matches, nested ones included, in source order.
	 */
	public List<Match> flattenedMatches(SyntaxNode root) {
		List<Match> all = new ArrayList<>();
		matches(root).forEach(m -> all.addAll(m.flatten()));
		all.sort(BY_POSITION);
		return all;
	}

	/**
	 * Explains, for every node whose text equals {@code snippet}, why each rule did or did not
	 * match it.
	 */
	public List<MatchDebugInfo> debugWhereTextEqual(SyntaxNode root, String snippet) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(snippet, "snippet must not be null");
		List<Matcher> active = activeMatchers();
		List<MatchDebugInfo> result = new ArrayList<>();
		SyntaxCursor.root(root).descendants()
				.filter(SyntaxCursor::isNode)
				.filter(cursor -> cursor.text().equals(snippet))
				.forEach(cursor -> active.forEach(matcher -> result.add(matcher.explain(cursor))));
		return result;
	}

	private List<Matcher> activeMatchers() {
		if (restrictRange == null) {
			return List.copyOf(matchers);
		}
		return matchers.stream().map(m -> m.restrictedTo(restrictRange)).toList();
	}

	// ---- nesting

	static List<Match> nestAndRemoveCollisions(List<Match> matches) {
		List<Match> ordered = new ArrayList<>(matches);
		// parents and competing matches are seen before the matches below them
		ordered.sort(Comparator.comparingInt(Match::depth).thenComparingInt(Match::ruleIndex));
		Collector collector = new Collector();
		ordered.forEach(collector::add);
		return collector.build();
	}

	/**
	 * Matches keyed by node, each with the collectors of its placeholders.
	 */
	private static final class Collector {

		private final Map<SyntaxCursor, Pending> byNode = new LinkedHashMap<>();

		void add(Match match) {
			Optional<Pending> existing = Optional.ofNullable(byNode.get(match.matchedNode()))
					.or(() -> match.matchedNode().ancestors().map(byNode::get).filter(Objects::nonNull).findFirst());
			if (existing.isPresent()) {
				existing.get().tryAddInner(match);
				return;
			}
			byNode.put(match.matchedNode(), new Pending(match));
		}

		List<Match> build() {
			List<Match> built = new ArrayList<>();
			byNode.values().forEach(p -> built.add(p.build()));
			built.sort(BY_POSITION);
			return built;
		}
	}

	private static final class Pending {

		private final Match match;
		private final Map<String, Collector> inner = new LinkedHashMap<>();

		Pending(Match match) {
			this.match = match;
		}

		/**
		 * Adds {@code candidate} below the first placeholder whose binding contains it; drops it if
		 * there is none.
		 */
		void tryAddInner(Match candidate) {
			for (Map.Entry<String, PlaceholderMatch> entry : match.placeholderValues().entrySet()) {
				if (entry.getValue().range().contains(candidate.range())) {
					inner.computeIfAbsent(entry.getKey(), k -> new Collector()).add(candidate);
					return;
				}
			}
			logger.debug("Dropping match of rule {} at {}: overlaps match of rule {} at {}", candidate.ruleIndex(),
					candidate.range(), match.ruleIndex(), match.range());
		}

		Match build() {
			if (inner.isEmpty()) {
				return match;
			}
			Map<String, PlaceholderMatch> values = new LinkedHashMap<>(match.placeholderValues());
			inner.forEach((name, collector) -> values.put(name, values.get(name).withInnerMatches(collector.build())));
			return match.withPlaceholderValues(values);
		}
	}
}
