package org.javai.syntax.rust.search;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.javai.syntax.rust.ast.NameRef;
import org.javai.syntax.rust.ast.RecordExprField;
import org.javai.syntax.rust.ast.RustKinds;
import org.javai.syntax.tree.SyntaxCursor;
import org.javai.syntax.tree.SyntaxElement;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.javai.syntax.tree.TextRange;
import org.javai.syntax.tree.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether the pattern of one {@link SearchRule} matches a particular code node.
 * <p>
 * Matching runs in two phases. The first phase only compares kinds and token text and records
 * nothing; most attempts fail there. Only when it succeeds does the second phase run the same
 * walk again, this time recording what each placeholder bound to and which comments in the
 * code were skipped.
 * <p>
 * Both sides are compared element by element with trivia skipped. On top of that:
 * <ul>
 *   <li>a comma in the code directly before a closing {@code )}, {@code ]} or {@code }} is
 *       accepted, and a comma in the pattern at that point is optional;</li>
 *   <li>record expression fields are matched by name, in any order, unless the pattern uses a
 *       placeholder as a field name;</li>
 *   <li>inside token trees a placeholder binds the run of code tokens up to the next token of
 *       the pattern.</li>
 * </ul>
 * Paths are compared syntactically. A matcher is immutable and may be shared between threads.
 */
public final class Matcher {

	private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

	private final SearchRule rule;
	private final TextRange restrictRange;
	private final boolean recordFailureReasons;

	private Matcher(SearchRule rule, TextRange restrictRange, boolean recordFailureReasons) {
		this.rule = Objects.requireNonNull(rule, "rule must not be null");
		this.restrictRange = restrictRange;
		this.recordFailureReasons = recordFailureReasons;
	}

	public static Matcher forRule(SearchRule rule) {
		return new Matcher(rule, null, false);
	}

	/**
	 * A matcher that rejects matches whose node or placeholder bindings lie outside {@code range}.
	 */
	public Matcher restrictedTo(TextRange range) {
		return new Matcher(rule, Objects.requireNonNull(range, "range must not be null"), recordFailureReasons);
	}

	public SearchRule rule() {
		return rule;
	}

	/**
	 * Matches the rule's pattern against {@code code}.
	 *
	 * @param code a cursor on a code node; its ancestors determine the match depth
	 * @return the match, or empty if the pattern does not match
	 */
	public Optional<Match> tryMatch(SyntaxCursor code) {
		try {
			return Optional.of(match(code));
		} catch (MatchFailed e) {
			return Optional.empty();
		}
	}

	/**
	 * Like {@link #tryMatch} but records why the match failed. Slower; meant for tooling that
	 * explains to a user why some code was not matched.
	 */
	public MatchDebugInfo explain(SyntaxCursor code) {
		Matcher recording = new Matcher(rule, restrictRange, true);
		try {
			recording.match(code);
			return new MatchDebugInfo(code.range(), code.text(), rule.index(), Optional.empty());
		} catch (MatchFailed e) {
			return new MatchDebugInfo(code.range(), code.text(), rule.index(),
					Optional.of(e.reason().orElse("no reason recorded")));
		}
	}

	private Match match(SyntaxCursor code) throws MatchFailed {
		if (!code.isNode()) {
			throw new IllegalArgumentException("Can only match nodes, got " + code);
		}
		SyntaxNode pattern = rule.pattern();
		attemptMatchNode(Phase.first(), pattern, code);
		validateRange(code.range());
		Phase second = Phase.second();
		attemptMatchNode(second, pattern, code);
		return new Match(code.range(), code, second.placeholderValues, second.ignoredComments, rule.index(),
				code.depth());
	}

	private void validateRange(TextRange range) throws MatchFailed {
		if (restrictRange != null && !restrictRange.contains(range)) {
			throw fail(() -> "Node at " + range + " lies outside the permitted range " + restrictRange);
		}
	}

	// ---- nodes

	private void attemptMatchNode(Phase phase, SyntaxNode pattern, SyntaxCursor code) throws MatchFailed {
		SyntaxNode codeNode = code.node().orElseThrow();
		Optional<Placeholder> placeholder = placeholderFor(pattern);
		if (placeholder.isPresent()) {
			for (Constraint constraint : placeholder.get().constraints()) {
				checkConstraint(constraint, codeNode);
			}
			if (phase.recording) {
				if (restrictRange != null && !restrictRange.contains(code.range())) {
					// the whole match was validated already, so its parts cannot lie outside
					logger.warn("Placeholder {} bound at {} outside the permitted range {}", placeholder.get(),
							code.range(), restrictRange);
					throw fail(() -> "Placeholder binding at " + code.range() + " lies outside the permitted range");
				}
				phase.placeholderValues.put(placeholder.get().name(), PlaceholderMatch.ofNode(code));
			}
			return;
		}
		if (!pattern.kind().equals(codeNode.kind())) {
			throw fail(() -> "Pattern had `" + pattern.text() + "` (" + pattern.kind() + "), code had `"
					+ codeNode.text() + "` (" + codeNode.kind() + ")");
		}
		if (codeNode.kind().equals(RustKinds.RECORD_EXPR_FIELD_LIST)) {
			attemptMatchRecordFieldList(phase, pattern, code);
		} else if (codeNode.kind().equals(RustKinds.TOKEN_TREE)) {
			attemptMatchTokenTree(phase, pattern, code);
		} else {
			attemptMatchSequences(phase, new PatternIterator(pattern), code.children().iterator());
		}
	}

	private void attemptMatchSequences(Phase phase, PatternIterator pattern, Iterator<SyntaxCursor> code)
			throws MatchFailed {
		while (true) {
			Optional<SyntaxCursor> next = phase.nextNonTrivial(code);
			if (next.isEmpty()) {
				Optional<SyntaxElement> unmatched = pattern.next();
				if (unmatched.isPresent()) {
					throw fail(() -> "Part of the pattern was unmatched: " + describe(unmatched.get()));
				}
				return;
			}
			SyntaxCursor c = next.get();
			if (c.isToken()) {
				attemptMatchToken(phase, pattern, c.token().orElseThrow());
				continue;
			}
			Optional<SyntaxElement> p = pattern.next();
			if (p.isEmpty()) {
				throw fail(() -> "Pattern reached end, code has " + c.text());
			}
			if (!(p.get() instanceof SyntaxNode patternNode)) {
				throw fail(() -> "Pattern wanted '" + p.get().text() + "', code has " + c.text());
			}
			attemptMatchNode(phase, patternNode, c);
		}
	}

	// ---- tokens

	private void attemptMatchToken(Phase phase, PatternIterator pattern, SyntaxToken code) throws MatchFailed {
		phase.recordIgnoredComment(code);
		if (code.kind().trivia()) {
			return;
		}
		Optional<SyntaxElement> peeked = pattern.peek();
		if (peeked.isPresent() && peeked.get() instanceof SyntaxToken p) {
			// trailing comma in code: accept it without advancing the pattern
			if (code.kind().equals(RustKinds.COMMA) && isClosing(p.kind())) {
				return;
			}
			// trailing comma in pattern: skip it
			if (p.kind().equals(RustKinds.COMMA) && isClosing(code.kind())) {
				pattern.next();
			}
		}
		Optional<SyntaxElement> next = pattern.next();
		if (next.isEmpty()) {
			throw fail(() -> "Pattern exhausted, while code remains: `" + code.text() + "`");
		}
		if (next.get() instanceof SyntaxToken p) {
			if (!p.kind().equals(code.kind()) || !p.text().equals(code.text())) {
				throw fail(() -> "Pattern wanted token '" + p.text() + "' (" + p.kind() + "), but code had token '"
						+ code.text() + "' (" + code.kind() + ")");
			}
		} else {
			throw fail(() -> "Pattern wanted " + describe(next.get()) + ", but code had token '" + code.text() + "' ("
					+ code.kind() + ")");
		}
	}

	private static boolean isClosing(TokenKind kind) {
		return kind.equals(RustKinds.R_PAREN) || kind.equals(RustKinds.R_CURLY) || kind.equals(RustKinds.R_BRACK);
	}

	// ---- constraints

	private void checkConstraint(Constraint constraint, SyntaxNode code) throws MatchFailed {
		if (constraint.test(code)) {
			return;
		}
		if (constraint instanceof Constraint.Kind kind) {
			throw fail(() -> "Code '" + code.text() + "' isn't of " + kind);
		}
		throw fail(() -> "Constraint " + constraint + " failed for '" + code.text() + "'");
	}

	// ---- record expression fields

	/**
	 * Record fields may be written in any order, so they are paired up by name.
	 */
	private void attemptMatchRecordFieldList(Phase phase, SyntaxNode pattern, SyntaxCursor code) throws MatchFailed {
		Map<String, SyntaxCursor> fieldsByName = new LinkedHashMap<>();
		List<SyntaxCursor> otherCode = new ArrayList<>();
		for (SyntaxCursor child : code.childNodes()) {
			Optional<String> name = child.node().flatMap(RecordExprField::cast).flatMap(Matcher::fieldName);
			if (name.isPresent()) {
				fieldsByName.put(name.get(), child);
			} else {
				otherCode.add(child);
			}
		}
		Iterator<SyntaxCursor> others = otherCode.iterator();
		for (SyntaxNode p : pattern.childNodes()) {
			if (!p.kind().equals(RustKinds.RECORD_EXPR_FIELD)) {
				if (!others.hasNext()) {
					throw fail(() -> "Pattern `" + p.text() + "` had nothing to match");
				}
				attemptMatchNode(phase, p, others.next());
				continue;
			}
			Optional<SyntaxElement> nameElement = p.firstChildOrToken();
			if (nameElement.isEmpty()) {
				continue;
			}
			if (placeholderFor(nameElement.get()).isPresent()) {
				// placeholders as field names make the order significant again
				attemptMatchSequences(phase, new PatternIterator(pattern), code.children().iterator());
				return;
			}
			Optional<SyntaxToken> ident = onlyIdent(nameElement.get());
			if (ident.isPresent()) {
				SyntaxCursor codeField = fieldsByName.remove(ident.get().text());
				if (codeField == null) {
					throw fail(() -> "Pattern has record field '" + ident.get().text() + "', but code doesn't");
				}
				attemptMatchNode(phase, p, codeField);
			}
		}
		if (!fieldsByName.isEmpty()) {
			throw fail(() -> fieldsByName.size() + " field(s) of a record literal failed to match, starting with "
					+ fieldsByName.keySet().iterator().next());
		}
		if (others.hasNext()) {
			SyntaxCursor extra = others.next();
			throw fail(() -> "Nothing in pattern to match code `" + extra.text() + "`");
		}
	}

	/**
	 * {@code name: value} or the shorthand {@code name}.
	 */
	private static Optional<String> fieldName(RecordExprField field) {
		Optional<NameRef> nameRef = field.nameRef();
		if (nameRef.isPresent()) {
			return nameRef.get().identToken().or(nameRef.get()::intNumberToken).map(SyntaxToken::text);
		}
		return field.expr().flatMap(expr -> onlyIdent(expr.syntax())).map(SyntaxToken::text);
	}

	// ---- token trees

	/**
	 * Outside of token trees a placeholder matches a single node; inside one it matches a run of
	 * tokens, up to the code token equal to the pattern's next token.
	 */
	private void attemptMatchTokenTree(Phase phase, SyntaxNode pattern, SyntaxCursor code) throws MatchFailed {
		PatternIterator patternIt = new PatternIterator(pattern);
		Iterator<SyntaxCursor> children = code.children().iterator();
		while (children.hasNext()) {
			SyntaxCursor child = children.next();
			Optional<SyntaxToken> trivia = child.token().filter(t -> t.kind().trivia());
			if (trivia.isPresent()) {
				phase.recordIgnoredComment(trivia.get());
				continue;
			}
			Optional<Placeholder> placeholder = patternIt.peek().flatMap(this::placeholderFor);
			if (placeholder.isPresent()) {
				patternIt.next();
				Optional<String> nextPatternToken = patternIt.peek().flatMap(Matcher::firstToken).map(SyntaxToken::text);
				SyntaxCursor first = child;
				SyntaxCursor last = child;
				while (children.hasNext()) {
					SyntaxCursor next = children.next();
					if (next.isToken()) {
						if (nextPatternToken.isPresent() && nextPatternToken.get().equals(next.text())) {
							patternIt.next();
							break;
						}
					} else {
						Optional<String> firstCodeToken = next.node().flatMap(SyntaxNode::firstToken).map(SyntaxToken::text);
						if (firstCodeToken.isPresent() && firstCodeToken.equals(nextPatternToken)
								&& patternIt.peek().filter(SyntaxNode.class::isInstance).isPresent()) {
							// a subtree that starts with the pattern's next token
							SyntaxNode subPattern = (SyntaxNode) patternIt.next().orElseThrow();
							attemptMatchTokenTree(phase, subPattern, next);
							break;
						}
					}
					last = next;
				}
				if (phase.recording) {
					phase.placeholderValues.put(placeholder.get().name(),
							PlaceholderMatch.ofRange(first.range().cover(last.range())));
				}
				continue;
			}
			if (child.isToken()) {
				attemptMatchToken(phase, patternIt, child.token().orElseThrow());
				continue;
			}
			Optional<SyntaxElement> p = patternIt.next();
			if (p.isEmpty()) {
				throw fail(() -> "Pattern has nothing, code has '" + child.text() + "'");
			}
			if (!(p.get() instanceof SyntaxNode subPattern)) {
				throw fail(() -> "Pattern has token '" + p.get().text() + "', code has subtree '" + child.text() + "'");
			}
			attemptMatchTokenTree(phase, subPattern, child);
		}
		Optional<SyntaxElement> remaining = patternIt.next();
		if (remaining.isPresent()) {
			throw fail(() -> "Reached end of token tree in code, but pattern still has " + describe(remaining.get()));
		}
	}

	// ---- placeholders

	private Optional<Placeholder> placeholderFor(SyntaxElement element) {
		return onlyIdent(element).flatMap(rule::placeholder);
	}

	/**
	 * The identifier if {@code element} is one, or is a node containing nothing but one.
	 */
	static Optional<SyntaxToken> onlyIdent(SyntaxElement element) {
		if (element instanceof SyntaxToken token) {
			return token.kind().equals(RustKinds.IDENT) ? Optional.of(token) : Optional.empty();
		}
		List<SyntaxElement> children = ((SyntaxNode) element).children();
		return children.size() == 1 ? onlyIdent(children.get(0)) : Optional.empty();
	}

	private static Optional<SyntaxToken> firstToken(SyntaxElement element) {
		return element instanceof SyntaxToken token ? Optional.of(token) : ((SyntaxNode) element).firstToken();
	}

	private static String describe(SyntaxElement element) {
		return element.kindName() + " `" + element.text() + "`";
	}

	private MatchFailed fail(Supplier<String> reason) {
		return new MatchFailed(recordFailureReasons ? reason.get() : null);
	}

	/**
	 * State of one matching phase. Only the second phase records anything.
	 */
	private static final class Phase {

		private final boolean recording;
		private final Map<String, PlaceholderMatch> placeholderValues = new LinkedHashMap<>();
		private final List<SyntaxToken> ignoredComments = new ArrayList<>();

		private Phase(boolean recording) {
			this.recording = recording;
		}

		static Phase first() {
			return new Phase(false);
		}

		static Phase second() {
			return new Phase(true);
		}

		Optional<SyntaxCursor> nextNonTrivial(Iterator<SyntaxCursor> code) {
			while (code.hasNext()) {
				SyntaxCursor next = code.next();
				Optional<SyntaxToken> token = next.token();
				if (token.isPresent()) {
					recordIgnoredComment(token.get());
					if (token.get().kind().trivia()) {
						continue;
					}
				}
				return Optional.of(next);
			}
			return Optional.empty();
		}

		void recordIgnoredComment(SyntaxToken token) {
			if (recording && token.kind().equals(RustKinds.COMMENT)) {
				ignoredComments.add(token);
			}
		}
	}

	/**
	 * The children of a pattern node with trivia removed.
	 */
	private static final class PatternIterator {

		private final List<SyntaxElement> elements;
		private int index;

		PatternIterator(SyntaxNode parent) {
			this.elements = parent.children().stream()
					.filter(e -> !(e instanceof SyntaxToken token && token.kind().trivia()))
					.toList();
		}

		Optional<SyntaxElement> peek() {
			return index < elements.size() ? Optional.of(elements.get(index)) : Optional.empty();
		}

		Optional<SyntaxElement> next() {
			Optional<SyntaxElement> next = peek();
			if (next.isPresent()) {
				index++;
			}
			return next;
		}
	}
}
