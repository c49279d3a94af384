package org.javai.syntax.grammar.compile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.javai.syntax.ast.ChildAnchor;
import org.javai.syntax.grammar.AmbiguousCardinalityException;
import org.javai.syntax.grammar.Definition;
import org.javai.syntax.grammar.Grammar;
import org.javai.syntax.grammar.GrammarException;
import org.javai.syntax.grammar.Rule;
import org.javai.syntax.grammar.UnresolvedReferenceException;
import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link Grammar} into a {@link CompiledGrammar}.
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>rename earlier-revision definitions through the configured aliases;</li>
 *   <li>resolve every reference, failing with {@link UnresolvedReferenceException};</li>
 *   <li>allocate the {@link KindTable};</li>
 *   <li>classify definitions: a bare alternation of definition references is a sum, anything
 *       else a product;</li>
 *   <li>rewrite separated lists ({@code X (',' X)* ','?}, {@code (X ',')* X?}) to {@code X*};</li>
 *   <li>flatten each product rule into named fields with a cardinality, target and position;</li>
 *   <li>anchor single-valued node fields that share kinds with a neighbour to the separator token
 *       between them, so that an absent neighbour does not shift them.</li>
 * </ol>
 * Compilation is deterministic: the same grammar text and options always produce equal output.
 * Grammar defects raise {@link GrammarException} or a subclass; nothing is recovered.
 */
public class GrammarCompiler {

	private static final Logger logger = LoggerFactory.getLogger(GrammarCompiler.class);

	private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final CompilerOptions options;

	public GrammarCompiler() {
		this(CompilerOptions.defaults());
	}

	public GrammarCompiler(CompilerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public CompilerOptions options() {
		return options;
	}

	public CompiledGrammar compile(Grammar grammar) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		CompiledGrammar compiled = new Compilation(grammar).run();
		logger.info("Compiled grammar: {} definitions ({} products, {} sums), {} node kinds, {} token kinds",
				compiled.definitions().size(), compiled.products().size(), compiled.sums().size(),
				compiled.kinds().nodeKinds().size(), compiled.kinds().tokenKinds().size());
		return compiled;
	}

	/**
	 * A field while a product rule is being flattened; the name is not yet pluralized.
	 */
	private record RawField(String name, boolean labeled, Cardinality cardinality, FieldTarget target) {

		RawField withCardinality(Cardinality newCardinality) {
			return new RawField(name, labeled, newCardinality, target);
		}
	}

	/**
	 * A leaf of a product rule in grammar order.
	 *
	 * @param field raw field name of a node occurrence, {@code null} for a token leaf
	 * @param tokens for a token leaf, the kinds one of which occurs here
	 * @param context ids of the enclosing options, repetitions and alternatives, outermost first
	 * @param repeated whether the leaf sits inside a repetition
	 */
	private record Leaf(String field, Set<TokenKind> tokens, List<Integer> context, boolean repeated) {

		boolean isToken() {
			return field == null;
		}

		boolean sharesTokens(Leaf other) {
			return other != this && other.tokens().stream().anyMatch(tokens::contains);
		}

		/**
		 * Whether this leaf can only occur where {@code outer} does.
		 */
		boolean within(Leaf outer) {
			List<Integer> enclosing = outer.context();
			return !enclosing.isEmpty() && context.size() >= enclosing.size()
					&& context.subList(0, enclosing.size()).equals(enclosing);
		}
	}

	private final class Compilation {

		private final Grammar grammar;
		private final Map<String, Rule> rules = new LinkedHashMap<>();
		private final Set<String> sums = new HashSet<>();
		private final Map<String, Set<NodeKind>> expandedMembers = new LinkedHashMap<>();
		private KindTable kinds;
		private int contexts;

		Compilation(Grammar grammar) {
			this.grammar = grammar;
		}

		CompiledGrammar run() {
			applyAliases();
			rules.forEach(this::resolveReferences);
			allocateKinds();
			rules.forEach((name, rule) -> {
				if (isSumRule(rule)) {
					sums.add(name);
				}
			});
			List<CompiledDefinition> compiled = new ArrayList<>();
			for (Map.Entry<String, Rule> entry : rules.entrySet()) {
				compiled.add(compileDefinition(entry.getKey(), entry.getValue()));
			}
			return new CompiledGrammar(compiled, kinds);
		}

		// ---- aliases and references

		private void applyAliases() {
			Map<String, String> aliases = options.aliases();
			for (Definition definition : grammar.definitions()) {
				String name = aliases.getOrDefault(definition.name(), definition.name());
				if (!name.equals(definition.name()) && grammar.isDefined(name)) {
					logger.warn("Definition {} is an earlier name of {}, which is also defined; keeping {}",
							definition.name(), name, name);
					continue;
				}
				if (rules.containsKey(name)) {
					throw new GrammarException("Duplicate definition after alias normalization: " + name
							+ " (from " + definition.name() + ")");
				}
				rules.put(name, rename(definition.rule(), aliases));
			}
		}

		private Rule rename(Rule rule, Map<String, String> aliases) {
			if (rule instanceof Rule.NodeRef ref) {
				return new Rule.NodeRef(aliases.getOrDefault(ref.name(), ref.name()));
			}
			if (rule instanceof Rule.Seq seq) {
				return new Rule.Seq(seq.rules().stream().map(r -> rename(r, aliases)).toList());
			}
			if (rule instanceof Rule.Alt alt) {
				return new Rule.Alt(alt.alternatives().stream().map(r -> rename(r, aliases)).toList());
			}
			if (rule instanceof Rule.Opt opt) {
				return new Rule.Opt(rename(opt.rule(), aliases));
			}
			if (rule instanceof Rule.Rep rep) {
				return new Rule.Rep(rename(rep.rule(), aliases));
			}
			if (rule instanceof Rule.Labeled labeled) {
				return new Rule.Labeled(labeled.label(), rename(labeled.rule(), aliases));
			}
			return rule;
		}

		private void resolveReferences(String definition, Rule rule) {
			if (rule instanceof Rule.NodeRef ref) {
				if (!rules.containsKey(ref.name())) {
					throw new UnresolvedReferenceException(definition, ref.name(), "no such definition");
				}
			} else if (rule instanceof Rule.TokenRef ref) {
				if (!options.primitiveTokens().contains(ref.name())) {
					throw new UnresolvedReferenceException(definition, ref.name(), "not a primitive token");
				}
			} else if (rule instanceof Rule.Literal literal) {
				String text = literal.text();
				if (!options.primitiveTokens().contains(text) && !options.punctuation().containsKey(text)
						&& !WORD.matcher(text).matches()) {
					throw new UnresolvedReferenceException(definition, text, "literal token has no configured name");
				}
			} else {
				rule.subRules().forEach(sub -> resolveReferences(definition, sub));
			}
		}

		// ---- kinds

		private void allocateKinds() {
			KindTable.Builder builder = KindTable.builder();
			options.primitiveTokens().forEach(builder::primitive);
			options.triviaTokens().forEach(builder::trivia);
			rules.values().forEach(rule -> registerLiterals(rule, builder));
			rules.keySet().forEach(builder::definition);
			options.extraNodes().forEach(builder::extraNode);
			kinds = builder.build();
		}

		private void registerLiterals(Rule rule, KindTable.Builder builder) {
			if (rule instanceof Rule.Literal literal) {
				String text = literal.text();
				if (options.primitiveTokens().contains(text) || builder.knownLiteral(text).isPresent()) {
					return;
				}
				String punctuation = options.punctuation().get(text);
				if (punctuation != null) {
					builder.literal(text, Names.upperSnake(punctuation), punctuation);
				} else {
					builder.literal(text, Names.upperSnake(text) + "_KW", text.toLowerCase(Locale.ROOT));
				}
				return;
			}
			rule.subRules().forEach(sub -> registerLiterals(sub, builder));
		}

		private TokenKind tokenKind(Rule rule) {
			if (rule instanceof Rule.TokenRef ref) {
				return kinds.primitive(ref.name()).orElseThrow();
			}
			if (rule instanceof Rule.Literal literal) {
				return kinds.primitive(literal.text()).or(() -> kinds.literal(literal.text())).orElseThrow();
			}
			throw new IllegalArgumentException("Not a token rule: " + rule);
		}

		private NodeKind nodeKind(String definition) {
			return kinds.definitionKind(definition).orElseThrow();
		}

		// ---- sums

		private boolean isSumRule(Rule rule) {
			return rule instanceof Rule.Alt alt && alt.alternatives().stream().allMatch(Rule.NodeRef.class::isInstance);
		}

		private List<String> members(String sum) {
			return ((Rule.Alt) rules.get(sum)).alternatives().stream()
					.map(r -> ((Rule.NodeRef) r).name())
					.toList();
		}

		/**
		 * Kinds reachable through a sum's members, nested sums expanded. Cycles are cut.
		 */
		private Set<NodeKind> expandedMembers(String sum) {
			Set<NodeKind> cached = expandedMembers.get(sum);
			if (cached != null) {
				return cached;
			}
			Set<NodeKind> result = new LinkedHashSet<>();
			expand(sum, result, new HashSet<>());
			expandedMembers.put(sum, result);
			return result;
		}

		private void expand(String sum, Set<NodeKind> into, Set<String> visiting) {
			if (!visiting.add(sum)) {
				return;
			}
			for (String member : members(sum)) {
				into.add(nodeKind(member));
				if (sums.contains(member)) {
					expand(member, into, visiting);
				}
			}
		}

		private FieldTarget nodeTarget(String definition) {
			NodeKind kind = nodeKind(definition);
			if (!sums.contains(definition)) {
				return new FieldTarget.Node(definition, kind);
			}
			Set<NodeKind> accepted = new LinkedHashSet<>();
			accepted.add(kind);
			accepted.addAll(expandedMembers(definition));
			return new FieldTarget.Sum(definition, kind, members(definition), accepted);
		}

		// ---- definitions

		private CompiledDefinition compileDefinition(String name, Rule rule) {
			NodeKind kind = nodeKind(name);
			if (sums.contains(name)) {
				List<String> members = members(name);
				logger.debug("{} is a sum of {}", name, members);
				return new CompiledDefinition(name, kind, DefinitionCategory.sum, List.of(), members,
						expandedMembers(name), Set.of(), rule);
			}
			Rule normalized = normalizeLists(rule);
			List<FieldSpec> fields = finish(name, flatten(name, normalized).values());
			List<Leaf> leaves = new ArrayList<>();
			linearize(name, normalized, List.of(), false, leaves);
			fields = anchor(fields, leaves);
			Set<TokenKind> tokenKinds = new LinkedHashSet<>();
			collectTokens(rule, tokenKinds);
			logger.debug("{} is a product with fields {}", name, fields.stream().map(FieldSpec::describe).toList());
			return new CompiledDefinition(name, kind, DefinitionCategory.product, fields, List.of(), Set.of(),
					tokenKinds, normalized);
		}

		private void collectTokens(Rule rule, Set<TokenKind> into) {
			if (rule instanceof Rule.TokenRef || rule instanceof Rule.Literal) {
				into.add(tokenKind(rule));
			} else {
				rule.subRules().forEach(sub -> collectTokens(sub, into));
			}
		}

		// ---- separated lists

		private Rule normalizeLists(Rule rule) {
			if (rule instanceof Rule.Seq seq) {
				return normalizeSeq(seq.rules().stream().map(this::normalizeLists).toList());
			}
			if (rule instanceof Rule.Alt alt) {
				return new Rule.Alt(alt.alternatives().stream().map(this::normalizeLists).toList());
			}
			if (rule instanceof Rule.Opt opt) {
				Rule inner = normalizeLists(opt.rule());
				// (X (',' X)*)? is a list that may be empty
				return inner instanceof Rule.Rep && !(opt.rule() instanceof Rule.Rep) ? inner : new Rule.Opt(inner);
			}
			if (rule instanceof Rule.Rep rep) {
				return new Rule.Rep(normalizeLists(rep.rule()));
			}
			if (rule instanceof Rule.Labeled labeled) {
				return new Rule.Labeled(labeled.label(), normalizeLists(labeled.rule()));
			}
			return rule;
		}

		private Rule normalizeSeq(List<Rule> children) {
			List<Rule> out = new ArrayList<>();
			int i = 0;
			while (i < children.size()) {
				Rule current = children.get(i);
				Rule next = i + 1 < children.size() ? children.get(i + 1) : null;
				Rule afterNext = i + 2 < children.size() ? children.get(i + 2) : null;
				if (isListItem(current) && next instanceof Rule.Rep rep && rep.rule() instanceof Rule.Seq pair
						&& pair.rules().size() == 2 && isSeparator(pair.rules().get(0))
						&& pair.rules().get(1).equals(current)) {
					// X (sep X)* sep?
					out.add(new Rule.Rep(current));
					i += new Rule.Opt(pair.rules().get(0)).equals(afterNext) ? 3 : 2;
				} else if (current instanceof Rule.Rep rep && rep.rule() instanceof Rule.Seq pair
						&& pair.rules().size() == 2 && isListItem(pair.rules().get(0))
						&& isSeparator(pair.rules().get(1))) {
					// (X sep)* X?
					out.add(new Rule.Rep(pair.rules().get(0)));
					i += new Rule.Opt(pair.rules().get(0)).equals(next) ? 2 : 1;
				} else {
					out.add(current);
					i++;
				}
			}
			return out.size() == 1 ? out.get(0) : new Rule.Seq(out);
		}

		private boolean isListItem(Rule rule) {
			return rule instanceof Rule.NodeRef || rule instanceof Rule.TokenRef;
		}

		private boolean isSeparator(Rule rule) {
			return rule instanceof Rule.Literal || rule instanceof Rule.TokenRef;
		}

		// ---- flattening

		private Map<String, RawField> flatten(String definition, Rule rule) {
			if (rule instanceof Rule.NodeRef ref) {
				return single(new RawField(Names.snake(ref.name()), false, Cardinality.one, nodeTarget(ref.name())));
			}
			if (rule instanceof Rule.TokenRef || rule instanceof Rule.Literal) {
				return single(tokenField(rule));
			}
			if (rule instanceof Rule.Labeled labeled) {
				return single(labeledField(definition, labeled));
			}
			if (rule instanceof Rule.Opt opt) {
				checkNotNested(definition, opt, opt.rule());
				Map<String, RawField> fields = flatten(definition, opt.rule());
				fields.replaceAll((k, f) -> f.withCardinality(f.cardinality().optionally()));
				return fields;
			}
			if (rule instanceof Rule.Rep rep) {
				checkNotNested(definition, rep, rep.rule());
				Map<String, RawField> fields = flatten(definition, rep.rule());
				fields.replaceAll((k, f) -> f.withCardinality(Cardinality.many));
				return fields;
			}
			if (rule instanceof Rule.Seq seq) {
				Map<String, RawField> merged = new LinkedHashMap<>();
				for (Rule child : seq.rules()) {
					for (RawField field : flatten(definition, child).values()) {
						merged.merge(field.name(), field, (a, b) -> mergeSequential(definition, a, b));
					}
				}
				return merged;
			}
			List<Map<String, RawField>> branches = new ArrayList<>();
			for (Rule branch : ((Rule.Alt) rule).alternatives()) {
				branches.add(flatten(definition, branch));
			}
			return mergeAlternatives(definition, branches);
		}

		private Map<String, RawField> single(RawField field) {
			Map<String, RawField> fields = new LinkedHashMap<>();
			fields.put(field.name(), field);
			return fields;
		}

		private RawField tokenField(Rule rule) {
			TokenKind kind = tokenKind(rule);
			return new RawField(kinds.fieldStem(kind) + "_token", false, Cardinality.one,
					new FieldTarget.Token(List.of(kind)));
		}

		/**
		 * Rejects an option or repetition directly inside another. Alternation does not intervene:
		 * {@code (A* | B)?} is as ambiguous as {@code A*?}; a label or sequence does.
		 */
		private void checkNotNested(String definition, Rule outer, Rule inner) {
			if (inner instanceof Rule.Alt alt) {
				alt.alternatives().forEach(branch -> checkNotNested(definition, outer, branch));
			} else if (inner instanceof Rule.Opt || inner instanceof Rule.Rep) {
				throw new AmbiguousCardinalityException("Ambiguous cardinality in " + definition + ": " + inner
						+ " is nested directly in " + (outer instanceof Rule.Opt ? "an option" : "a repetition"));
			}
		}

		/**
		 * Two occurrences of one field in a sequence: the field repeats.
		 */
		private RawField mergeSequential(String definition, RawField a, RawField b) {
			checkCompatible(definition, a, b);
			return a.withCardinality(Cardinality.many);
		}

		private Map<String, RawField> mergeAlternatives(String definition, List<Map<String, RawField>> branches) {
			Map<String, List<RawField>> occurrences = new LinkedHashMap<>();
			for (Map<String, RawField> branch : branches) {
				branch.values().forEach(f -> occurrences.computeIfAbsent(f.name(), k -> new ArrayList<>()).add(f));
			}
			Map<String, RawField> merged = new LinkedHashMap<>();
			occurrences.forEach((name, fields) -> {
				RawField first = fields.get(0);
				fields.forEach(f -> checkCompatible(definition, first, f));
				Set<Cardinality> cardinalities = new LinkedHashSet<>();
				fields.forEach(f -> cardinalities.add(f.cardinality()));
				Cardinality cardinality;
				if (cardinalities.contains(Cardinality.many)) {
					cardinality = Cardinality.many;
				} else if (cardinalities.size() > 1) {
					throw new AmbiguousCardinalityException("Ambiguous cardinality in " + definition + ": field '"
							+ name + "' is both required and optional in different alternatives");
				} else {
					cardinality = fields.size() == branches.size() ? first.cardinality()
							: first.cardinality().optionally();
				}
				merged.put(name, first.withCardinality(cardinality));
			});
			return merged;
		}

		private void checkCompatible(String definition, RawField a, RawField b) {
			if (a.labeled() != b.labeled()) {
				throw new GrammarException("Field name clash in " + definition + ": label '" + a.name()
						+ "' is also the name of an unlabeled field");
			}
			if (!a.target().equals(b.target())) {
				throw new GrammarException("Conflicting targets for field '" + a.name() + "' in " + definition + ": "
						+ a.target() + " and " + b.target());
			}
		}

		private RawField labeledField(String definition, Rule.Labeled labeled) {
			List<String> nodes = new ArrayList<>();
			List<TokenKind> tokens = new ArrayList<>();
			collectTargets(labeled.rule(), nodes, tokens);
			if (!nodes.isEmpty() && !tokens.isEmpty()) {
				throw new GrammarException("Label '" + labeled.label() + "' in " + definition
						+ " mixes node and token targets: " + labeled.rule());
			}
			FieldTarget target;
			if (!tokens.isEmpty()) {
				target = new FieldTarget.Token(tokens);
			} else if (nodes.size() == 1) {
				target = nodeTarget(nodes.get(0));
			} else {
				Set<NodeKind> accepted = new LinkedHashSet<>();
				nodes.forEach(n -> accepted.addAll(nodeTarget(n).nodeKinds()));
				target = new FieldTarget.Sum(null, null, nodes, accepted);
			}
			return new RawField(labeled.label(), true, labelCardinality(definition, labeled.rule()), target);
		}

		private void collectTargets(Rule rule, List<String> nodes, List<TokenKind> tokens) {
			if (rule instanceof Rule.NodeRef ref) {
				addDistinct(nodes, ref.name());
			} else if (rule instanceof Rule.TokenRef || rule instanceof Rule.Literal) {
				addDistinct(tokens, tokenKind(rule));
			} else {
				rule.subRules().forEach(sub -> collectTargets(sub, nodes, tokens));
			}
		}

		private <T> void addDistinct(List<T> list, T item) {
			if (!list.contains(item)) {
				list.add(item);
			}
		}

		private Cardinality labelCardinality(String definition, Rule rule) {
			if (rule instanceof Rule.Labeled labeled) {
				return labelCardinality(definition, labeled.rule());
			}
			if (rule instanceof Rule.Opt opt) {
				checkNotNested(definition, opt, opt.rule());
				return labelCardinality(definition, opt.rule()).optionally();
			}
			if (rule instanceof Rule.Rep rep) {
				checkNotNested(definition, rep, rep.rule());
				return Cardinality.many;
			}
			if (rule instanceof Rule.Alt alt) {
				return alt.alternatives().stream()
						.map(r -> labelCardinality(definition, r))
						.reduce(Cardinality.one, Cardinality::max);
			}
			if (rule instanceof Rule.Seq) {
				// more than one occurrence in a row
				return Cardinality.many;
			}
			return Cardinality.one;
		}

		/**
		 * Pluralizes repeated auto-named fields and assigns positions.
		 */
		private List<FieldSpec> finish(String definition, Iterable<RawField> rawFields) {
			List<FieldSpec> fields = new ArrayList<>();
			Set<String> names = new HashSet<>();
			for (RawField raw : rawFields) {
				String name = raw.name();
				if (!raw.labeled() && raw.cardinality() == Cardinality.many) {
					name = name.endsWith("_token") ? name + "s" : Names.plural(name);
				}
				if (!names.add(name)) {
					throw new GrammarException("Field name clash in " + definition + ": " + name);
				}
				int position = 0;
				if (raw.cardinality() != Cardinality.many) {
					for (FieldSpec earlier : fields) {
						if (earlier.cardinality() != Cardinality.many && earlier.target().overlaps(raw.target())) {
							position++;
						}
					}
				}
				fields.add(new FieldSpec(name, raw.cardinality(), raw.target(), position, raw.labeled()));
			}
			return fields;
		}

		// ---- anchors

		private void linearize(String definition, Rule rule, List<Integer> context, boolean repeated,
				List<Leaf> out) {
			if (rule instanceof Rule.NodeRef ref) {
				out.add(new Leaf(Names.snake(ref.name()), Set.of(), context, repeated));
			} else if (rule instanceof Rule.TokenRef || rule instanceof Rule.Literal) {
				out.add(new Leaf(null, Set.of(tokenKind(rule)), context, repeated));
			} else if (rule instanceof Rule.Labeled labeled) {
				List<String> nodes = new ArrayList<>();
				List<TokenKind> tokens = new ArrayList<>();
				collectTargets(labeled.rule(), nodes, tokens);
				List<Integer> where = labelCardinality(definition, labeled.rule()) == Cardinality.one
						? context : enclose(context);
				out.add(tokens.isEmpty() ? new Leaf(labeled.label(), Set.of(), where, repeated)
						: new Leaf(null, new LinkedHashSet<>(tokens), where, repeated));
			} else if (rule instanceof Rule.Alt alt) {
				if (alt.alternatives().stream().allMatch(r -> r instanceof Rule.TokenRef || r instanceof Rule.Literal)) {
					// one of several tokens always occurs here
					Set<TokenKind> tokens = new LinkedHashSet<>();
					alt.alternatives().forEach(r -> tokens.add(tokenKind(r)));
					out.add(new Leaf(null, tokens, context, repeated));
				} else {
					alt.alternatives().forEach(r -> linearize(definition, r, enclose(context), repeated, out));
				}
			} else if (rule instanceof Rule.Opt opt) {
				linearize(definition, opt.rule(), enclose(context), repeated, out);
			} else if (rule instanceof Rule.Rep rep) {
				linearize(definition, rep.rule(), enclose(context), true, out);
			} else {
				rule.subRules().forEach(r -> linearize(definition, r, context, repeated, out));
			}
		}

		private List<Integer> enclose(List<Integer> context) {
			List<Integer> inner = new ArrayList<>(context);
			inner.add(contexts++);
			return List.copyOf(inner);
		}

		private List<FieldSpec> anchor(List<FieldSpec> fields, List<Leaf> leaves) {
			List<FieldSpec> anchored = new ArrayList<>();
			for (int i = 0; i < fields.size(); i++) {
				FieldSpec field = fields.get(i);
				anchored.add(isSingleNode(field) ? anchorField(field, fields.subList(i + 1, fields.size()), anchored,
						leaves) : field);
			}
			return anchored;
		}

		/**
		 * Looks for a separator after the nearest earlier overlapping field, then before the nearest
		 * later one.
		 */
		private FieldSpec anchorField(FieldSpec field, List<FieldSpec> later, List<FieldSpec> earlier,
				List<Leaf> leaves) {
			List<FieldSpec> overlapping = earlier.stream().filter(f -> overlap(f, field)).toList();
			int first = firstLeaf(leaves, field.name());
			int last = lastLeaf(leaves, field.name());
			if (first < 0) {
				return field;
			}
			if (!overlapping.isEmpty()) {
				int from = lastLeaf(leaves, overlapping.get(overlapping.size() - 1).name());
				int separator = separator(leaves, from, first, true);
				if (separator >= 0) {
					int index = (int) overlapping.stream().filter(f -> firstLeaf(leaves, f.name()) > separator).count();
					return field.withAnchor(ChildAnchor.after(leaves.get(separator).tokens(), index,
							fallback(field, overlapping, leaves.get(first), leaves.get(separator))));
				}
			}
			for (FieldSpec next : later) {
				if (!overlap(next, field)) {
					continue;
				}
				int separator = separator(leaves, last, firstLeaf(leaves, next.name()), false);
				if (separator < 0) {
					break;
				}
				int index = (int) overlapping.stream().filter(f -> firstLeaf(leaves, f.name()) < separator).count();
				return field.withAnchor(ChildAnchor.before(leaves.get(separator).tokens(), index,
						fallback(field, overlapping, leaves.get(first), leaves.get(separator))));
			}
			return field;
		}

		/**
		 * The token leaf strictly between {@code from} and {@code to} nearest the field, or -1. Only a
		 * token that occurs once in the rule, outside any repetition, can serve.
		 */
		private int separator(List<Leaf> leaves, int from, int to, boolean nearestTo) {
			if (from < 0 || to < 0 || from >= to) {
				return -1;
			}
			for (int step = 1; step < to - from; step++) {
				int i = nearestTo ? to - step : from + step;
				Leaf leaf = leaves.get(i);
				if (leaf.isToken() && !leaf.repeated() && leaves.stream().noneMatch(leaf::sharesTokens)) {
					return i;
				}
			}
			return -1;
		}

		/**
		 * Without the separator the field is absent if it only occurs together with it. Otherwise it
		 * is counted from the first child, skipping earlier fields that need the same separator.
		 */
		private int fallback(FieldSpec field, List<FieldSpec> overlapping, Leaf occurrence, Leaf separator) {
			if (occurrence.within(separator)) {
				return -1;
			}
			long absent = overlapping.stream()
					.map(FieldSpec::anchor)
					.filter(a -> a != null && a.requiresAnchor() && a.tokens().equals(separator.tokens()))
					.count();
			return field.position() - (int) absent;
		}

		private boolean isSingleNode(FieldSpec field) {
			return !field.isToken() && field.cardinality() != Cardinality.many;
		}

		private boolean overlap(FieldSpec a, FieldSpec b) {
			return isSingleNode(a) && a.target().overlaps(b.target());
		}

		private int firstLeaf(List<Leaf> leaves, String field) {
			for (int i = 0; i < leaves.size(); i++) {
				if (field.equals(leaves.get(i).field())) {
					return i;
				}
			}
			return -1;
		}

		private int lastLeaf(List<Leaf> leaves, String field) {
			for (int i = leaves.size() - 1; i >= 0; i--) {
				if (field.equals(leaves.get(i).field())) {
					return i;
				}
			}
			return -1;
		}
	}
}
