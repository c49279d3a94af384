package org.javai.syntax.grammar;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A grammar rule. Rules are immutable values and compare structurally.
 * <p>
 * {@link #toString()} renders the rule back to grammar text that parses to an equal rule.
 */
public sealed interface Rule
		permits Rule.Seq, Rule.Alt, Rule.Opt, Rule.Rep, Rule.Labeled, Rule.NodeRef, Rule.TokenRef, Rule.Literal {

	/**
	 * The immediate sub-rules, in source order.
	 */
	List<Rule> subRules();

	record Seq(List<Rule> rules) implements Rule {

		public Seq {
			rules = List.copyOf(rules);
		}

		@Override
		public List<Rule> subRules() {
			return rules;
		}

		@Override
		public String toString() {
			return rules.stream()
					.map(r -> r instanceof Alt || r instanceof Seq ? "(" + r + ")" : r.toString())
					.collect(Collectors.joining(" "));
		}
	}

	record Alt(List<Rule> alternatives) implements Rule {

		public Alt {
			alternatives = List.copyOf(alternatives);
		}

		@Override
		public List<Rule> subRules() {
			return alternatives;
		}

		@Override
		public String toString() {
			return alternatives.stream()
					.map(r -> r instanceof Alt ? "(" + r + ")" : r.toString())
					.collect(Collectors.joining(" | "));
		}
	}

	/**
	 * Zero or one occurrence.
	 */
	record Opt(Rule rule) implements Rule {

		public Opt {
			Objects.requireNonNull(rule, "rule must not be null");
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}

		@Override
		public String toString() {
			return Rule.postfixOperand(rule) + "?";
		}
	}

	/**
	 * Zero or more occurrences.
	 */
	record Rep(Rule rule) implements Rule {

		public Rep {
			Objects.requireNonNull(rule, "rule must not be null");
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}

		@Override
		public String toString() {
			return Rule.postfixOperand(rule) + "*";
		}
	}

	record Labeled(String label, Rule rule) implements Rule {

		public Labeled {
			Objects.requireNonNull(label, "label must not be null");
			Objects.requireNonNull(rule, "rule must not be null");
		}

		@Override
		public List<Rule> subRules() {
			return List.of(rule);
		}

		@Override
		public String toString() {
			return label + ":" + (rule instanceof Seq || rule instanceof Alt || rule instanceof Labeled
					? "(" + rule + ")"
					: rule.toString());
		}
	}

	/**
	 * Reference to another definition, by name.
	 */
	record NodeRef(String name) implements Rule {

		@Override
		public List<Rule> subRules() {
			return List.of();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Reference to a primitive token category ({@code ident}, {@code int_number}) written as a
	 * bare lower-case identifier.
	 */
	record TokenRef(String name) implements Rule {

		@Override
		public List<Rule> subRules() {
			return List.of();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Fixed token text, or the quoted name of a primitive token category.
	 */
	record Literal(String text) implements Rule {

		@Override
		public List<Rule> subRules() {
			return List.of();
		}

		@Override
		public String toString() {
			return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
		}
	}

	private static String postfixOperand(Rule rule) {
		return rule instanceof NodeRef || rule instanceof TokenRef || rule instanceof Literal
				|| rule instanceof Opt || rule instanceof Rep
				? rule.toString()
				: "(" + rule + ")";
	}
}
