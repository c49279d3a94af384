package org.javai.syntax.grammar.compile;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.TokenKind;

/**
 * What a field holds: tokens of some kinds, one product node kind, or a set of node kinds.
 */
public sealed interface FieldTarget permits FieldTarget.Token, FieldTarget.Node, FieldTarget.Sum {

	boolean acceptsNode(NodeKind kind);

	boolean acceptsToken(TokenKind kind);

	/**
	 * Whether some child could be claimed by both targets.
	 */
	default boolean overlaps(FieldTarget other) {
		if (this instanceof Token mine && other instanceof Token theirs) {
			return mine.kinds().stream().anyMatch(theirs::acceptsToken);
		}
		if (this instanceof Token || other instanceof Token) {
			return false;
		}
		return nodeKinds().stream().anyMatch(other::acceptsNode);
	}

	/**
	 * Node kinds accepted by this target; empty for token targets.
	 */
	Set<NodeKind> nodeKinds();

	/**
	 * One or more token kinds, e.g. {@code op:('+' | '-')}.
	 */
	record Token(List<TokenKind> kinds) implements FieldTarget {

		public Token {
			if (kinds.isEmpty()) {
				throw new IllegalArgumentException("Token target needs at least one kind");
			}
			kinds = List.copyOf(kinds);
		}

		@Override
		public boolean acceptsNode(NodeKind kind) {
			return false;
		}

		@Override
		public boolean acceptsToken(TokenKind kind) {
			return kinds.contains(kind);
		}

		@Override
		public Set<NodeKind> nodeKinds() {
			return Set.of();
		}

		@Override
		public String toString() {
			return kinds.size() == 1 ? kinds.get(0).name() : kinds.toString();
		}
	}

	/**
	 * A product definition.
	 */
	record Node(String definition, NodeKind kind) implements FieldTarget {

		public Node {
			Objects.requireNonNull(definition, "definition must not be null");
			Objects.requireNonNull(kind, "kind must not be null");
		}

		@Override
		public boolean acceptsNode(NodeKind candidate) {
			return kind.equals(candidate);
		}

		@Override
		public boolean acceptsToken(TokenKind candidate) {
			return false;
		}

		@Override
		public Set<NodeKind> nodeKinds() {
			return Set.of(kind);
		}

		@Override
		public String toString() {
			return definition;
		}
	}

	/**
	 * A sum definition ({@code definition} and {@code kind} set) or an inline group of
	 * definitions such as {@code else_branch:(IfExpr | BlockExpr)} (both null).
	 *
	 * @param members the member definitions in declaration order
	 * @param accepted every accepted node kind, nested sums expanded
	 */
	record Sum(String definition, NodeKind kind, List<String> members, Set<NodeKind> accepted)
			implements FieldTarget {

		public Sum {
			members = List.copyOf(members);
			accepted = Collections.unmodifiableSet(new LinkedHashSet<>(accepted));
		}

		public boolean isInline() {
			return definition == null;
		}

		@Override
		public boolean acceptsNode(NodeKind candidate) {
			return accepted.contains(candidate);
		}

		@Override
		public boolean acceptsToken(TokenKind candidate) {
			return false;
		}

		@Override
		public Set<NodeKind> nodeKinds() {
			return accepted;
		}

		@Override
		public String toString() {
			return isInline() ? String.join(" | ", members) : definition;
		}
	}
}
