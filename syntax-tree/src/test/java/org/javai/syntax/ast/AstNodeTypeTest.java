package org.javai.syntax.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxFactory;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.javai.syntax.tree.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Runtime facade behaviour with wrappers written the way the generator emits them.
 */
class AstNodeTypeTest {

	static final TokenKind PLUS = new TokenKind(0, "PLUS", "+", false);
	static final TokenKind MINUS = new TokenKind(1, "MINUS", "-", false);
	static final NodeKind LIT = new NodeKind(0, "LIT");
	static final NodeKind NEG = new NodeKind(1, "NEG");
	static final NodeKind BIN = new NodeKind(2, "BIN");
	static final NodeKind EXPR = new NodeKind(3, "EXPR");
	static final NodeKind OTHER = new NodeKind(4, "OTHER");

	record Lit(SyntaxNode syntax) implements AstNode {
		static final AstNodeType<Lit> TYPE = AstNodeType.product("Lit", LIT, Lit::new);
	}

	record Neg(SyntaxNode syntax) implements AstNode {
		static final AstNodeType<Neg> TYPE = AstNodeType.product("Neg", NEG, Neg::new);
	}

	record Bin(SyntaxNode syntax) implements AstNode {
		static final AstNodeType<Bin> TYPE = AstNodeType.product("Bin", BIN, Bin::new);

		Optional<Expr> lhs() {
			return AstSupport.child(syntax, Expr.TYPE, 0);
		}

		Optional<Expr> rhs() {
			return AstSupport.child(syntax, Expr.TYPE, 1);
		}

		Optional<SyntaxToken> op() {
			return AstSupport.token(syntax, Set.of(PLUS, MINUS), 0);
		}

		AstChildren<Lit> literals() {
			return AstSupport.children(syntax, Lit.TYPE);
		}
	}

	record Expr(SyntaxNode syntax) implements AstNode {
		static final AstNodeType<Expr> TYPE = AstNodeType.sum("Expr", EXPR, Set.of(LIT, NEG, BIN), Expr::new,
				() -> List.of(Lit.TYPE, Neg.TYPE, Bin.TYPE));

		Optional<AstNode> downcastMember() {
			return TYPE.downcastMember(syntax);
		}
	}

	static SyntaxNode lit(String text) {
		return SyntaxFactory.buildNode(LIT, SyntaxFactory.buildToken(new TokenKind(9, "INT", null, false), text));
	}

	@Nested
	@DisplayName("cast")
	class Cast {

		@Test
		void productAcceptsOnlyItsKind() {
			SyntaxNode node = lit("1");

			assertThat(Lit.TYPE.cast(node)).map(AstNode::syntax).containsSame(node);
			assertThat(Neg.TYPE.cast(node)).isEmpty();
			assertThat(Lit.TYPE.cast(null)).isEmpty();
		}

		@Test
		void sumAcceptsItsOwnKindAndEveryMemberKind() {
			assertThat(Expr.TYPE.acceptedKinds()).containsExactlyInAnyOrder(EXPR, LIT, NEG, BIN);
			assertThat(Expr.TYPE.cast(lit("1"))).isPresent();
			assertThat(Expr.TYPE.cast(SyntaxFactory.buildNode(OTHER))).isEmpty();
		}

		@Test
		@DisplayName("upcast returns the very node that was cast")
		void upcastIsIdentity() {
			SyntaxNode node = lit("1");

			assertThat(Expr.TYPE.cast(node).orElseThrow().syntax()).isSameAs(node);
		}
	}

	@Nested
	@DisplayName("downcastMember")
	class DowncastMember {

		@Test
		void narrowsToTheMatchingMember() {
			Expr expr = Expr.TYPE.cast(SyntaxFactory.buildNode(NEG)).orElseThrow();

			assertThat(expr.downcastMember()).containsInstanceOf(Neg.class);
		}

		@Test
		void emptyWhenNoMemberMatches() {
			Expr expr = Expr.TYPE.cast(SyntaxFactory.buildNode(EXPR)).orElseThrow();

			assertThat(expr.downcastMember()).isEmpty();
		}

		@Test
		void anyOfWrapsAsTheMatchingMember() {
			AstNodeType<AstNode> litOrNeg = AstNodeType.anyOf("LitOrNeg", Set.of(LIT, NEG),
					() -> List.of(Lit.TYPE, Neg.TYPE));

			assertThat(litOrNeg.kind()).isEmpty();
			assertThat(litOrNeg.cast(lit("1"))).containsInstanceOf(Lit.class);
			assertThat(litOrNeg.cast(SyntaxFactory.buildNode(BIN))).isEmpty();
		}

		@Test
		void anyOfNeedsMembers() {
			assertThatThrownBy(() -> AstNodeType.anyOf("Empty", Set.of(), List::of))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("accessors")
	class Accessors {

		private final SyntaxNode bin = SyntaxFactory.buildNode(BIN, lit("1"), SyntaxFactory.buildToken(MINUS),
				SyntaxFactory.buildNode(NEG, lit("2")));

		@Test
		void positionalFieldsPickTheNthMatchingChild() {
			Bin wrapper = Bin.TYPE.cast(bin).orElseThrow();

			assertThat(wrapper.lhs()).map(AstNode::text).contains("1");
			assertThat(wrapper.rhs()).map(AstNode::text).contains("2");
			assertThat(wrapper.op()).map(SyntaxToken::text).contains("-");
		}

		@Test
		void missingChildrenAreAbsentNotErrors() {
			Bin empty = Bin.TYPE.cast(SyntaxFactory.buildNode(BIN)).orElseThrow();

			assertThat(empty.lhs()).isEmpty();
			assertThat(empty.rhs()).isEmpty();
			assertThat(empty.op()).isEmpty();
			assertThat(empty.literals().isEmpty()).isTrue();
		}

		@Test
		void manyFieldsSkipOtherKindsAndAreRestartable() {
			SyntaxNode node = SyntaxFactory.buildNode(BIN, lit("1"), SyntaxFactory.buildNode(OTHER),
					SyntaxFactory.buildToken(PLUS), lit("2"));
			AstChildren<Lit> literals = Bin.TYPE.cast(node).orElseThrow().literals();

			assertThat(literals).extracting(AstNode::text).containsExactly("1", "2");
			assertThat(literals).extracting(AstNode::text).containsExactly("1", "2");
			assertThat(literals.count()).isEqualTo(2);
			assertThat(literals.first()).map(AstNode::text).contains("1");
		}

		@Test
		void slotLookupCountsEarlierWiderFields() {
			// cond:Expr then:Neg, where the condition is itself a Neg in the second tree
			Set<NodeKind> slot = Set.of(EXPR, LIT, NEG, BIN);
			SyntaxNode litThenNeg = SyntaxFactory.buildNode(BIN, lit("1"), SyntaxFactory.buildNode(NEG, lit("2")));
			SyntaxNode negThenNeg = SyntaxFactory.buildNode(BIN, SyntaxFactory.buildNode(NEG, lit("1")),
					SyntaxFactory.buildNode(NEG, lit("2")));

			assertThat(AstSupport.child(litThenNeg, Neg.TYPE, slot, 1)).map(AstNode::text).contains("2");
			assertThat(AstSupport.child(negThenNeg, Neg.TYPE, slot, 1)).map(AstNode::text).contains("2");
			assertThat(AstSupport.child(litThenNeg, Neg.TYPE, 1)).isEmpty();
			assertThat(AstSupport.child(litThenNeg, Lit.TYPE, slot, 1)).isEmpty();
		}

		@Test
		void anchoredFieldsAreFoundBesideTheirSeparator() {
			// start:Expr? op:('+' | '-') end:Expr?
			Set<NodeKind> slot = Set.of(EXPR, LIT, NEG, BIN);
			ChildAnchor start = ChildAnchor.before(Set.of(PLUS, MINUS), 0, 0);
			ChildAnchor end = ChildAnchor.after(Set.of(PLUS, MINUS), 0, 1);
			SyntaxNode openStart = SyntaxFactory.buildNode(BIN, SyntaxFactory.buildToken(MINUS), lit("5"));
			SyntaxNode openEnd = SyntaxFactory.buildNode(BIN, lit("5"), SyntaxFactory.buildToken(PLUS));

			assertThat(AstSupport.child(openStart, Expr.TYPE, slot, start)).isEmpty();
			assertThat(AstSupport.child(openStart, Expr.TYPE, slot, end)).map(AstNode::text).contains("5");
			assertThat(AstSupport.child(openEnd, Expr.TYPE, slot, start)).map(AstNode::text).contains("5");
			assertThat(AstSupport.child(openEnd, Expr.TYPE, slot, end)).isEmpty();
		}

		@Test
		void missingSeparatorEitherFallsBackOrMeansAbsent() {
			// (head:Lit '-')? tail:Lit
			ChildAnchor head = ChildAnchor.before(Set.of(MINUS), 0, -1);
			ChildAnchor tail = ChildAnchor.after(Set.of(MINUS), 0, 0);
			SyntaxNode tailOnly = SyntaxFactory.buildNode(BIN, lit("1"));
			SyntaxNode both = SyntaxFactory.buildNode(BIN, lit("1"), SyntaxFactory.buildToken(MINUS), lit("2"));

			assertThat(head.requiresAnchor()).isTrue();
			assertThat(AstSupport.child(tailOnly, Lit.TYPE, Set.of(LIT), head)).isEmpty();
			assertThat(AstSupport.child(tailOnly, Lit.TYPE, Set.of(LIT), tail)).map(AstNode::text).contains("1");
			assertThat(AstSupport.child(both, Lit.TYPE, Set.of(LIT), head)).map(AstNode::text).contains("1");
			assertThat(AstSupport.child(both, Lit.TYPE, Set.of(LIT), tail)).map(AstNode::text).contains("2");
			assertThatThrownBy(() -> ChildAnchor.after(Set.of(), 0, 0)).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void tokensCollectsAllMatchingTokens() {
			SyntaxNode node = SyntaxFactory.buildNode(BIN, SyntaxFactory.buildToken(PLUS), lit("1"),
					SyntaxFactory.buildToken(PLUS));

			assertThat(AstSupport.tokens(node, PLUS)).hasSize(2);
			assertThat(AstSupport.tokens(node, MINUS)).isEmpty();
		}
	}
}
