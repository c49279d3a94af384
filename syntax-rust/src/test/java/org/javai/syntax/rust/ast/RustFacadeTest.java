package org.javai.syntax.rust.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.syntax.rust.testsupport.RustTrees.binary;
import static org.javai.syntax.rust.testsupport.RustTrees.block;
import static org.javai.syntax.rust.testsupport.RustTrees.call;
import static org.javai.syntax.rust.testsupport.RustTrees.literal;
import static org.javai.syntax.rust.testsupport.RustTrees.node;
import static org.javai.syntax.rust.testsupport.RustTrees.path;
import static org.javai.syntax.rust.testsupport.RustTrees.pathExpr;
import static org.javai.syntax.rust.testsupport.RustTrees.space;
import static org.javai.syntax.rust.testsupport.RustTrees.token;

import org.javai.syntax.ast.AstNode;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RustFacadeTest {

	/**
	 * {@code if cond { } else <elseBranch>}
	 */
	private static SyntaxNode ifExpr(SyntaxNode thenBranch, SyntaxNode elseBranch) {
		SyntaxNode condition = node(RustKinds.CONDITION, pathExpr("cond"));
		if (elseBranch == null) {
			return node(RustKinds.IF_EXPR, token(RustKinds.IF_KW), space(), condition, space(), thenBranch);
		}
		return node(RustKinds.IF_EXPR, token(RustKinds.IF_KW), space(), condition, space(), thenBranch, space(),
				token(RustKinds.ELSE_KW), space(), elseBranch);
	}

	@Nested
	@DisplayName("If expressions")
	class IfExpressions {

		@Test
		void branchesAreToldApartByPosition() {
			SyntaxNode thenBranch = block();
			SyntaxNode elseBranch = block(call("foo", literal("1")));

			IfExpr ifExpr = IfExpr.cast(ifExpr(thenBranch, elseBranch)).orElseThrow();

			assertThat(ifExpr.condition()).isPresent();
			assertThat(ifExpr.thenBranch()).hasValueSatisfying(b -> assertThat(b.syntax()).isSameAs(thenBranch));
			assertThat(ifExpr.elseBranch()).hasValueSatisfying(b -> {
				assertThat(b).isInstanceOf(BlockExpr.class);
				assertThat(b.syntax()).isSameAs(elseBranch);
			});
		}

		@Test
		void elseIfIsNarrowedToIfExpr() {
			SyntaxNode nested = ifExpr(block(), null);

			IfExpr ifExpr = IfExpr.cast(ifExpr(block(), nested)).orElseThrow();

			assertThat(ifExpr.elseBranch()).hasValueSatisfying(b -> assertThat(b).isInstanceOf(IfExpr.class));
			assertThat(IfExpr.cast(nested).orElseThrow().elseBranch()).isEmpty();
		}

		@Test
		void keywordsAreTokenFields() {
			IfExpr ifExpr = IfExpr.cast(ifExpr(block(), block())).orElseThrow();

			assertThat(ifExpr.ifToken()).map(SyntaxToken::text).contains("if");
			assertThat(ifExpr.elseToken()).map(SyntaxToken::text).contains("else");
		}
	}

	@Nested
	@DisplayName("Binary expressions")
	class BinaryExpressions {

		@Test
		void operandsAndOperator() {
			BinExpr bin = BinExpr.cast(binary(literal("1"), RustKinds.PLUS, pathExpr("x"))).orElseThrow();

			assertThat(bin.lhs().flatMap(Expr::asLiteral)).isPresent();
			assertThat(bin.rhs().flatMap(Expr::asPathExpr)).isPresent();
			assertThat(bin.op()).map(SyntaxToken::text).contains("+");
		}

		@Test
		void missingRightOperand() {
			BinExpr bin = BinExpr.cast(node(RustKinds.BIN_EXPR, literal("1"), token(RustKinds.PLUS))).orElseThrow();

			assertThat(bin.lhs()).isPresent();
			assertThat(bin.rhs()).isEmpty();
		}
	}

	/**
	 * {@code impl Foo {}} when {@code trait} is null, else {@code impl Trait for Foo {}}
	 */
	private static SyntaxNode impl(SyntaxNode trait, SyntaxNode selfTy) {
		SyntaxNode items = node(RustKinds.ASSOC_ITEM_LIST, token(RustKinds.L_CURLY), token(RustKinds.R_CURLY));
		if (trait == null) {
			return node(RustKinds.IMPL, token(RustKinds.IMPL_KW), space(), selfTy, space(), items);
		}
		return node(RustKinds.IMPL, token(RustKinds.IMPL_KW), space(), trait, space(), token(RustKinds.FOR_KW),
				space(), selfTy, space(), items);
	}

	private static SyntaxNode pathType(String name) {
		return node(RustKinds.PATH_TYPE, path(name));
	}

	@Nested
	@DisplayName("Impls")
	class Impls {

		@Test
		void inherentImplHasOnlyASelfType() {
			SyntaxNode foo = pathType("Foo");

			Impl impl = Impl.cast(impl(null, foo)).orElseThrow();

			assertThat(impl.trait()).isEmpty();
			assertThat(impl.forToken()).isEmpty();
			assertThat(impl.selfTy()).hasValueSatisfying(t -> assertThat(t.syntax()).isSameAs(foo));
		}

		@Test
		void traitImplSplitsAtFor() {
			SyntaxNode trait = pathType("T");
			SyntaxNode selfTy = pathType("U");

			Impl impl = Impl.cast(impl(trait, selfTy)).orElseThrow();

			assertThat(impl.trait()).hasValueSatisfying(t -> assertThat(t.syntax()).isSameAs(trait));
			assertThat(impl.selfTy()).hasValueSatisfying(t -> {
				assertThat(t.syntax()).isSameAs(selfTy);
				assertThat(t.asPathType()).isPresent();
			});
		}
	}

	@Nested
	@DisplayName("Ranges")
	class Ranges {

		@Test
		void rangeTo() {
			SyntaxNode five = literal("5");

			RangeExpr range = RangeExpr.cast(node(RustKinds.RANGE_EXPR, token(RustKinds.DOT2), five)).orElseThrow();

			assertThat(range.start()).isEmpty();
			assertThat(range.end()).hasValueSatisfying(e -> assertThat(e.syntax()).isSameAs(five));
			assertThat(range.op()).map(SyntaxToken::text).contains("..");
		}

		@Test
		void rangeFrom() {
			SyntaxNode five = literal("5");

			RangeExpr range = RangeExpr.cast(node(RustKinds.RANGE_EXPR, five, token(RustKinds.DOT2))).orElseThrow();

			assertThat(range.start()).hasValueSatisfying(e -> assertThat(e.syntax()).isSameAs(five));
			assertThat(range.end()).isEmpty();
		}

		@Test
		void fullRange() {
			RangeExpr range = RangeExpr.cast(node(RustKinds.RANGE_EXPR, token(RustKinds.DOT2))).orElseThrow();

			assertThat(range.start()).isEmpty();
			assertThat(range.end()).isEmpty();
		}

		@Test
		void inclusiveRangeHasBothEnds() {
			SyntaxNode one = literal("1");
			SyntaxNode two = literal("2");

			RangeExpr range = RangeExpr.cast(node(RustKinds.RANGE_EXPR, one, token(RustKinds.DOT2EQ), two))
					.orElseThrow();

			assertThat(range.start()).hasValueSatisfying(e -> assertThat(e.syntax()).isSameAs(one));
			assertThat(range.end()).hasValueSatisfying(e -> assertThat(e.syntax()).isSameAs(two));
			assertThat(range.op()).map(SyntaxToken::text).contains("..=");
		}
	}

	@Nested
	@DisplayName("Blocks")
	class Blocks {

		@Test
		void statementsWithoutTail() {
			BlockExpr block = BlockExpr.cast(block(call("foo", literal("1")), call("bar", literal("2"))))
					.orElseThrow();

			assertThat(block.statements().count()).isEqualTo(2);
			assertThat(block.statements().first().flatMap(Stmt::asExprStmt)).isPresent();
			assertThat(block.tailExpr()).isEmpty();
		}

		@Test
		void tailExpression() {
			SyntaxNode statement = node(RustKinds.EXPR_STMT, call("foo", literal("1")), token(RustKinds.SEMICOLON));
			SyntaxNode tail = literal("2");
			BlockExpr block = BlockExpr.cast(node(RustKinds.BLOCK_EXPR, token(RustKinds.L_CURLY), statement, space(),
					tail, token(RustKinds.R_CURLY))).orElseThrow();

			assertThat(block.statements().count()).isEqualTo(1);
			assertThat(block.tailExpr()).hasValueSatisfying(e -> assertThat(e.syntax()).isSameAs(tail));
		}
	}

	@Nested
	@DisplayName("Expression sum")
	class ExpressionSum {

		@Test
		void downcastToLiteral() {
			Expr expr = Expr.cast(literal("42")).orElseThrow();

			AstNode member = expr.downcastMember().orElseThrow();

			assertThat(member).isInstanceOf(Literal.class);
			assertThat(((Literal) member).value()).map(SyntaxToken::text).contains("42");
			assertThat(expr.asCallExpr()).isEmpty();
		}

		@Test
		void typesAreNotExpressions() {
			assertThat(Expr.cast(node(RustKinds.INFER_TYPE, token(RustKinds.UNDERSCORE)))).isEmpty();
			assertThat(Type.cast(node(RustKinds.INFER_TYPE, token(RustKinds.UNDERSCORE)))).isPresent();
		}

		@Test
		void macroCallIsBothItemAndExpression() {
			SyntaxNode macro = node(RustKinds.MACRO_CALL, node(RustKinds.PATH), token(RustKinds.BANG));

			assertThat(Expr.cast(macro)).isPresent();
			assertThat(Item.cast(macro).flatMap(Item::asMacroCall)).isPresent();
		}
	}
}
