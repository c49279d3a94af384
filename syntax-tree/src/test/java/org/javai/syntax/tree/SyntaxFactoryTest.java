package org.javai.syntax.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.syntax.tree.TestKinds.BIN_EXPR;
import static org.javai.syntax.tree.TestKinds.ERROR;
import static org.javai.syntax.tree.TestKinds.FN;
import static org.javai.syntax.tree.TestKinds.FN_KW;
import static org.javai.syntax.tree.TestKinds.IDENT;
import static org.javai.syntax.tree.TestKinds.LITERAL;
import static org.javai.syntax.tree.TestKinds.NAME;
import static org.javai.syntax.tree.TestKinds.PLUS;
import static org.javai.syntax.tree.TestKinds.literal;
import static org.javai.syntax.tree.TestKinds.name;
import static org.javai.syntax.tree.TestKinds.space;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SyntaxFactoryTest {

	@Nested
	@DisplayName("buildNode")
	class BuildNode {

		@ParameterizedTest
		@ValueSource(ints = { 0, 1, 2, 7 })
		@DisplayName("kind and children round-trip for any number of children")
		void roundTrip(int count) {
			List<SyntaxElement> children = new ArrayList<>();
			for (int i = 0; i < count; i++) {
				children.add(i % 2 == 0 ? literal(Integer.toString(i)) : space());
			}

			SyntaxNode node = SyntaxFactory.buildNode(BIN_EXPR, children);

			assertThat(node.kind()).isEqualTo(BIN_EXPR);
			assertThat(node.children()).containsExactlyElementsOf(children);
		}

		@Test
		@DisplayName("later changes to the caller's list do not leak into the node")
		void childrenAreCopied() {
			List<SyntaxElement> children = new ArrayList<>(List.of(literal("1")));
			SyntaxNode node = SyntaxFactory.buildNode(BIN_EXPR, children);

			children.add(space());

			assertThat(node.children()).hasSize(1);
			assertThatThrownBy(() -> node.children().add(space()))
					.isInstanceOf(UnsupportedOperationException.class);
		}

		@Test
		@DisplayName("any shape is accepted, including nodes the grammar would reject")
		void malformedShapesAreRepresentable() {
			SyntaxNode fnWithoutBody = SyntaxFactory.buildNode(FN, SyntaxFactory.buildToken(FN_KW));
			SyntaxNode errorNode = SyntaxFactory.buildNode(ERROR, SyntaxFactory.buildToken(PLUS), fnWithoutBody);

			assertThat(errorNode.text()).isEqualTo("+fn");
			assertThat(fnWithoutBody.nthChildOfKind(NAME, 0)).isEmpty();
		}

		@Test
		void rejectsNulls() {
			assertThatThrownBy(() -> SyntaxFactory.buildNode(null, List.of()))
					.isInstanceOf(NullPointerException.class);
			assertThatThrownBy(() -> SyntaxFactory.buildNode(FN, (List<SyntaxElement>) null))
					.isInstanceOf(NullPointerException.class);
		}
	}

	@Nested
	@DisplayName("buildToken")
	class BuildToken {

		@Test
		void usesFixedTextWhenPresent() {
			assertThat(SyntaxFactory.buildToken(FN_KW).text()).isEqualTo("fn");
		}

		@Test
		void rejectsKindsWithoutFixedText() {
			assertThatThrownBy(() -> SyntaxFactory.buildToken(IDENT))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("IDENT");
		}

		@Test
		void printsKindAndQuotedText() {
			assertThat(SyntaxFactory.buildToken(IDENT, "a\"b\n")).hasToString("IDENT \"a\\\"b\\n\"");
		}
	}

	@Nested
	@DisplayName("navigation")
	class Navigation {

		private final SyntaxNode fn = TestKinds.sampleFn();

		@Test
		@DisplayName("children() can be iterated repeatedly with the same result")
		void childrenAreRestartable() {
			Iterable<SyntaxNode> nodes = fn.childNodes();

			List<SyntaxNode> first = new ArrayList<>();
			nodes.forEach(first::add);
			List<SyntaxNode> second = new ArrayList<>();
			nodes.forEach(second::add);

			assertThat(first).hasSize(3).containsExactlyElementsOf(second);
		}

		@Test
		void nthChildOfKindCountsOnlyThatKind() {
			SyntaxNode binExpr = fn.nthChildOfKind(BIN_EXPR, 0).orElseThrow();

			assertThat(binExpr.nthChildOfKind(LITERAL, 0)).map(SyntaxNode::text).contains("1");
			assertThat(binExpr.nthChildOfKind(LITERAL, 1)).map(SyntaxNode::text).contains("2");
			assertThat(binExpr.nthChildOfKind(LITERAL, 2)).isEmpty();
			assertThat(binExpr.nthTokenOfKind(PLUS, 0)).isPresent();
		}

		@Test
		void negativeIndexIsRejected() {
			assertThatThrownBy(() -> fn.nthChildOfKind(NAME, -1))
					.isInstanceOf(IndexOutOfBoundsException.class);
		}

		@Test
		void firstAndLastTokenDescendIntoNodes() {
			assertThat(fn.firstToken()).map(SyntaxToken::text).contains("fn");
			assertThat(fn.lastToken()).map(SyntaxToken::text).contains("2");
			assertThat(SyntaxFactory.buildNode(FN, SyntaxFactory.buildNode(NAME)).firstToken()).isEmpty();
		}

		@Test
		void textConcatenatesTokensInOrder() {
			assertThat(fn.text()).isEqualTo("fn main() 1 + 2");
			assertThat(fn.textLength()).isEqualTo(fn.text().length());
		}

		@Test
		void descendantsArePreOrder() {
			assertThat(fn.descendantNodes().map(SyntaxNode::kind))
					.containsExactly(FN, NAME, TestKinds.PARAM_LIST, BIN_EXPR, LITERAL, LITERAL);
		}

		@Test
		void debugDumpShowsOffsetsAndTokens() {
			String dump = SyntaxFactory.buildNode(NAME, SyntaxFactory.buildToken(IDENT, "x")).debugDump();

			assertThat(dump).isEqualTo("""
					NAME@0..1
					  IDENT@0..1 "x"
					""");
		}
	}

	@Test
	@DisplayName("a built tree can be read from many threads at once")
	void concurrentReads() throws Exception {
		SyntaxNode fn = TestKinds.sampleFn();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Callable<String>> readers = new ArrayList<>();
			for (int i = 0; i < 16; i++) {
				readers.add(() -> fn.text() + fn.nthChildOfKind(NAME, 0).map(SyntaxNode::text).orElse("?"));
			}
			for (Future<String> result : executor.invokeAll(readers)) {
				assertThat(result.get()).isEqualTo("fn main() 1 + 2main");
			}
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void nameHelperBuildsIdentifier() {
		assertThat(name("x").firstToken()).map(SyntaxToken::kind).contains(IDENT);
	}
}
