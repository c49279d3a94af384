package org.javai.syntax.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.syntax.ast.AstNode;
import org.javai.syntax.tree.SyntaxFactory;
import org.javai.syntax.tree.SyntaxNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Exercises a facade generated at build time from a four-definition grammar.
 */
class ScenarioFacadeTest {

	private static SyntaxNode bar() {
		return SyntaxFactory.buildNode(ScenarioKinds.BAR, SyntaxFactory.buildToken(ScenarioKinds.BAR_KW));
	}

	private static SyntaxNode baz() {
		return SyntaxFactory.buildNode(ScenarioKinds.BAZ, SyntaxFactory.buildToken(ScenarioKinds.BAZ_KW));
	}

	@Nested
	@DisplayName("Products")
	class Products {

		@Test
		void accessorsReadTheTree() {
			SyntaxNode bar = bar();
			SyntaxNode firstBaz = baz();
			SyntaxNode secondBaz = baz();
			SyntaxNode node = SyntaxFactory.buildNode(ScenarioKinds.FOO,
					SyntaxFactory.buildToken(ScenarioKinds.A_KW), bar, firstBaz, secondBaz);

			Foo foo = Foo.cast(node).orElseThrow();

			assertThat(foo.syntax()).isSameAs(node);
			assertThat(foo.text()).isEqualTo("abarbazbaz");
			assertThat(foo.aToken()).hasValueSatisfying(t -> assertThat(t.text()).isEqualTo("a"));
			assertThat(foo.bar()).hasValueSatisfying(b -> assertThat(b.syntax()).isSameAs(bar));
			assertThat(foo.baz().count()).isEqualTo(2);
			assertThat(foo.baz().toList()).extracting(Baz::syntax).containsExactly(firstBaz, secondBaz);
		}

		@Test
		void absentOptionalAndRepeatedFieldsAreEmpty() {
			Foo foo = Foo.cast(SyntaxFactory.buildNode(ScenarioKinds.FOO, SyntaxFactory.buildToken(ScenarioKinds.A_KW)))
					.orElseThrow();

			assertThat(foo.aToken()).hasValueSatisfying(t -> assertThat(t.text()).isEqualTo("a"));
			assertThat(foo.bar()).isEmpty();
			assertThat(foo.baz().isEmpty()).isTrue();
			assertThat(foo.baz().toList()).isEmpty();
		}

		@Test
		void emptyNodeHasNoFields() {
			Foo foo = Foo.cast(SyntaxFactory.buildNode(ScenarioKinds.FOO)).orElseThrow();

			assertThat(foo.aToken()).isEmpty();
			assertThat(foo.bar()).isEmpty();
		}

		@Test
		void castRejectsOtherKinds() {
			assertThat(Foo.cast(bar())).isEmpty();
			assertThat(Foo.TYPE.canCast(ScenarioKinds.BAR)).isFalse();
		}

		@Test
		void equalityFollowsNodeIdentity() {
			SyntaxNode node = bar();

			assertThat(Bar.cast(node).orElseThrow()).isEqualTo(Bar.cast(node).orElseThrow());
			assertThat(Bar.cast(node).orElseThrow()).isNotEqualTo(Bar.cast(bar()).orElseThrow());
		}
	}

	@Nested
	@DisplayName("Sums")
	class Sums {

		@Test
		void downcastFindsTheMember() {
			SyntaxNode node = baz();
			Item item = Item.cast(node).orElseThrow();

			AstNode member = item.downcastMember().orElseThrow();

			assertThat(member).isInstanceOf(Baz.class);
			assertThat(member.syntax()).isSameAs(node);
			assertThat(item.asBaz()).isPresent();
			assertThat(item.asBar()).isEmpty();
		}

		@Test
		void downcastOfTheFirstMember() {
			Item item = Item.cast(bar()).orElseThrow();

			assertThat(item.downcastMember()).containsInstanceOf(Bar.class);
			assertThat(item.asBaz()).isEmpty();
		}

		@Test
		void sumKindItselfHasNoMember() {
			Item item = Item.cast(SyntaxFactory.buildNode(ScenarioKinds.ITEM, bar())).orElseThrow();

			assertThat(item.downcastMember()).isEmpty();
		}

		@Test
		void nonMembersAreRejected() {
			assertThat(Item.cast(SyntaxFactory.buildNode(ScenarioKinds.FOO))).isEmpty();
		}
	}

	@Test
	void fixedTextLooksUpKeywords() {
		assertThat(ScenarioKinds.fixedToken("bar")).contains(ScenarioKinds.BAR_KW);
		assertThat(ScenarioKinds.fixedToken("qux")).isEmpty();
		assertThat(ScenarioKinds.nodeKind("FOO")).contains(ScenarioKinds.FOO);
	}
}
