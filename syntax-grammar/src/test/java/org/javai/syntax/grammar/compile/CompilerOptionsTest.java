package org.javai.syntax.grammar.compile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompilerOptionsTest {

	@Test
	void bundledDefaultsDescribeTheTokenVocabulary() {
		CompilerOptions defaults = CompilerOptions.defaults();

		assertThat(defaults.primitiveTokens()).contains("ident", "int_number", "lifetime_ident");
		assertThat(defaults.triviaTokens()).containsExactly("whitespace", "comment");
		assertThat(defaults.extraNodes()).containsExactly("ERROR");
		assertThat(defaults.aliases()).contains(entry("TypeRef", "Type"), entry("RecordLit", "RecordExpr"));
		assertThat(defaults.punctuation()).contains(entry("::", "coloncolon"), entry("..=", "dot2eq"));
	}

	@Test
	void defaultsAreLoadedOnce() {
		assertThat(CompilerOptions.defaults()).isSameAs(CompilerOptions.defaults());
	}

	@Test
	void overrideReplacesOnlyTheKeysItNames() {
		CompilerOptions options = CompilerOptions.parse("""
				aliases:
				  Old: New
				extra_nodes: []
				""");

		assertThat(options.aliases()).containsExactly(entry("Old", "New"));
		assertThat(options.extraNodes()).isEmpty();
		assertThat(options.primitiveTokens()).isEqualTo(CompilerOptions.defaults().primitiveTokens());
		assertThat(options.punctuation()).isEqualTo(CompilerOptions.defaults().punctuation());
	}

	@Test
	void emptyOverrideIsTheDefaults() {
		assertThat(CompilerOptions.parse("")).isEqualTo(CompilerOptions.defaults());
	}

	@Test
	void loadsOverridesFromAFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("options.yml");
		Files.writeString(file, "trivia_tokens:\n  - whitespace\n");

		CompilerOptions options = CompilerOptions.load(file);

		assertThat(options.triviaTokens()).containsExactly("whitespace");
	}

	@Test
	void missingFileIsAnIllegalState(@TempDir Path dir) {
		assertThatThrownBy(() -> CompilerOptions.load(dir.resolve("absent.yml")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void topLevelMustBeAMapping() {
		assertThatThrownBy(() -> CompilerOptions.parse("- a\n- b\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be a YAML mapping");
	}

	@Test
	void listKeysMustHoldLists() {
		assertThatThrownBy(() -> CompilerOptions.parse("primitive_tokens: ident"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'primitive_tokens' must be a list");
	}

	@Test
	void malformedYamlIsAnIllegalArgument() {
		assertThatThrownBy(() -> CompilerOptions.parse("aliases: [unclosed"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Malformed compiler options");
	}

	@Test
	void withersReplaceOneComponent() {
		CompilerOptions options = CompilerOptions.defaults().withExtraNodes(List.of("ERROR", "MACRO_ITEMS"));

		assertThat(options.extraNodes()).containsExactly("ERROR", "MACRO_ITEMS");
		assertThat(options.aliases()).isEqualTo(CompilerOptions.defaults().aliases());
	}
}
