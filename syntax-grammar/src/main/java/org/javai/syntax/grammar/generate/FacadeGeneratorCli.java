package org.javai.syntax.grammar.generate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.javai.syntax.grammar.Grammar;
import org.javai.syntax.grammar.GrammarParser;
import org.javai.syntax.grammar.compile.CompiledGrammar;
import org.javai.syntax.grammar.compile.CompilerOptions;
import org.javai.syntax.grammar.compile.GrammarCompiler;

/**
 * Command line entry point used by the build to generate a facade from a grammar file.
 * <p>
 * Options:
 * <pre>
 *   --grammar PATH       grammar file (required)
 *   --package NAME       package of the generated classes (required)
 *   --kinds-class NAME   simple name of the kinds class (required)
 *   --output DIR         source root to write into (required)
 *   --options PATH       compiler options YAML overlaying the defaults
 *   --json PATH          also write the compiled grammar as JSON
 * </pre>
 * Runs inside the build JVM, so it reports failure by throwing rather than exiting.
 */
public final class FacadeGeneratorCli {

	private static final List<String> REQUIRED = List.of("--grammar", "--package", "--kinds-class", "--output");
	private static final Set<String> KNOWN = Set.of("--grammar", "--package", "--kinds-class", "--output",
			"--options", "--json");

	private FacadeGeneratorCli() {}

	public static void main(String[] args) {
		try {
			run(args);
		} catch (Exception e) {
			System.err.println("Failed to generate syntax facade: " + e.getMessage());
			throw e instanceof IllegalStateException ise ? ise
					: new IllegalStateException("Failed to generate syntax facade", e);
		}
	}

	/**
	 * Parses the arguments, compiles the grammar and writes the facade.
	 *
	 * @return the written source files
	 */
	public static List<Path> run(String[] args) throws IOException {
		Map<String, String> options = parseArgs(args);
		Path grammarFile = Path.of(options.get("--grammar"));
		Path output = Path.of(options.get("--output"));

		CompilerOptions compilerOptions = options.containsKey("--options")
				? CompilerOptions.load(Path.of(options.get("--options")))
				: CompilerOptions.defaults();

		Grammar grammar = new GrammarParser().parse(grammarFile);
		CompiledGrammar compiled = new GrammarCompiler(compilerOptions).compile(grammar);

		FacadeGenerator generator = new FacadeGenerator(options.get("--package"), options.get("--kinds-class"));
		List<Path> written = generator.write(compiled, output);

		if (options.containsKey("--json")) {
			Path json = Path.of(options.get("--json"));
			if (json.getParent() != null) {
				Files.createDirectories(json.getParent());
			}
			Files.writeString(json, CompiledGrammarJsonEmitter.emitString(compiled), StandardCharsets.UTF_8);
		}
		return written;
	}

	static Map<String, String> parseArgs(String[] args) {
		Map<String, String> options = new LinkedHashMap<>();
		for (int i = 0; i < args.length; i++) {
			String name = args[i];
			if (!KNOWN.contains(name)) {
				throw new IllegalArgumentException("Unknown option: " + name);
			}
			if (i + 1 >= args.length) {
				throw new IllegalArgumentException("Missing value for option " + name);
			}
			options.put(name, args[++i]);
		}
		for (String required : REQUIRED) {
			if (!options.containsKey(required)) {
				throw new IllegalArgumentException("Missing required option " + required);
			}
		}
		return options;
	}
}
