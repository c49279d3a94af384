package org.javai.syntax.rust;

import org.javai.syntax.grammar.Grammar;
import org.javai.syntax.grammar.GrammarParser;
import org.javai.syntax.grammar.compile.CompiledGrammar;
import org.javai.syntax.grammar.compile.GrammarCompiler;
import org.javai.syntax.grammar.validate.ShapeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access to the grammar the {@code org.javai.syntax.rust.ast} facade is generated from.
 * <p>
 * The facade itself never consults the grammar at run time. Tooling that wants to inspect
 * definitions or validate trees loads it from here; the grammar is parsed and compiled once,
 * on first use, and shared afterwards.
 */
public final class RustGrammar {

	private static final Logger logger = LoggerFactory.getLogger(RustGrammar.class);

	/**
	 * Classpath location of the grammar text.
	 */
	public static final String RESOURCE = "org/javai/syntax/rust/rust.ungram";

	private RustGrammar() {
	}

	/**
	 * The parsed, uncompiled grammar. Parsed anew on every call.
	 */
	public static Grammar grammar() {
		return new GrammarParser().parseResource(RESOURCE, RustGrammar.class.getClassLoader());
	}

	/**
	 * The compiled grammar, with the same kind ids as {@code RustKinds}.
	 */
	public static CompiledGrammar compiled() {
		return Holder.COMPILED;
	}

	/**
	 * A shape validator for trees of this language.
	 */
	public static ShapeValidator validator() {
		return new ShapeValidator(compiled());
	}

	private static final class Holder {

		private static final CompiledGrammar COMPILED = load();

		private static CompiledGrammar load() {
			Grammar grammar = grammar();
			CompiledGrammar compiled = new GrammarCompiler().compile(grammar);
			logger.debug("Loaded grammar from {}: {}", RESOURCE, compiled.summary());
			return compiled;
		}
	}
}
