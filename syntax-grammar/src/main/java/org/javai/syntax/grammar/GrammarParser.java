package org.javai.syntax.grammar;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.javai.syntax.grammar.GrammarToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for the grammar DSL.
 * <p>
 * Both textual revisions of the systems-language grammar use the same notation:
 * <pre>
 * grammar  := definition*
 * definition := Name '=' '|'? alt
 * alt      := seq ('|' seq)*
 * seq      := postfix+
 * postfix  := atom ('*' | '?')*
 * atom     := label ':' postfix | Name | token_name | 'literal' | '(' alt ')'
 * </pre>
 * A sequence ends where the next definition begins ({@code Name =}). Upper-case identifiers
 * refer to definitions, lower-case identifiers to primitive token categories.
 */
public class GrammarParser {

	private static final Logger logger = LoggerFactory.getLogger(GrammarParser.class);

	/**
	 * Parse grammar text.
	 *
	 * @throws GrammarSyntaxException if the text is malformed
	 * @throws GrammarException if a definition name is repeated
	 */
	public Grammar parse(String text) {
		Grammar grammar = new Parser(new GrammarTokenizer(text).tokenize()).parseGrammar();
		logger.debug("Parsed grammar with {} definitions", grammar.size());
		return grammar;
	}

	/**
	 * Parse a grammar file (UTF-8).
	 */
	public Grammar parse(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			return parse(Files.readString(path, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read grammar from path: " + path, e);
		}
	}

	/**
	 * Parse a grammar from a stream (UTF-8). The stream is not closed.
	 */
	public Grammar parse(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		try {
			return parse(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read grammar from input stream", e);
		}
	}

	/**
	 * Parse a grammar from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 */
	public Grammar parseResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return parse(is);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read grammar resource: " + resourcePath, e);
		}
	}

	private static final class Parser {

		private final List<GrammarToken> tokens;
		private int pos = 0;

		Parser(List<GrammarToken> tokens) {
			this.tokens = tokens;
		}

		Grammar parseGrammar() {
			List<Definition> definitions = new ArrayList<>();
			while (!peek().isType(TokenType.EOF)) {
				definitions.add(parseDefinition());
			}
			return new Grammar(definitions);
		}

		private Definition parseDefinition() {
			GrammarToken name = expect(TokenType.IDENT, "definition name");
			expect(TokenType.EQ, "'=' after " + name.value());
			match(TokenType.PIPE);
			Rule rule = parseAlt();
			GrammarToken next = peek();
			if (next.isType(TokenType.RPAREN)) {
				throw error("Unbalanced parenthesis: unexpected ')'", next);
			}
			if (!next.isType(TokenType.EOF) && !next.isType(TokenType.IDENT)) {
				throw error("Unexpected " + describe(next) + " in definition " + name.value(), next);
			}
			return new Definition(name.value(), rule);
		}

		private Rule parseAlt() {
			List<Rule> alternatives = new ArrayList<>();
			alternatives.add(parseSeq());
			while (match(TokenType.PIPE)) {
				alternatives.add(parseSeq());
			}
			return alternatives.size() == 1 ? alternatives.get(0) : new Rule.Alt(alternatives);
		}

		private Rule parseSeq() {
			List<Rule> rules = new ArrayList<>();
			while (!atSeqEnd()) {
				rules.add(parsePostfix());
			}
			if (rules.isEmpty()) {
				throw error("Empty alternative", peek());
			}
			return rules.size() == 1 ? rules.get(0) : new Rule.Seq(rules);
		}

		private boolean atSeqEnd() {
			GrammarToken t = peek();
			return switch (t.type()) {
				case PIPE, RPAREN, EOF -> true;
				case IDENT -> peekAt(1).isType(TokenType.EQ);
				default -> false;
			};
		}

		private Rule parsePostfix() {
			Rule rule = parseAtom();
			while (true) {
				if (match(TokenType.STAR)) {
					rule = new Rule.Rep(rule);
				} else if (match(TokenType.QUESTION)) {
					rule = new Rule.Opt(rule);
				} else {
					return rule;
				}
			}
		}

		private Rule parseAtom() {
			GrammarToken t = advance();
			return switch (t.type()) {
				case IDENT -> {
					if (match(TokenType.COLON)) {
						yield new Rule.Labeled(t.value(), parsePostfix());
					}
					yield Character.isUpperCase(t.value().charAt(0))
							? new Rule.NodeRef(t.value())
							: new Rule.TokenRef(t.value());
				}
				case LITERAL -> new Rule.Literal(t.value());
				case LPAREN -> {
					Rule inner = parseAlt();
					if (!match(TokenType.RPAREN)) {
						throw error("Unbalanced parenthesis: missing ')' for '(' at line " + t.line()
								+ ", column " + t.column(), peek());
					}
					yield inner;
				}
				default -> throw error("Unexpected " + describe(t), t);
			};
		}

		private GrammarToken expect(TokenType type, String what) {
			GrammarToken t = peek();
			if (!t.isType(type)) {
				throw error("Expected " + what + " but found " + describe(t), t);
			}
			return advance();
		}

		private boolean match(TokenType type) {
			if (peek().isType(type)) {
				pos++;
				return true;
			}
			return false;
		}

		private GrammarToken peek() {
			return peekAt(0);
		}

		private GrammarToken peekAt(int offset) {
			int index = Math.min(pos + offset, tokens.size() - 1);
			return tokens.get(index);
		}

		private GrammarToken advance() {
			GrammarToken t = peek();
			if (!t.isType(TokenType.EOF)) {
				pos++;
			}
			return t;
		}

		private static String describe(GrammarToken t) {
			return t.isType(TokenType.EOF) ? "end of input" : "'" + t.value() + "'";
		}

		private static GrammarSyntaxException error(String message, GrammarToken at) {
			return new GrammarSyntaxException(message, at.line(), at.column());
		}
	}
}
