package org.javai.syntax.grammar.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.javai.syntax.grammar.GrammarException;
import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.TokenKind;

/**
 * The node and token kinds allocated for a grammar.
 * <p>
 * Ids are dense and stable for a given grammar text and options: token kinds are numbered
 * primitives first, then trivia, then literal tokens in order of first appearance; node kinds
 * follow definition order, then the extra nodes. Constant names must be unique across both
 * sets because generated code declares them side by side.
 */
public final class KindTable {

	private final List<TokenKind> tokenKinds;
	private final List<NodeKind> nodeKinds;
	private final Map<String, TokenKind> primitives;
	private final Map<String, TokenKind> literals;
	private final Map<TokenKind, String> stems;
	private final Map<String, NodeKind> definitions;
	private final Map<String, Object> byConstant;

	private KindTable(Builder builder) {
		this.tokenKinds = List.copyOf(builder.tokenKinds);
		this.nodeKinds = List.copyOf(builder.nodeKinds);
		this.primitives = Collections.unmodifiableMap(new LinkedHashMap<>(builder.primitives));
		this.literals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.literals));
		this.stems = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stems));
		this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.definitions));
		this.byConstant = Collections.unmodifiableMap(new LinkedHashMap<>(builder.byConstant));
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<TokenKind> tokenKinds() {
		return tokenKinds;
	}

	public List<NodeKind> nodeKinds() {
		return nodeKinds;
	}

	/**
	 * The token kind of a primitive category such as {@code ident}.
	 */
	public Optional<TokenKind> primitive(String name) {
		return Optional.ofNullable(primitives.get(name));
	}

	/**
	 * The token kind of fixed token text such as {@code ::} or {@code fn}.
	 */
	public Optional<TokenKind> literal(String text) {
		return Optional.ofNullable(literals.get(text));
	}

	/**
	 * The node kind of a definition, by definition name.
	 */
	public Optional<NodeKind> definitionKind(String definition) {
		return Optional.ofNullable(definitions.get(definition));
	}

	public Optional<TokenKind> tokenKind(String constantName) {
		return byConstant.get(constantName) instanceof TokenKind kind ? Optional.of(kind) : Optional.empty();
	}

	public Optional<NodeKind> nodeKind(String constantName) {
		return byConstant.get(constantName) instanceof NodeKind kind ? Optional.of(kind) : Optional.empty();
	}

	/**
	 * The word used to name fields of this token kind: {@code fn}, {@code semicolon}, {@code ident}.
	 */
	public String fieldStem(TokenKind kind) {
		String stem = stems.get(kind);
		if (stem == null) {
			throw new IllegalArgumentException("Unknown token kind: " + kind);
		}
		return stem;
	}

	public List<TokenKind> triviaKinds() {
		return tokenKinds.stream().filter(TokenKind::trivia).toList();
	}

	public static final class Builder {

		private final List<TokenKind> tokenKinds = new ArrayList<>();
		private final List<NodeKind> nodeKinds = new ArrayList<>();
		private final Map<String, TokenKind> primitives = new LinkedHashMap<>();
		private final Map<String, TokenKind> literals = new LinkedHashMap<>();
		private final Map<TokenKind, String> stems = new LinkedHashMap<>();
		private final Map<String, NodeKind> definitions = new LinkedHashMap<>();
		private final Map<String, Object> byConstant = new LinkedHashMap<>();

		private Builder() {
		}

		public TokenKind primitive(String name) {
			TokenKind kind = addToken(Names.upperSnake(name), null, false, name);
			primitives.put(name, kind);
			return kind;
		}

		public TokenKind trivia(String name) {
			return addToken(Names.upperSnake(name), null, true, name);
		}

		/**
		 * Registers fixed token text once; later calls with the same text return the same kind.
		 */
		public TokenKind literal(String text, String constantName, String stem) {
			TokenKind existing = literals.get(text);
			if (existing != null) {
				return existing;
			}
			TokenKind kind = addToken(constantName, text, false, stem);
			literals.put(text, kind);
			return kind;
		}

		public Optional<TokenKind> knownLiteral(String text) {
			return Optional.ofNullable(literals.get(text));
		}

		public NodeKind definition(String definition) {
			NodeKind kind = addNode(Names.upperSnake(definition));
			definitions.put(definition, kind);
			return kind;
		}

		public NodeKind extraNode(String constantName) {
			return addNode(constantName);
		}

		public KindTable build() {
			return new KindTable(this);
		}

		private TokenKind addToken(String constantName, String fixedText, boolean trivia, String stem) {
			TokenKind kind = new TokenKind(tokenKinds.size(), constantName, fixedText, trivia);
			claim(constantName, kind);
			tokenKinds.add(kind);
			stems.put(kind, stem);
			return kind;
		}

		private NodeKind addNode(String constantName) {
			NodeKind kind = new NodeKind(nodeKinds.size(), constantName);
			claim(constantName, kind);
			nodeKinds.add(kind);
			return kind;
		}

		private void claim(String constantName, Object kind) {
			Object previous = byConstant.putIfAbsent(constantName, kind);
			if (previous != null) {
				throw new GrammarException("Kind name collision: " + constantName + " is used by both "
						+ describe(previous) + " and " + describe(kind));
			}
		}

		private static String describe(Object kind) {
			if (kind instanceof TokenKind token) {
				return token.text().map(t -> "token '" + t + "'").orElse("token " + token.name());
			}
			return "node " + kind;
		}
	}
}
