package org.javai.syntax.grammar.generate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import javax.lang.model.SourceVersion;

import org.javai.syntax.ast.ChildAnchor;
import org.javai.syntax.grammar.GrammarException;
import org.javai.syntax.grammar.compile.Cardinality;
import org.javai.syntax.grammar.compile.CompiledDefinition;
import org.javai.syntax.grammar.compile.CompiledGrammar;
import org.javai.syntax.grammar.compile.FieldSpec;
import org.javai.syntax.grammar.compile.FieldTarget;
import org.javai.syntax.grammar.compile.Names;
import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the typed facade for a compiled grammar.
 * <p>
 * Output, all in one package:
 * <ul>
 *   <li>a kinds class with one {@code TokenKind} or {@code NodeKind} constant per kind;</li>
 *   <li>per product definition, a final wrapper with a {@code TYPE} descriptor, a static
 *       {@code cast} and one accessor per field;</li>
 *   <li>per sum definition, a final wrapper with {@code cast}, {@code downcastMember()} and one
 *       {@code asMember()} narrowing per member. Members do not extend their sums.</li>
 * </ul>
 * Wrappers hold only the node reference; accessors read the tree on every call.
 */
public final class FacadeGenerator {

	private static final Logger logger = LoggerFactory.getLogger(FacadeGenerator.class);

	/**
	 * Simple names the generated code imports or relies on.
	 */
	private static final Set<String> RESERVED_CLASS_NAMES = Set.of("AstChildren", "AstNode", "AstNodeType",
			"AstSupport", "SyntaxNode", "SyntaxToken", "NodeKind", "TokenKind", "List", "Set", "Map", "HashMap",
			"Optional", "Object", "String", "Override", "Integer", "System");

	/**
	 * Member names of {@code AstNode}, {@code Object} and the generated classes themselves.
	 */
	private static final Set<String> RESERVED_METHOD_NAMES = Set.of("syntax", "kind", "text", "cast", "canCast",
			"downcastMember", "equals", "hashCode", "toString", "getClass", "notify", "notifyAll", "wait", "clone",
			"finalize");

	private final String packageName;
	private final String kindsClassName;

	public FacadeGenerator(String packageName, String kindsClassName) {
		this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
		this.kindsClassName = Objects.requireNonNull(kindsClassName, "kindsClassName must not be null");
		if (!SourceVersion.isName(packageName)) {
			throw new IllegalArgumentException("Not a valid package name: " + packageName);
		}
		if (!SourceVersion.isIdentifier(kindsClassName) || SourceVersion.isKeyword(kindsClassName)) {
			throw new IllegalArgumentException("Not a valid class name: " + kindsClassName);
		}
	}

	/**
	 * Generates all sources for the grammar.
	 *
	 * @throws GrammarException if a definition name cannot be used as a class name
	 */
	public List<GeneratedSource> generate(CompiledGrammar grammar) {
		checkClassNames(grammar);
		List<GeneratedSource> sources = new ArrayList<>();
		sources.add(source(kindsClassName, kindsClass(grammar)));
		for (CompiledDefinition definition : grammar.definitions()) {
			String content = definition.isSum() ? sumClass(grammar, definition) : productClass(grammar, definition);
			sources.add(source(definition.name(), content));
		}
		return sources;
	}

	/**
	 * Generates and writes all sources below {@code outputRoot}.
	 */
	public List<Path> write(CompiledGrammar grammar, Path outputRoot) throws IOException {
		List<Path> written = new ArrayList<>();
		for (GeneratedSource source : generate(grammar)) {
			written.add(source.writeTo(outputRoot));
		}
		logger.info("Generated {} facade sources for package {} in {}", written.size(), packageName, outputRoot);
		return written;
	}

	private GeneratedSource source(String className, String content) {
		return new GeneratedSource(packageName.replace('.', '/') + "/" + className + ".java", content);
	}

	private void checkClassNames(CompiledGrammar grammar) {
		for (CompiledDefinition definition : grammar.definitions()) {
			String name = definition.name();
			if (!SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)
					|| RESERVED_CLASS_NAMES.contains(name) || name.equals(kindsClassName)) {
				throw new GrammarException("Definition name " + name + " cannot be used as a generated class name");
			}
		}
	}

	// ---- kinds

	private String kindsClass(CompiledGrammar grammar) {
		List<TokenKind> tokens = grammar.kinds().tokenKinds();
		List<NodeKind> nodes = grammar.kinds().nodeKinds();
		StringBuilder sb = new StringBuilder();
		header(sb, List.of("java.util.HashMap", "java.util.List", "java.util.Map", "java.util.Optional",
				"org.javai.syntax.tree.NodeKind", "org.javai.syntax.tree.TokenKind"));
		sb.append("/**\n");
		sb.append(" * Token and node kinds of the grammar. Generated; do not edit.\n");
		sb.append(" */\n");
		sb.append("public final class ").append(kindsClassName).append(" {\n\n");
		for (TokenKind token : tokens) {
			sb.append("\tpublic static final TokenKind ").append(token.name()).append(" = new TokenKind(")
					.append(token.id()).append(", \"").append(token.name()).append("\", ")
					.append(token.text().map(FacadeGenerator::javaString).orElse("null")).append(", ")
					.append(token.trivia()).append(");\n");
		}
		sb.append('\n');
		for (NodeKind node : nodes) {
			sb.append("\tpublic static final NodeKind ").append(node.name()).append(" = new NodeKind(")
					.append(node.id()).append(", \"").append(node.name()).append("\");\n");
		}
		sb.append('\n');
		sb.append("\tpublic static final List<TokenKind> TOKEN_KINDS = List.of(")
				.append(wrapList(tokens.stream().map(TokenKind::name).toList())).append(");\n\n");
		sb.append("\tpublic static final List<NodeKind> NODE_KINDS = List.of(")
				.append(wrapList(nodes.stream().map(NodeKind::name).toList())).append(");\n\n");
		sb.append("\tprivate static final Map<String, TokenKind> FIXED_TOKENS = new HashMap<>();\n\n");
		sb.append("\tstatic {\n");
		sb.append("\t\tfor (TokenKind kind : TOKEN_KINDS) {\n");
		sb.append("\t\t\tkind.text().ifPresent(text -> FIXED_TOKENS.put(text, kind));\n");
		sb.append("\t\t}\n");
		sb.append("\t}\n\n");
		sb.append("\tprivate ").append(kindsClassName).append("() {\n");
		sb.append("\t}\n\n");
		sb.append("\t/**\n");
		sb.append("\t * The token kind spelled by fixed text such as {@code ::}.\n");
		sb.append("\t */\n");
		sb.append("\tpublic static Optional<TokenKind> fixedToken(String text) {\n");
		sb.append("\t\treturn Optional.ofNullable(FIXED_TOKENS.get(text));\n");
		sb.append("\t}\n\n");
		sb.append("\tpublic static Optional<TokenKind> tokenKind(String name) {\n");
		sb.append("\t\treturn TOKEN_KINDS.stream().filter(k -> k.name().equals(name)).findFirst();\n");
		sb.append("\t}\n\n");
		sb.append("\tpublic static Optional<NodeKind> nodeKind(String name) {\n");
		sb.append("\t\treturn NODE_KINDS.stream().filter(k -> k.name().equals(name)).findFirst();\n");
		sb.append("\t}\n");
		sb.append("}\n");
		return sb.toString();
	}

	// ---- products

	private String productClass(CompiledGrammar grammar, CompiledDefinition definition) {
		String name = definition.name();
		StringBuilder sb = new StringBuilder();
		header(sb, List.of("java.util.List", "java.util.Optional", "java.util.Set",
				"org.javai.syntax.ast.AstChildren", "org.javai.syntax.ast.AstNode", "org.javai.syntax.ast.AstNodeType",
				"org.javai.syntax.ast.AstSupport", "org.javai.syntax.ast.ChildAnchor", "org.javai.syntax.tree.NodeKind",
				"org.javai.syntax.tree.SyntaxNode",
				"org.javai.syntax.tree.SyntaxToken", "org.javai.syntax.tree.TokenKind"));
		classDoc(sb, definition);
		sb.append("public final class ").append(name).append(" implements AstNode {\n\n");
		sb.append("\tpublic static final AstNodeType<").append(name).append("> TYPE = AstNodeType.product(\"")
				.append(name).append("\", ").append(kindsClassName).append('.').append(definition.kind().name())
				.append(", ").append(name).append("::new);\n");
		for (FieldSpec field : definition.fields()) {
			if (field.target() instanceof FieldTarget.Sum sum && sum.isInline()) {
				sb.append("\n\tprivate static final AstNodeType<AstNode> ").append(helperConstant(field, "TYPE"))
						.append(" = AstNodeType.anyOf(\"").append(name).append('.').append(field.name())
						.append("\",\n\t\t\tSet.of(").append(kindConstants(sum.accepted()))
						.append("),\n\t\t\t() -> List.of(")
						.append(sum.members().stream().map(m -> m + ".TYPE").collect(Collectors.joining(", ")))
						.append("));\n");
			} else if (field.target() instanceof FieldTarget.Token token && token.kinds().size() > 1) {
				sb.append("\n\tprivate static final Set<TokenKind> ").append(helperConstant(field, "KINDS"))
						.append(" = Set.of(")
						.append(token.kinds().stream().distinct().map(k -> kindsClassName + "." + k.name())
								.collect(Collectors.joining(", ")))
						.append(");\n");
			}
			if (usesSlot(field)) {
				sb.append("\n\tprivate static final Set<NodeKind> ").append(helperConstant(field, "SLOT"))
						.append(" = Set.of(").append(kindConstants(definition.slotKinds(field))).append(");\n");
			}
			if (field.anchor() != null) {
				ChildAnchor anchor = field.anchor();
				sb.append("\tprivate static final ChildAnchor ").append(helperConstant(field, "ANCHOR"))
						.append(" = ChildAnchor.").append(anchor.side().name()).append("(Set.of(")
						.append(anchor.tokens().stream().map(k -> kindsClassName + "." + k.name())
								.collect(Collectors.joining(", ")))
						.append("), ").append(anchor.index()).append(", ").append(anchor.fallback()).append(");\n");
			}
		}
		wrapperCore(sb, name);
		for (FieldSpec field : definition.fields()) {
			accessor(sb, field);
		}
		wrapperObjectMethods(sb, name);
		sb.append("}\n");
		return sb.toString();
	}

	private void accessor(StringBuilder sb, FieldSpec field) {
		boolean many = field.cardinality() == Cardinality.many;
		String method = methodName(field);
		String returnType;
		String body;
		if (field.target() instanceof FieldTarget.Token token) {
			String kinds = token.kinds().size() > 1
					? helperConstant(field, "KINDS")
					: kindsClassName + "." + token.kinds().get(0).name();
			returnType = many ? "List<SyntaxToken>" : "Optional<SyntaxToken>";
			body = many ? "AstSupport.tokens(syntax, " + kinds + ")"
					: "AstSupport.token(syntax, " + kinds + ", " + field.position() + ")";
		} else {
			String wrapper;
			String type;
			if (field.target() instanceof FieldTarget.Sum sum && sum.isInline()) {
				wrapper = "AstNode";
				type = helperConstant(field, "TYPE");
			} else {
				wrapper = field.target() instanceof FieldTarget.Sum sum ? sum.definition()
						: ((FieldTarget.Node) field.target()).definition();
				type = wrapper + ".TYPE";
			}
			returnType = many ? "AstChildren<" + wrapper + ">" : "Optional<" + wrapper + ">";
			if (many) {
				body = "AstSupport.children(syntax, " + type + ")";
			} else if (field.anchor() != null) {
				body = "AstSupport.child(syntax, " + type + ", " + helperConstant(field, "SLOT") + ", "
						+ helperConstant(field, "ANCHOR") + ")";
			} else if (usesSlot(field)) {
				body = "AstSupport.child(syntax, " + type + ", " + helperConstant(field, "SLOT") + ", "
						+ field.position() + ")";
			} else {
				body = "AstSupport.child(syntax, " + type + ", " + field.position() + ")";
			}
		}
		sb.append("\n\t/**\n");
		sb.append("\t * {@code ").append(field.name()).append("}: ").append(describe(field)).append(".\n");
		sb.append("\t */\n");
		sb.append("\tpublic ").append(returnType).append(' ').append(method).append("() {\n");
		sb.append("\t\treturn ").append(body).append(";\n");
		sb.append("\t}\n");
	}

	private String describe(FieldSpec field) {
		String target = escapeDoc(field.target().toString());
		String where;
		if (field.anchor() != null) {
			where = ", " + field.anchor().side() + " " + field.anchor().tokens().stream()
					.map(TokenKind::name).collect(Collectors.joining(" or "));
		} else {
			where = field.position() > 0 ? ", occurrence " + (field.position() + 1) : "";
		}
		return switch (field.cardinality()) {
			case one -> "one " + target + where;
			case optional -> "optional " + target + where;
			case many -> "zero or more " + target;
		};
	}

	// ---- sums

	private String sumClass(CompiledGrammar grammar, CompiledDefinition definition) {
		String name = definition.name();
		StringBuilder sb = new StringBuilder();
		header(sb, List.of("java.util.List", "java.util.Optional", "java.util.Set", "org.javai.syntax.ast.AstNode",
				"org.javai.syntax.ast.AstNodeType", "org.javai.syntax.tree.SyntaxNode"));
		classDoc(sb, definition);
		sb.append("public final class ").append(name).append(" implements AstNode {\n\n");
		sb.append("\tpublic static final AstNodeType<").append(name).append("> TYPE = AstNodeType.sum(\"")
				.append(name).append("\", ").append(kindsClassName).append('.').append(definition.kind().name())
				.append(",\n\t\t\tSet.of(").append(kindConstants(definition.memberKinds())).append("),\n\t\t\t")
				.append(name).append("::new,\n\t\t\t() -> List.of(")
				.append(definition.members().stream().map(m -> m + ".TYPE").collect(Collectors.joining(", ")))
				.append("));\n");
		wrapperCore(sb, name);
		sb.append("\n\t/**\n");
		sb.append("\t * The member wrapper for this node, trying members in declaration order. Empty if the\n");
		sb.append("\t * node has the sum's own kind or a kind no member claims.\n");
		sb.append("\t */\n");
		sb.append("\tpublic Optional<AstNode> downcastMember() {\n");
		sb.append("\t\treturn TYPE.downcastMember(syntax);\n");
		sb.append("\t}\n");
		for (String member : definition.members()) {
			sb.append("\n\tpublic Optional<").append(member).append("> as").append(member).append("() {\n");
			sb.append("\t\treturn ").append(member).append(".cast(syntax);\n");
			sb.append("\t}\n");
		}
		wrapperObjectMethods(sb, name);
		sb.append("}\n");
		return sb.toString();
	}

	// ---- shared pieces

	private void header(StringBuilder sb, List<String> imports) {
		sb.append("package ").append(packageName).append(";\n\n");
		String previousRoot = null;
		for (String imported : imports) {
			String root = imported.startsWith("java.") ? "java" : "other";
			if (previousRoot != null && !previousRoot.equals(root)) {
				sb.append('\n');
			}
			sb.append("import ").append(imported).append(";\n");
			previousRoot = root;
		}
		sb.append('\n');
	}

	private void classDoc(StringBuilder sb, CompiledDefinition definition) {
		sb.append("/**\n");
		sb.append(" * ").append(definition.isSum() ? "Sum" : "Product").append(" wrapper for {@code ")
				.append(definition.kind().name()).append("} nodes. Generated; do not edit.\n");
		sb.append(" * <pre>\n");
		sb.append(" * ").append(escapeDoc(definition.name() + " = " + definition.rule())).append('\n');
		sb.append(" * </pre>\n");
		sb.append(" */\n");
	}

	private void wrapperCore(StringBuilder sb, String name) {
		sb.append("\n\tprivate final SyntaxNode syntax;\n\n");
		sb.append("\tprivate ").append(name).append("(SyntaxNode syntax) {\n");
		sb.append("\t\tthis.syntax = syntax;\n");
		sb.append("\t}\n\n");
		sb.append("\t/**\n");
		sb.append("\t * Wraps {@code node} if its kind is accepted by this wrapper.\n");
		sb.append("\t */\n");
		sb.append("\tpublic static Optional<").append(name).append("> cast(SyntaxNode node) {\n");
		sb.append("\t\treturn TYPE.cast(node);\n");
		sb.append("\t}\n\n");
		sb.append("\t@Override\n");
		sb.append("\tpublic SyntaxNode syntax() {\n");
		sb.append("\t\treturn syntax;\n");
		sb.append("\t}\n");
	}

	private void wrapperObjectMethods(StringBuilder sb, String name) {
		sb.append("\n\t@Override\n");
		sb.append("\tpublic boolean equals(Object o) {\n");
		sb.append("\t\treturn o instanceof ").append(name).append(" other && other.syntax == syntax;\n");
		sb.append("\t}\n\n");
		sb.append("\t@Override\n");
		sb.append("\tpublic int hashCode() {\n");
		sb.append("\t\treturn System.identityHashCode(syntax);\n");
		sb.append("\t}\n\n");
		sb.append("\t@Override\n");
		sb.append("\tpublic String toString() {\n");
		sb.append("\t\treturn \"").append(name).append("(\" + syntax + \")\";\n");
		sb.append("\t}\n");
	}

	private static boolean usesSlot(FieldSpec field) {
		return !field.isToken() && field.cardinality() != Cardinality.many
				&& (field.position() > 0 || field.anchor() != null);
	}

	private String kindConstants(Set<NodeKind> kinds) {
		return new LinkedHashSet<>(kinds).stream()
				.map(k -> kindsClassName + "." + k.name())
				.collect(Collectors.joining(", "));
	}

	private static String helperConstant(FieldSpec field, String suffix) {
		return Names.upperSnake(field.name()) + "_" + suffix;
	}

	/**
	 * Accessor name: camelCase of the field name, suffixed where it would clash with a Java
	 * keyword or an inherited member.
	 */
	static String methodName(FieldSpec field) {
		String name = Names.camel(field.name());
		if (SourceVersion.isKeyword(name) || RESERVED_METHOD_NAMES.contains(name)) {
			name = name + (field.isToken() ? "Token" : "Node");
		}
		return name;
	}

	private static String wrapList(List<String> names) {
		StringBuilder sb = new StringBuilder("\n\t\t\t");
		int lineLength = 0;
		for (int i = 0; i < names.size(); i++) {
			String item = names.get(i) + (i + 1 < names.size() ? "," : "");
			if (lineLength > 0 && lineLength + item.length() > 90) {
				sb.append("\n\t\t\t");
				lineLength = 0;
			} else if (lineLength > 0) {
				sb.append(' ');
				lineLength++;
			}
			sb.append(item);
			lineLength += item.length();
		}
		return sb.toString();
	}

	static String javaString(String text) {
		StringBuilder sb = new StringBuilder("\"");
		for (char c : text.toCharArray()) {
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}

	static String escapeDoc(String text) {
		return text.replace("&", "&amp;")
				.replace("<", "&lt;")
				.replace(">", "&gt;")
				.replace("{", "&#123;")
				.replace("}", "&#125;")
				.replace("@", "&#64;")
				.replace("*/", "*&#47;");
	}
}
