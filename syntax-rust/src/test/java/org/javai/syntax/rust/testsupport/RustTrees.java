package org.javai.syntax.rust.testsupport;

import java.util.ArrayList;
import java.util.List;

import org.javai.syntax.rust.ast.RustKinds;
import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxCursor;
import org.javai.syntax.tree.SyntaxElement;
import org.javai.syntax.tree.SyntaxFactory;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.javai.syntax.tree.TokenKind;

/**
 * Builds small trees of the systems language by hand, the way its parser would.
 */
public final class RustTrees {

	private RustTrees() {
	}

	public static SyntaxNode node(NodeKind kind, SyntaxElement... children) {
		return SyntaxFactory.buildNode(kind, children);
	}

	public static SyntaxToken token(TokenKind kind) {
		return SyntaxFactory.buildToken(kind);
	}

	public static SyntaxToken ident(String text) {
		return SyntaxFactory.buildToken(RustKinds.IDENT, text);
	}

	public static SyntaxToken space() {
		return SyntaxFactory.buildToken(RustKinds.WHITESPACE, " ");
	}

	public static SyntaxToken comment(String text) {
		return SyntaxFactory.buildToken(RustKinds.COMMENT, text);
	}

	public static SyntaxNode nameRef(String name) {
		return node(RustKinds.NAME_REF, ident(name));
	}

	public static SyntaxNode path(String name) {
		return node(RustKinds.PATH, node(RustKinds.PATH_SEGMENT, nameRef(name)));
	}

	/**
	 * {@code name}
	 */
	public static SyntaxNode pathExpr(String name) {
		return node(RustKinds.PATH_EXPR, path(name));
	}

	/**
	 * An integer literal.
	 */
	public static SyntaxNode literal(String digits) {
		return node(RustKinds.LITERAL, SyntaxFactory.buildToken(RustKinds.INT_NUMBER, digits));
	}

	/**
	 * {@code lhs op rhs}
	 */
	public static SyntaxNode binary(SyntaxNode lhs, TokenKind op, SyntaxNode rhs) {
		return node(RustKinds.BIN_EXPR, lhs, space(), token(op), space(), rhs);
	}

	/**
	 * {@code callee(arg, arg)}
	 */
	public static SyntaxNode call(String callee, SyntaxElement... args) {
		return node(RustKinds.CALL_EXPR, pathExpr(callee), argList(args));
	}

	/**
	 * An argument list; commas and spaces go between arguments that are nodes. Tokens are
	 * inserted as given, so trivia and stray commas can be placed exactly.
	 */
	public static SyntaxNode argList(SyntaxElement... args) {
		List<SyntaxElement> children = new ArrayList<>();
		children.add(token(RustKinds.L_PAREN));
		boolean first = true;
		for (SyntaxElement arg : args) {
			if (arg instanceof SyntaxNode && !first) {
				children.add(token(RustKinds.COMMA));
				children.add(space());
			}
			children.add(arg);
			first &= !(arg instanceof SyntaxNode);
		}
		children.add(token(RustKinds.R_PAREN));
		return SyntaxFactory.buildNode(RustKinds.ARG_LIST, children);
	}

	/**
	 * {@code name: value}
	 */
	public static SyntaxNode field(String name, SyntaxNode value) {
		return node(RustKinds.RECORD_EXPR_FIELD, nameRef(name), token(RustKinds.COLON), space(), value);
	}

	/**
	 * {@code Path { field, field }}
	 */
	public static SyntaxNode recordExpr(String path, SyntaxNode... fields) {
		List<SyntaxElement> children = new ArrayList<>();
		children.add(token(RustKinds.L_CURLY));
		for (int i = 0; i < fields.length; i++) {
			children.add(i == 0 ? space() : token(RustKinds.COMMA));
			if (i > 0) {
				children.add(space());
			}
			children.add(fields[i]);
		}
		children.add(space());
		children.add(token(RustKinds.R_CURLY));
		return node(RustKinds.RECORD_EXPR, path(path), space(),
				SyntaxFactory.buildNode(RustKinds.RECORD_EXPR_FIELD_LIST, children));
	}

	/**
	 * {@code name!(tokens)}
	 */
	public static SyntaxNode macroCall(String name, SyntaxElement... tokens) {
		List<SyntaxElement> children = new ArrayList<>();
		children.add(token(RustKinds.L_PAREN));
		children.addAll(List.of(tokens));
		children.add(token(RustKinds.R_PAREN));
		return node(RustKinds.MACRO_CALL, path(name), token(RustKinds.BANG),
				SyntaxFactory.buildNode(RustKinds.TOKEN_TREE, children));
	}

	/**
	 * {@code { stmt; stmt; }}
	 */
	public static SyntaxNode block(SyntaxNode... statements) {
		List<SyntaxElement> children = new ArrayList<>();
		children.add(token(RustKinds.L_CURLY));
		for (SyntaxNode statement : statements) {
			children.add(space());
			children.add(node(RustKinds.EXPR_STMT, statement, token(RustKinds.SEMICOLON)));
		}
		children.add(space());
		children.add(token(RustKinds.R_CURLY));
		return SyntaxFactory.buildNode(RustKinds.BLOCK_EXPR, children);
	}

	/**
	 * The cursor on {@code node} within the tree rooted at {@code root}.
	 */
	public static SyntaxCursor cursorOf(SyntaxNode root, SyntaxNode node) {
		return SyntaxCursor.root(root).descendants()
				.filter(c -> c.element() == node)
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException(node + " is not part of " + root));
	}
}
