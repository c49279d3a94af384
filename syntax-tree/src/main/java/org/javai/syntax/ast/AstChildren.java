package org.javai.syntax.ast;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.javai.syntax.tree.SyntaxElement;
import org.javai.syntax.tree.SyntaxNode;

/**
 * The children of a node that a typed wrapper accepts, in tree order.
 * <p>
 * Lazy and restartable: every iteration re-reads the parent's children, and children of
 * other kinds are skipped.
 */
public final class AstChildren<W extends AstNode> implements Iterable<W> {

	private final SyntaxNode parent;
	private final AstNodeType<W> type;

	AstChildren(SyntaxNode parent, AstNodeType<W> type) {
		this.parent = parent;
		this.type = type;
	}

	@Override
	public Iterator<W> iterator() {
		return stream().iterator();
	}

	public Stream<W> stream() {
		return parent.children().stream()
				.filter(child -> child instanceof SyntaxNode node && type.canCast(node.kind()))
				.map(child -> type.wrap((SyntaxNode) child));
	}

	public List<W> toList() {
		return stream().toList();
	}

	public Optional<W> first() {
		return stream().findFirst();
	}

	public boolean isEmpty() {
		return first().isEmpty();
	}

	public int count() {
		int count = 0;
		for (SyntaxElement child : parent.children()) {
			if (child instanceof SyntaxNode node && type.canCast(node.kind())) {
				count++;
			}
		}
		return count;
	}

	@Override
	public String toString() {
		return type.name() + toList();
	}
}
