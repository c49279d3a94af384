package org.javai.syntax.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxNode;

/**
 * Describes one typed wrapper: which node kinds it accepts and how to wrap a node.
 * <p>
 * Three shapes exist:
 * <ul>
 *   <li>{@link #product} accepts exactly its own kind;</li>
 *   <li>{@link #sum} accepts its own kind (a parser may still emit it) plus every kind reachable
 *       through its members, and narrows with {@link #downcastMember};</li>
 *   <li>{@link #anyOf} is an unnamed sum used for labeled fields such as
 *       {@code else_branch:(IfExpr | BlockExpr)}; its wrapper is the matching member itself.</li>
 * </ul>
 * Member lists are supplied lazily because generated sum types refer to each other's
 * {@code TYPE} constants during class initialisation.
 *
 * @param <W> the wrapper type produced by {@link #cast}
 */
public final class AstNodeType<W extends AstNode> {

	private final String name;
	private final NodeKind kind;
	private final Set<NodeKind> accepted;
	private final Function<SyntaxNode, ? extends W> wrapper;
	private final Supplier<List<AstNodeType<?>>> memberSupplier;
	private volatile List<AstNodeType<?>> members;

	private AstNodeType(String name, NodeKind kind, Set<NodeKind> accepted, Function<SyntaxNode, ? extends W> wrapper,
			Supplier<List<AstNodeType<?>>> memberSupplier) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.kind = kind;
		this.accepted = accepted;
		this.wrapper = wrapper;
		this.memberSupplier = memberSupplier;
	}

	public static <W extends AstNode> AstNodeType<W> product(String name, NodeKind kind,
			Function<SyntaxNode, W> wrapper) {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(wrapper, "wrapper must not be null");
		return new AstNodeType<>(name, kind, Set.of(kind), wrapper, List::of);
	}

	/**
	 * @param memberKinds every kind a member accepts, nested sums already expanded
	 * @param members the member types in declaration order
	 */
	public static <W extends AstNode> AstNodeType<W> sum(String name, NodeKind kind, Set<NodeKind> memberKinds,
			Function<SyntaxNode, W> wrapper, Supplier<List<AstNodeType<?>>> members) {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(wrapper, "wrapper must not be null");
		Set<NodeKind> accepted = new LinkedHashSet<>();
		accepted.add(kind);
		accepted.addAll(memberKinds);
		return new AstNodeType<>(name, kind, Collections.unmodifiableSet(accepted), wrapper, members);
	}

	public static AstNodeType<AstNode> anyOf(String name, Set<NodeKind> memberKinds,
			Supplier<List<AstNodeType<?>>> members) {
		if (memberKinds.isEmpty()) {
			throw new IllegalArgumentException("anyOf type " + name + " needs at least one member kind");
		}
		return new AstNodeType<>(name, null, Collections.unmodifiableSet(new LinkedHashSet<>(memberKinds)), null,
				members);
	}

	public String name() {
		return name;
	}

	/**
	 * The wrapper's own kind; empty for {@link #anyOf} types.
	 */
	public Optional<NodeKind> kind() {
		return Optional.ofNullable(kind);
	}

	public Set<NodeKind> acceptedKinds() {
		return accepted;
	}

	public boolean isSum() {
		return !members().isEmpty();
	}

	public boolean canCast(NodeKind nodeKind) {
		return accepted.contains(nodeKind);
	}

	/**
	 * Downcast: wraps the node if its kind is accepted, otherwise returns empty.
	 */
	public Optional<W> cast(SyntaxNode node) {
		if (node == null || !accepted.contains(node.kind())) {
			return Optional.empty();
		}
		return Optional.of(wrap(node));
	}

	@SuppressWarnings("unchecked")
	W wrap(SyntaxNode node) {
		if (wrapper != null) {
			return wrapper.apply(node);
		}
		return (W) downcastMember(node).orElseGet(() -> new UntypedNode(node));
	}

	public List<AstNodeType<?>> members() {
		List<AstNodeType<?>> resolved = members;
		if (resolved == null) {
			resolved = List.copyOf(memberSupplier.get());
			members = resolved;
		}
		return resolved;
	}

	/**
	 * Tries each declared member in declaration order and returns the first successful cast.
	 * Empty when the node's kind matches no member, including the sum's own kind.
	 */
	public Optional<AstNode> downcastMember(SyntaxNode node) {
		for (AstNodeType<?> member : members()) {
			Optional<? extends AstNode> cast = member.cast(node);
			if (cast.isPresent()) {
				return Optional.of(cast.get());
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * Wrapper for a node of an {@link #anyOf} type whose kind none of the members claims.
	 */
	private record UntypedNode(SyntaxNode syntax) implements AstNode {
	}
}
