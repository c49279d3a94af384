package org.javai.syntax.grammar.validate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.javai.syntax.grammar.compile.Cardinality;
import org.javai.syntax.grammar.compile.CompiledDefinition;
import org.javai.syntax.grammar.compile.CompiledGrammar;
import org.javai.syntax.grammar.compile.FieldSpec;
import org.javai.syntax.grammar.compile.FieldTarget;
import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.SyntaxCursor;
import org.javai.syntax.tree.SyntaxNode;
import org.javai.syntax.tree.SyntaxToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks trees against a compiled grammar and reports where they differ.
 * <p>
 * The tree core and the typed facade accept any shape; this is the diagnostics collaborator
 * that tooling runs when it wants to know what is missing or out of place. It never throws for
 * shape problems. Children of node kinds without a definition (such as {@code ERROR}) are
 * accepted anywhere, and trivia tokens are always allowed.
 */
public final class ShapeValidator {

	private static final Logger logger = LoggerFactory.getLogger(ShapeValidator.class);

	private final CompiledGrammar grammar;
	private final Set<NodeKind> extraKinds = new HashSet<>();

	public ShapeValidator(CompiledGrammar grammar) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
		for (NodeKind kind : grammar.kinds().nodeKinds()) {
			if (grammar.definition(kind).isEmpty()) {
				extraKinds.add(kind);
			}
		}
	}

	/**
	 * Validates the whole tree below and including {@code root}.
	 *
	 * @return diagnostics in pre-order; empty when the tree matches the grammar
	 */
	public List<ShapeDiagnostic> validate(SyntaxNode root) {
		List<ShapeDiagnostic> diagnostics = new ArrayList<>();
		SyntaxCursor.root(root).descendants()
				.filter(SyntaxCursor::isNode)
				.forEach(cursor -> validateNode(cursor, diagnostics));
		logger.debug("Validated {}: {} diagnostic(s)", root, diagnostics.size());
		return diagnostics;
	}

	private void validateNode(SyntaxCursor cursor, List<ShapeDiagnostic> diagnostics) {
		SyntaxNode node = cursor.node().orElseThrow();
		NodeKind kind = node.kind();
		if (extraKinds.contains(kind)) {
			return;
		}
		Optional<CompiledDefinition> found = grammar.definition(kind);
		if (found.isEmpty()) {
			diagnostics.add(new ShapeDiagnostic(ShapeDiagnostic.Code.unknown_kind, kind.name(), cursor.range(),
					"node kind " + kind + " is not part of the grammar"));
			return;
		}
		CompiledDefinition definition = found.get();
		if (definition.isSum()) {
			diagnostics.add(new ShapeDiagnostic(ShapeDiagnostic.Code.abstract_node, definition.name(), cursor.range(),
					definition.name() + " must be one of " + definition.members()));
			return;
		}
		for (SyntaxCursor child : cursor.children()) {
			if (!isAccepted(definition, child)) {
				diagnostics.add(new ShapeDiagnostic(ShapeDiagnostic.Code.unexpected_child, definition.name(),
						child.range(), child.element().kindName() + " is not a child of " + definition.name()));
			}
		}
		for (FieldSpec field : definition.fields()) {
			if (field.cardinality() == Cardinality.one && !isPresent(node, definition, field)) {
				diagnostics.add(new ShapeDiagnostic(ShapeDiagnostic.Code.missing_field, definition.name(),
						cursor.range(), definition.name() + " is missing " + field.name()));
			}
		}
	}

	private boolean isAccepted(CompiledDefinition definition, SyntaxCursor child) {
		if (child.element() instanceof SyntaxToken token) {
			return token.kind().trivia() || definition.tokenKinds().contains(token.kind());
		}
		NodeKind kind = child.nodeKind().orElseThrow();
		return extraKinds.contains(kind) || definition.fields().stream().anyMatch(f -> f.target().acceptsNode(kind));
	}

	/**
	 * Mirrors how generated accessors locate single-valued fields.
	 */
	private boolean isPresent(SyntaxNode node, CompiledDefinition definition, FieldSpec field) {
		if (field.target() instanceof FieldTarget.Token token) {
			return node.nthChildToken(token::acceptsToken, field.position()).isPresent();
		}
		Set<NodeKind> slot = definition.slotKinds(field);
		Optional<SyntaxNode> child = field.childAnchor()
				.map(anchor -> anchor.locate(node, slot::contains))
				.orElseGet(() -> node.nthChildNode(slot::contains, field.position()));
		return child.filter(c -> field.target().acceptsNode(c.kind())).isPresent();
	}
}
