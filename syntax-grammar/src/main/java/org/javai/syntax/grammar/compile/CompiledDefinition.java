package org.javai.syntax.grammar.compile;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.javai.syntax.grammar.Rule;
import org.javai.syntax.tree.NodeKind;
import org.javai.syntax.tree.TokenKind;

/**
 * The compiler's output for one definition.
 *
 * @param name definition name after alias normalization
 * @param kind the node kind allocated to the definition
 * @param category product or sum
 * @param fields product fields in grammar order; empty for sums
 * @param members sum members in declaration order; empty for products
 * @param memberKinds every node kind reachable through the members, nested sums expanded
 * @param tokenKinds every token kind the rule mentions, separators included
 * @param rule the normalized rule
 */
public record CompiledDefinition(String name, NodeKind kind, DefinitionCategory category, List<FieldSpec> fields,
		List<String> members, Set<NodeKind> memberKinds, Set<TokenKind> tokenKinds, Rule rule) {

	public CompiledDefinition {
		fields = List.copyOf(fields);
		members = List.copyOf(members);
		memberKinds = Collections.unmodifiableSet(new LinkedHashSet<>(memberKinds));
		tokenKinds = Collections.unmodifiableSet(new LinkedHashSet<>(tokenKinds));
	}

	public boolean isSum() {
		return category == DefinitionCategory.sum;
	}

	/**
	 * Field names in the order children are expected to appear.
	 */
	public List<String> childOrder() {
		return fields.stream().map(FieldSpec::name).toList();
	}

	/**
	 * Node kinds counted when locating a single-valued node field: the field's own kinds plus
	 * those of every earlier single-valued field it overlaps. The field is the
	 * {@code position}-th child of one of these kinds, provided the field accepts that child.
	 */
	public Set<NodeKind> slotKinds(FieldSpec field) {
		Set<NodeKind> slot = new LinkedHashSet<>();
		for (FieldSpec earlier : fields) {
			if (earlier.equals(field)) {
				break;
			}
			if (earlier.cardinality() != Cardinality.many && earlier.target().overlaps(field.target())) {
				slot.addAll(earlier.target().nodeKinds());
			}
		}
		slot.addAll(field.target().nodeKinds());
		return Collections.unmodifiableSet(slot);
	}

	public Optional<FieldSpec> field(String fieldName) {
		return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
	}
}
