package org.javai.syntax.grammar.compile;

import java.util.Objects;
import java.util.Optional;

import org.javai.syntax.ast.ChildAnchor;

/**
 * One compiled field of a product definition.
 *
 * @param name snake_case field name, plural for auto-named {@link Cardinality#many} fields
 * @param cardinality how often the field may occur
 * @param target what the field holds
 * @param position for single-valued fields, how many earlier single-valued fields of the same
 *        definition claim overlapping kinds; the accessor reads the {@code position}-th match
 * @param labeled whether the grammar named the field explicitly
 * @param anchor for single-valued node fields with an overlapping neighbour, the separator token
 *        that locates the field in place of {@code position}; {@code null} if there is none
 */
public record FieldSpec(String name, Cardinality cardinality, FieldTarget target, int position, boolean labeled,
		ChildAnchor anchor) {

	public FieldSpec {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(cardinality, "cardinality must not be null");
		Objects.requireNonNull(target, "target must not be null");
	}

	public FieldSpec(String name, Cardinality cardinality, FieldTarget target, int position, boolean labeled) {
		this(name, cardinality, target, position, labeled, null);
	}

	public boolean isToken() {
		return target instanceof FieldTarget.Token;
	}

	public Optional<ChildAnchor> childAnchor() {
		return Optional.ofNullable(anchor);
	}

	FieldSpec withAnchor(ChildAnchor newAnchor) {
		return new FieldSpec(name, cardinality, target, position, labeled, newAnchor);
	}

	/**
	 * Name, cardinality and target, e.g. {@code params:many:Param}.
	 */
	public String describe() {
		return name + ":" + cardinality + ":" + target;
	}
}
