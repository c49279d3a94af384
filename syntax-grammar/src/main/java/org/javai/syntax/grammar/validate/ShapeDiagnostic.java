package org.javai.syntax.grammar.validate;

import org.javai.syntax.tree.TextRange;

/**
 * One place where a tree departs from its grammar.
 *
 * @param code what is wrong
 * @param definition the definition (or kind name) of the node being checked
 * @param range the offending element, or the node itself for missing fields
 * @param message human-readable detail
 */
public record ShapeDiagnostic(Code code, String definition, TextRange range, String message) {

	public enum Code {
		/**
		 * A required field has no matching child.
		 */
		missing_field,
		/**
		 * A child that no field of the parent accepts.
		 */
		unexpected_child,
		/**
		 * A node whose kind is a sum; parsers should emit one of the members.
		 */
		abstract_node,
		/**
		 * A node kind the grammar does not know.
		 */
		unknown_kind
	}

	@Override
	public String toString() {
		return code + " " + definition + "@" + range + ": " + message;
	}
}
