package org.javai.syntax.grammar.compile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.javai.syntax.tree.NodeKind;

/**
 * The result of compiling a grammar: per-definition field or member lists plus the kind table.
 * This structure is the whole contract between the compiler and any facade generator.
 */
public final class CompiledGrammar {

	private final List<CompiledDefinition> definitions;
	private final KindTable kinds;
	private final Map<String, CompiledDefinition> byName = new LinkedHashMap<>();
	private final Map<NodeKind, CompiledDefinition> byKind = new LinkedHashMap<>();

	public CompiledGrammar(List<CompiledDefinition> definitions, KindTable kinds) {
		this.definitions = List.copyOf(definitions);
		this.kinds = kinds;
		for (CompiledDefinition definition : this.definitions) {
			byName.put(definition.name(), definition);
			byKind.put(definition.kind(), definition);
		}
	}

	public List<CompiledDefinition> definitions() {
		return definitions;
	}

	public Optional<CompiledDefinition> definition(String name) {
		return Optional.ofNullable(byName.get(name));
	}

	public Optional<CompiledDefinition> definition(NodeKind kind) {
		return Optional.ofNullable(byKind.get(kind));
	}

	public List<CompiledDefinition> products() {
		return definitions.stream().filter(d -> !d.isSum()).toList();
	}

	public List<CompiledDefinition> sums() {
		return definitions.stream().filter(CompiledDefinition::isSum).toList();
	}

	public KindTable kinds() {
		return kinds;
	}

	/**
	 * One line per definition: {@code Name = f1:card:Target, ...} or {@code Name = A | B}.
	 * Two compilations of the same grammar produce the same summary.
	 */
	public Map<String, String> summary() {
		Map<String, String> summary = new LinkedHashMap<>();
		for (CompiledDefinition definition : definitions) {
			summary.put(definition.name(), definition.isSum()
					? String.join(" | ", definition.members())
					: String.join(", ", definition.fields().stream().map(FieldSpec::describe).toList()));
		}
		return Collections.unmodifiableMap(summary);
	}

	@Override
	public String toString() {
		return "CompiledGrammar[" + definitions.size() + " definitions, " + kinds.nodeKinds().size() + " node kinds, "
				+ kinds.tokenKinds().size() + " token kinds]";
	}
}
