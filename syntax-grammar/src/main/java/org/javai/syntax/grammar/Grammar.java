package org.javai.syntax.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A parsed grammar: its definitions in source order. Immutable.
 */
public final class Grammar {

	private final List<Definition> definitions;
	private final Map<String, Definition> byName;

	public Grammar(List<Definition> definitions) {
		this.definitions = List.copyOf(definitions);
		Map<String, Definition> index = new LinkedHashMap<>();
		for (Definition definition : this.definitions) {
			if (index.putIfAbsent(definition.name(), definition) != null) {
				throw new GrammarException("Duplicate definition: " + definition.name());
			}
		}
		this.byName = Collections.unmodifiableMap(index);
	}

	public List<Definition> definitions() {
		return definitions;
	}

	public Optional<Definition> definition(String name) {
		return Optional.ofNullable(byName.get(name));
	}

	public boolean isDefined(String name) {
		return byName.containsKey(name);
	}

	public int size() {
		return definitions.size();
	}

	/**
	 * Renders the grammar as text that parses back to an equal grammar.
	 */
	public String render() {
		return definitions.stream().map(Definition::toString).collect(Collectors.joining("\n\n", "", "\n"));
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Grammar other && definitions.equals(other.definitions);
	}

	@Override
	public int hashCode() {
		return definitions.hashCode();
	}

	@Override
	public String toString() {
		return "Grammar" + byName.keySet();
	}
}
