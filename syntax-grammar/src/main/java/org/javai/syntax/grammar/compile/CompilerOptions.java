package org.javai.syntax.grammar.compile;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Settings the grammar compiler needs beyond the grammar text.
 * <p>
 * Defaults come from {@value #DEFAULTS_RESOURCE}. An override file only needs the keys it
 * changes:
 * <pre>
 * primitive_tokens: [ident, int_number]
 * trivia_tokens: [whitespace, comment]
 * extra_nodes: [ERROR]
 * aliases:
 *   TypeRef: Type
 * punctuation:
 *   "::": coloncolon
 * </pre>
 *
 * @param primitiveTokens terminal categories, referable as {@code ident} or {@code 'ident'}
 * @param triviaTokens token kinds that carry no syntax
 * @param extraNodes node kinds with no definition, e.g. {@code ERROR}
 * @param aliases earlier-revision definition names mapped to their later names
 * @param punctuation names of punctuation literals; word-like literals become keywords
 */
public record CompilerOptions(List<String> primitiveTokens, List<String> triviaTokens, List<String> extraNodes,
		Map<String, String> aliases, Map<String, String> punctuation) {

	public static final String DEFAULTS_RESOURCE = "META-INF/syntax-grammar/compiler-defaults.yml";

	private static volatile CompilerOptions defaults;

	public CompilerOptions {
		primitiveTokens = List.copyOf(primitiveTokens);
		triviaTokens = List.copyOf(triviaTokens);
		extraNodes = List.copyOf(extraNodes);
		aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
		punctuation = Collections.unmodifiableMap(new LinkedHashMap<>(punctuation));
	}

	/**
	 * The bundled defaults.
	 *
	 * @throws IllegalStateException if the bundled resource is missing or malformed
	 */
	public static CompilerOptions defaults() {
		CompilerOptions loaded = defaults;
		if (loaded == null) {
			ClassLoader loader = CompilerOptions.class.getClassLoader();
			try (InputStream is = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
				if (is == null) {
					throw new IllegalStateException("Resource not found: " + DEFAULTS_RESOURCE);
				}
				loaded = overlay(empty(), readYaml(is, DEFAULTS_RESOURCE));
			} catch (IOException e) {
				throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
			}
			defaults = loaded;
		}
		return loaded;
	}

	/**
	 * The defaults with the keys present in the given YAML file replaced.
	 */
	public static CompilerOptions load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path)) {
			return overlay(defaults(), readYaml(reader, path.toString()));
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read compiler options from path: " + path, e);
		}
	}

	/**
	 * The defaults with the keys present in the given YAML text replaced.
	 */
	public static CompilerOptions parse(String yamlContent) {
		return overlay(defaults(), readYaml(yamlContent, "string"));
	}

	public CompilerOptions withAliases(Map<String, String> newAliases) {
		return new CompilerOptions(primitiveTokens, triviaTokens, extraNodes, newAliases, punctuation);
	}

	public CompilerOptions withExtraNodes(List<String> newExtraNodes) {
		return new CompilerOptions(primitiveTokens, triviaTokens, newExtraNodes, aliases, punctuation);
	}

	private static CompilerOptions empty() {
		return new CompilerOptions(List.of(), List.of(), List.of(), Map.of(), Map.of());
	}

	private static Map<String, Object> readYaml(Object source, String description) {
		try {
			Yaml yaml = new Yaml();
			Object data = source instanceof InputStream is ? yaml.load(is)
					: source instanceof Reader reader ? yaml.load(reader)
					: yaml.load((String) source);
			if (data == null) {
				return Map.of();
			}
			if (!(data instanceof Map<?, ?> map)) {
				throw new IllegalArgumentException("Compiler options in " + description + " must be a YAML mapping");
			}
			Map<String, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(String.valueOf(k), v));
			return result;
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Malformed compiler options in " + description, e);
		}
	}

	private static CompilerOptions overlay(CompilerOptions base, Map<String, Object> data) {
		return new CompilerOptions(
				data.containsKey("primitive_tokens") ? stringList(data, "primitive_tokens") : base.primitiveTokens,
				data.containsKey("trivia_tokens") ? stringList(data, "trivia_tokens") : base.triviaTokens,
				data.containsKey("extra_nodes") ? stringList(data, "extra_nodes") : base.extraNodes,
				data.containsKey("aliases") ? stringMap(data, "aliases") : base.aliases,
				data.containsKey("punctuation") ? stringMap(data, "punctuation") : base.punctuation);
	}

	private static List<String> stringList(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new IllegalArgumentException("'" + key + "' must be a list");
		}
		List<String> result = new ArrayList<>();
		list.forEach(item -> result.add(String.valueOf(item)));
		return result;
	}

	private static Map<String, String> stringMap(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("'" + key + "' must be a mapping");
		}
		Map<String, String> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
		return result;
	}
}
