package org.javai.syntax.grammar.generate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One generated Java source file.
 *
 * @param relativePath path below the output root, e.g. {@code org/javai/syntax/rust/ast/Fn.java}
 * @param content the file content
 */
public record GeneratedSource(String relativePath, String content) {

	public GeneratedSource {
		Objects.requireNonNull(relativePath, "relativePath must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	/**
	 * Writes the file below {@code root}, creating directories as needed.
	 *
	 * @return the written file
	 */
	public Path writeTo(Path root) throws IOException {
		Path target = root.resolve(relativePath);
		Files.createDirectories(target.getParent());
		Files.writeString(target, content, StandardCharsets.UTF_8);
		return target;
	}
}
