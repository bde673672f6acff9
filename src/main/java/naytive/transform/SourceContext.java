package naytive.transform;

import naytive.ast.SourceSpan;

import java.nio.file.Path;

/**
 * Per-module data a rule may need besides the node itself: the module's file,
 * to resolve relative imports, and its text, to recover the source of a span.
 *
 * {@code filePath} is null for source compiled from a string.
 */
public record SourceContext(Path filePath, String source) {
	public static SourceContext ofSource(String source) {
		return new SourceContext(null, source);
	}

	/**
	 * Directory relative imports are resolved against.
	 */
	public Path directory() {
		if (filePath == null) {
			return Path.of("").toAbsolutePath();
		}
		Path parent = filePath.toAbsolutePath().getParent();
		return parent == null ? Path.of("").toAbsolutePath() : parent;
	}

	public String textOf(SourceSpan span) {
		if (source == null || !span.isKnown() || span.endOffset() > source.length()) {
			return null;
		}
		return source.substring(span.startOffset(), span.endOffset());
	}
}
