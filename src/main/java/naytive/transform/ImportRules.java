package naytive.transform;

import naytive.TranspileException;
import naytive.ast.ts.ImportDeclaration;
import naytive.build.CompilerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Import declarations.
 *
 * - {@code @naytive/...}: intrinsic libraries; known names register a system
 * include and the import itself disappears.
 * - {@code ./...}: local modules. Source modules are translated and inlined,
 * anything else is copied to the output directory and included.
 * - everything else: included as is.
 */
final class ImportRules {
	private static final Logger LOG = Logger.getLogger(ImportRules.class.getName());

	static final String INTRINSIC_NAMESPACE = "@naytive/";
	static final String SOURCE_EXTENSION = ".ts";
	static final String HEADER_EXTENSION = ".h";
	static final String IMPLEMENTATION_EXTENSION = ".cpp";

	static final Map<String, String> INTRINSIC_LIBRARIES = Map.of(
			"std", "iostream",
			"array", "array");

	private ImportRules() {
	}

	static String lowerImport(ImportDeclaration declaration, SourceContext ctx, Translator t) {
		String specifier = declaration.moduleSpecifier();

		if (specifier.startsWith(INTRINSIC_NAMESPACE)) {
			for (String name : declaration.namedImports()) {
				String library = INTRINSIC_LIBRARIES.get(name);
				if (library != null) {
					t.state().addInclude(Includes.system(library));
				}
			}
			return "";
		}

		if (specifier.startsWith(".")) {
			Path target = resolve(ctx, specifier);
			if (!Files.exists(target)) {
				throw new UnresolvableImportException(target);
			}
			if (target.getFileName().toString().endsWith(SOURCE_EXTENSION)) {
				LOG.fine(() -> "inlining module " + target);
				return t.translateModule(target);
			}
			copyPassThrough(target, specifier, t.config());
		}

		t.state().addRawImport(Includes.quoted(specifier));
		return "";
	}

	/**
	 * Resolves a relative specifier against the importing module's directory;
	 * a specifier without extension names a source module.
	 */
	static Path resolve(SourceContext ctx, String specifier) {
		String fileName = Path.of(specifier).getFileName().toString();
		String file = fileName.contains(".") ? specifier : specifier + SOURCE_EXTENSION;
		return ctx.directory().resolve(file).normalize();
	}

	private static void copyPassThrough(Path target, String specifier, CompilerConfig config) {
		Path destination = config.outputDirectory().resolve(specifier).normalize();
		copy(target, destination);

		String fileName = target.getFileName().toString();
		if (fileName.endsWith(HEADER_EXTENSION)) {
			String stem = fileName.substring(0, fileName.length() - HEADER_EXTENSION.length());
			Path implementation = target.resolveSibling(stem + IMPLEMENTATION_EXTENSION);
			if (Files.exists(implementation)) {
				copy(implementation, destination.resolveSibling(stem + config.compiledHeaderExtension()));
			}
		}
	}

	private static void copy(Path from, Path to) {
		try {
			Path parent = to.getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
			LOG.fine(() -> "copied " + from + " to " + to);
		} catch (IOException e) {
			throw new TranspileException("Cannot copy " + from + " to " + to, e);
		}
	}
}
