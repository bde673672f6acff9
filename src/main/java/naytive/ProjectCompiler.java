package naytive;

import naytive.build.CompilerConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Compiles an entry module and writes {@code <stem>.cpp} into the configured
 * output directory. Imported modules are inlined into that one file.
 *
 * Nothing is written when the compilation fails.
 */
public final class ProjectCompiler {
	private static final Logger LOG = Logger.getLogger(ProjectCompiler.class.getName());

	private static final String SOURCE_EXTENSION = ".ts";
	private static final String OUTPUT_EXTENSION = ".cpp";

	private final Compiler compiler;

	public ProjectCompiler(CompilerConfig config) {
		this(new Compiler(config));
	}

	public ProjectCompiler(Compiler compiler) {
		this.compiler = compiler;
	}

	public Path compileEntry(Path entryFile) throws IOException {
		LOG.info(() -> "compiling " + entryFile);
		String cpp = compiler.compileFile(entryFile);

		Path outFile = compiler.config().outputDirectory().resolve(outputName(entryFile));
		Files.createDirectories(outFile.getParent());
		Files.writeString(outFile, cpp, StandardCharsets.UTF_8);
		LOG.info(() -> "wrote " + outFile);
		return outFile;
	}

	static String outputName(Path entryFile) {
		String fileName = entryFile.getFileName().toString();
		String base = fileName.endsWith(SOURCE_EXTENSION)
				? fileName.substring(0, fileName.length() - SOURCE_EXTENSION.length())
				: fileName;
		return base + OUTPUT_EXTENSION;
	}
}
