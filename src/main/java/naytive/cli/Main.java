package naytive.cli;

import naytive.ProjectCompiler;
import naytive.TranspileException;
import naytive.build.CompilerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code naytive <entry.ts> [outputDir]}
 *
 * The project directory is the entry file's directory; {@code naytive.properties}
 * there is honoured. An explicit output directory replaces the configured one.
 */
public final class Main {
	private static final Logger LOG = Logger.getLogger(Main.class.getName());

	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	private Main() {
	}

	public static void main(String[] args) {
		int status = run(args);
		if (status != 0) {
			System.exit(status);
		}
	}

	static int run(String[] args) {
		if (args.length < 1 || args.length > 2) {
			System.err.println("usage: naytive <entry.ts> [outputDir]");
			return EXIT_USAGE;
		}

		Path entry = Path.of(args[0]).toAbsolutePath().normalize();
		if (!Files.isRegularFile(entry)) {
			System.err.println("no such file: " + entry);
			return EXIT_USAGE;
		}

		CompilerConfig config = CompilerConfig.load(entry.getParent());
		if (args.length == 2) {
			Path outputDir = Path.of(args[1]).toAbsolutePath().normalize();
			config = new CompilerConfig(outputDir, ".", config.compiledHeaderExtension());
		}

		try {
			Path written = new ProjectCompiler(config).compileEntry(entry);
			System.out.println(written);
			return 0;
		} catch (TranspileException e) {
			LOG.log(Level.FINE, "compilation failed", e);
			System.err.println("error: " + e.getMessage());
			return EXIT_FAILURE;
		} catch (IOException e) {
			LOG.log(Level.FINE, "cannot write output", e);
			System.err.println("error: " + e.getMessage());
			return EXIT_FAILURE;
		}
	}
}
