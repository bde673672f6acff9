package naytive.build;

import naytive.TranspileException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Where a compilation run places its artifacts.
 *
 * @param outputRoot              application directory the output directory is relative to
 * @param outputSubdir            output directory below {@code outputRoot}
 * @param compiledHeaderExtension extension given to the implementation file copied next to an imported header
 */
public record CompilerConfig(Path outputRoot, String outputSubdir, String compiledHeaderExtension) {
	public static final String FILE_NAME = "naytive.properties";

	static final String APP_DIR = "naytive.appDir";
	static final String OUTPUT = "naytive.output";
	static final String COMPILE_TYPE = "naytive.compileType";

	public static CompilerConfig defaults() {
		return new CompilerConfig(Path.of("."), "dist", ".cpp");
	}

	public Path outputDirectory() {
		return outputRoot.resolve(outputSubdir);
	}

	public CompilerConfig withOutputRoot(Path root) {
		return new CompilerConfig(root, outputSubdir, compiledHeaderExtension);
	}

	/**
	 * Reads {@value #FILE_NAME} from {@code projectDir} when present, then lets
	 * {@code -Dnaytive.*} system properties override individual values. A
	 * relative {@code naytive.appDir} is resolved against {@code projectDir}.
	 */
	public static CompilerConfig load(Path projectDir) {
		Properties file = new Properties();
		Path configFile = projectDir.resolve(FILE_NAME);
		if (Files.isRegularFile(configFile)) {
			try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
				file.load(reader);
			} catch (IOException e) {
				throw new TranspileException("Cannot read " + configFile, e);
			}
		}
		return from(file, System.getProperties(), projectDir);
	}

	static CompilerConfig from(Properties file, Properties overrides, Path projectDir) {
		CompilerConfig defaults = defaults();
		String appDir = value(APP_DIR, file, overrides, defaults.outputRoot().toString());
		String output = value(OUTPUT, file, overrides, defaults.outputSubdir());
		String compileType = value(COMPILE_TYPE, file, overrides, defaults.compiledHeaderExtension());
		if (!compileType.startsWith(".")) {
			compileType = "." + compileType;
		}
		return new CompilerConfig(projectDir.resolve(appDir).normalize(), output, compileType);
	}

	private static String value(String key, Properties file, Properties overrides, String fallback) {
		String override = overrides.getProperty(key);
		if (override != null && !override.isBlank()) {
			return override.trim();
		}
		return file.getProperty(key, fallback).trim();
	}
}
