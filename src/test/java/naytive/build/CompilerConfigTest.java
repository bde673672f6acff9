package naytive.build;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CompilerConfigTest {
	@Test
	void defaultsWhenNothingIsConfigured(@TempDir Path dir) {
		CompilerConfig config = CompilerConfig.from(new Properties(), new Properties(), dir);

		assertEquals(dir, config.outputRoot());
		assertEquals(dir.resolve("dist"), config.outputDirectory());
		assertEquals(".cpp", config.compiledHeaderExtension());
	}

	@Test
	void fileValuesAreResolvedAgainstProjectDirectory(@TempDir Path dir) {
		Properties file = new Properties();
		file.setProperty("naytive.appDir", "app");
		file.setProperty("naytive.output", "build");
		file.setProperty("naytive.compileType", "hpp");

		CompilerConfig config = CompilerConfig.from(file, new Properties(), dir);

		assertEquals(dir.resolve("app").resolve("build"), config.outputDirectory());
		assertEquals(".hpp", config.compiledHeaderExtension());
	}

	@Test
	void overridesWinOverFile(@TempDir Path dir) {
		Properties file = new Properties();
		file.setProperty("naytive.output", "build");
		Properties overrides = new Properties();
		overrides.setProperty("naytive.output", "out");
		overrides.setProperty("naytive.compileType", " ");

		CompilerConfig config = CompilerConfig.from(file, overrides, dir);

		assertEquals("out", config.outputSubdir());
		assertEquals(".cpp", config.compiledHeaderExtension());
	}

	@Test
	void loadsPropertiesFile(@TempDir Path dir) throws Exception {
		Files.writeString(dir.resolve(CompilerConfig.FILE_NAME), "naytive.output=target/cpp\n");

		CompilerConfig config = CompilerConfig.load(dir);

		assertEquals(dir.resolve("target/cpp"), config.outputDirectory());
	}
}
