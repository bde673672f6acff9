package naytive;

import naytive.build.CompilerConfig;
import naytive.transform.UnresolvableImportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectCompilerTest extends NaytiveLoggingConfig {
	@Test
	void writesEntryModuleIntoOutputDirectory(@TempDir Path dir) throws Exception {
		Path src = Files.createDirectories(dir.resolve("src"));
		Files.writeString(src.resolve("util.ts"), "function one(): number { return 1; }\n");
		Path entry = src.resolve("app.ts");
		Files.writeString(entry, "import { one } from \"./util\";\nconsole.log(one());\n");

		Path written = new ProjectCompiler(CompilerConfig.defaults().withOutputRoot(dir)).compileEntry(entry);

		assertEquals(dir.resolve("dist").resolve("app.cpp"), written);
		String cpp = Files.readString(written);
		assertTrue(cpp.contains("int one() {\nreturn 1;\n}"), cpp);
		assertTrue(cpp.contains("std::cout << one();"), cpp);
		assertFalse(Files.exists(dir.resolve("dist").resolve("util.cpp")), "imported modules are inlined");
	}

	@Test
	void writesNothingWhenImportIsMissing(@TempDir Path dir) throws Exception {
		Path entry = dir.resolve("app.ts");
		Files.writeString(entry, "import { gone } from \"./gone\";\nconsole.log(1);\n");

		ProjectCompiler compiler = new ProjectCompiler(CompilerConfig.defaults().withOutputRoot(dir));

		assertThrows(UnresolvableImportException.class, () -> compiler.compileEntry(entry));
		assertFalse(Files.exists(dir.resolve("dist").resolve("app.cpp")));
	}

	@Test
	void outputNameReplacesSourceExtension() {
		assertEquals("app.cpp", ProjectCompiler.outputName(Path.of("src", "app.ts")));
		assertEquals("script.cpp", ProjectCompiler.outputName(Path.of("script")));
	}
}
