package naytive.transform;

import naytive.Compiler;
import naytive.NaytiveLoggingConfig;
import naytive.build.CompilerConfig;
import naytive.print.CppProgram;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ImportRulesTest extends NaytiveLoggingConfig {
	private static CppProgram compile(Path dir, String entrySource) throws Exception {
		Path entry = dir.resolve("main.ts");
		Files.writeString(entry, entrySource);
		Compiler compiler = new Compiler(CompilerConfig.defaults().withOutputRoot(dir));
		return compiler.newCompilation().compileFile(entry);
	}

	@Test
	void missingModuleIsFatal(@TempDir Path dir) throws Exception {
		UnresolvableImportException ex = assertThrows(UnresolvableImportException.class,
				() -> compile(dir, "import { helper } from \"./missing\";\n"));
		assertEquals(dir.resolve("missing.ts"), ex.target());
		assertTrue(ex.getMessage().contains("missing.ts"), ex.getMessage());
	}

	@Test
	void sourceModuleIsInlined(@TempDir Path dir) throws Exception {
		Files.writeString(dir.resolve("util.ts"), "function twice(n: number): number { return n * 2; }\n");

		CppProgram program = compile(dir, "import { twice } from \"./util\";\nconsole.log(twice(2));\n");

		assertEquals(List.of("int twice(int n) {\nreturn n * 2;\n}"), program.declarations());
		assertEquals(List.of("std::cout << twice(2);"), program.mainBody());
		assertTrue(program.rawImports().isEmpty());
	}

	@Test
	void inlinedModuleResolvesItsOwnImportsRelativeToItself(@TempDir Path dir) throws Exception {
		Files.createDirectories(dir.resolve("lib"));
		Files.writeString(dir.resolve("lib").resolve("a.ts"), "import { b } from \"./b\";\nfunction a(): number { return b(); }\n");
		Files.writeString(dir.resolve("lib").resolve("b.ts"), "function b(): number { return 1; }\n");

		CppProgram program = compile(dir, "import { a } from \"./lib/a\";\n");

		assertEquals(List.of("int b() {\nreturn 1;\n}\n\nint a() {\nreturn b();\n}"), program.declarations());
	}

	@Test
	void headerIsCopiedWithItsImplementation(@TempDir Path dir) throws Exception {
		Path lib = Files.createDirectories(dir.resolve("lib"));
		Files.writeString(lib.resolve("math.h"), "int add(int a, int b);\n");
		Files.writeString(lib.resolve("math.cpp"), "int add(int a, int b) { return a + b; }\n");

		CppProgram program = compile(dir, "import \"./lib/math.h\";\n");

		Path out = dir.resolve("dist").resolve("lib");
		assertEquals("int add(int a, int b);\n", Files.readString(out.resolve("math.h")));
		assertTrue(Files.exists(out.resolve("math.cpp")));
		assertEquals(List.of("#include \"./lib/math.h\""), program.rawImports());
	}

	@Test
	void implementationCopyUsesConfiguredExtension(@TempDir Path dir) throws Exception {
		Files.writeString(dir.resolve("io.h"), "void log();\n");
		Files.writeString(dir.resolve("io.cpp"), "void log() {}\n");
		Path entry = dir.resolve("main.ts");
		Files.writeString(entry, "import \"./io.h\";\n");

		Compiler compiler = new Compiler(new CompilerConfig(dir, "build", ".cc"));
		compiler.newCompilation().compileFile(entry);

		assertTrue(Files.exists(dir.resolve("build").resolve("io.h")));
		assertTrue(Files.exists(dir.resolve("build").resolve("io.cc")));
	}

	@Test
	void intrinsicImportsOnlyRegisterIncludes(@TempDir Path dir) throws Exception {
		CppProgram program = compile(dir, "import { std, array, int } from \"@naytive/std\";\n");

		assertEquals(List.of("#include <iostream>", "#include <array>"), program.includes());
		assertTrue(program.declarations().isEmpty());
		assertTrue(program.mainBody().isEmpty());
	}

	@Test
	void packageImportIsIncludedVerbatim(@TempDir Path dir) throws Exception {
		CppProgram program = compile(dir, "import \"vendor/json.hpp\";\n");

		assertEquals(List.of("#include \"vendor/json.hpp\""), program.rawImports());
	}

	@Test
	void relativeSpecifierWithoutExtensionNamesSourceModule() {
		SourceContext ctx = new SourceContext(Path.of("/app/src/main.ts"), "");
		assertEquals(Path.of("/app/src/util.ts"), ImportRules.resolve(ctx, "./util"));
		assertEquals(Path.of("/app/lib/x.h"), ImportRules.resolve(ctx, "../lib/x.h"));
	}
}
