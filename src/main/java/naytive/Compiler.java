package naytive;

import naytive.build.CompilerConfig;
import naytive.print.CppPrinter;
import naytive.transform.Grammar;
import naytive.types.TypeMapper;

import java.nio.file.Path;

/**
 * Entry point for turning TypeScript source into a C++ translation unit.
 *
 * A {@code Compiler} holds only immutable collaborators; every call starts a
 * fresh {@link Compilation}.
 */
public final class Compiler {
	private final Grammar grammar;
	private final TypeMapper types;
	private final CompilerConfig config;
	private final CppPrinter printer = new CppPrinter();

	public Compiler() {
		this(CompilerConfig.defaults());
	}

	public Compiler(CompilerConfig config) {
		this(Grammar.standard(), new TypeMapper(), config);
	}

	public Compiler(Grammar grammar, TypeMapper types, CompilerConfig config) {
		this.grammar = grammar;
		this.types = types;
		this.config = config;
	}

	public String compile(String source) {
		return compile(source, null);
	}

	/**
	 * @param file where the source came from; relative imports resolve against its directory
	 */
	public String compile(String source, Path file) {
		return printer.print(newCompilation().compileSource(source, file));
	}

	public String compileFile(Path file) {
		return printer.print(newCompilation().compileFile(file));
	}

	public Compilation newCompilation() {
		return new Compilation(grammar, types, config);
	}

	public CompilerConfig config() {
		return config;
	}
}
