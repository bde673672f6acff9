package naytive;

import naytive.ast.ts.ArrowFunction;
import naytive.ast.ts.DeclareStatement;
import naytive.ast.ts.FunctionDeclaration;
import naytive.ast.ts.ImportDeclaration;
import naytive.ast.ts.Parameter;
import naytive.ast.ts.SourceFile;
import naytive.ast.ts.TsNode;
import naytive.ast.ts.TsStatement;
import naytive.ast.ts.VariableStatement;
import naytive.build.BuildState;
import naytive.build.CompilerConfig;
import naytive.parse.ts.TsParser;
import naytive.print.CppProgram;
import naytive.transform.Grammar;
import naytive.transform.SourceContext;
import naytive.transform.Translator;
import naytive.types.TypeMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One compilation run. Owns the build state shared by the entry module and
 * every module it imports; not reusable across runs.
 */
public final class Compilation implements Translator {
	private static final Logger LOG = Logger.getLogger(Compilation.class.getName());

	private final Grammar grammar;
	private final TypeMapper types;
	private final TsParser parser;
	private final CompilerConfig config;
	private final BuildState state = new BuildState();

	Compilation(Grammar grammar, TypeMapper types, CompilerConfig config) {
		this.grammar = grammar;
		this.types = types;
		this.parser = new TsParser(types);
		this.config = config;
	}

	@Override
	public String translate(TsNode node, SourceContext ctx) {
		if (LOG.isLoggable(Level.FINEST)) {
			LOG.finest("translating " + node.kind() + " at offset " + node.span().startOffset());
		}
		return grammar.apply(node, ctx, this);
	}

	@Override
	public String translateTypedParameter(Parameter parameter, SourceContext ctx) {
		return mapType(parameter.typeAnnotation()) + " " + parameter.name();
	}

	@Override
	public String mapType(String sourceType) {
		return types.map(sourceType);
	}

	@Override
	public String translateModule(Path file) {
		String source = read(file);
		SourceContext ctx = new SourceContext(file, source);
		List<String> fragments = new ArrayList<>();
		for (TsStatement statement : parser.parse(source).statements()) {
			String fragment = translate(statement, ctx);
			if (!fragment.isEmpty()) {
				fragments.add(fragment);
			}
		}
		return String.join("\n\n", fragments);
	}

	@Override
	public BuildState state() {
		return state;
	}

	@Override
	public CompilerConfig config() {
		return config;
	}

	/**
	 * Translates an entry module. Imports, macros and functions stay at file
	 * scope; the remaining statements form the body of a synthesized
	 * {@code main}, unless the module defines {@code main} itself.
	 *
	 * @param file the module's path, or null when the source has no file
	 */
	public CppProgram compileSource(String source, Path file) {
		SourceFile module = parser.parse(source);
		SourceContext ctx = new SourceContext(file, source);
		boolean ownsMain = definesMain(module);

		List<String> declarations = new ArrayList<>();
		List<String> mainBody = new ArrayList<>();
		for (TsStatement statement : module.statements()) {
			String fragment = translate(statement, ctx);
			if (fragment.isEmpty()) {
				continue;
			}
			if (ownsMain || isFileScope(statement)) {
				declarations.add(fragment);
			} else {
				mainBody.add(fragment);
			}
		}

		return new CppProgram(
				new ArrayList<>(state.includes()),
				new ArrayList<>(state.rawImports()),
				new ArrayList<>(state.helpers().values()),
				declarations,
				mainBody);
	}

	public CppProgram compileFile(Path file) {
		return compileSource(read(file), file);
	}

	private static boolean isFileScope(TsStatement statement) {
		if (statement instanceof ImportDeclaration
				|| statement instanceof DeclareStatement
				|| statement instanceof FunctionDeclaration) {
			return true;
		}
		return statement instanceof VariableStatement variable && declaresFunction(variable);
	}

	private static boolean declaresFunction(VariableStatement statement) {
		return statement.declarationList().declarations().get(0).initializer() instanceof ArrowFunction;
	}

	private static boolean definesMain(SourceFile module) {
		for (TsStatement statement : module.statements()) {
			if (statement instanceof FunctionDeclaration function && function.name().equals("main")) {
				return true;
			}
			if (statement instanceof VariableStatement variable && declaresFunction(variable)
					&& variable.declarationList().declarations().get(0).name().equals("main")) {
				return true;
			}
		}
		return false;
	}

	private static String read(Path file) {
		try {
			return Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new TranspileException("Cannot read " + file, e);
		}
	}
}
