package naytive.transform;

import naytive.Compilation;
import naytive.Compiler;
import naytive.ast.ts.TsStatement;
import naytive.build.BuildState;
import naytive.parse.ts.TsParser;

import java.util.List;

/**
 * Translates the statements of a snippet one by one within a single
 * compilation, the way the rules see them.
 */
final class Lowering {
	private final Compilation compilation;

	private Lowering(Compilation compilation) {
		this.compilation = compilation;
	}

	static Lowering fresh() {
		return new Lowering(new Compiler().newCompilation());
	}

	/**
	 * Lowers the last statement of {@code source}; earlier statements are
	 * lowered first so their registrations are visible.
	 */
	String last(String source) {
		SourceContext ctx = SourceContext.ofSource(source);
		List<TsStatement> statements = new TsParser().parse(source).statements();
		String result = "";
		for (TsStatement statement : statements) {
			result = compilation.translate(statement, ctx);
		}
		return result;
	}

	BuildState state() {
		return compilation.state();
	}

	Compilation compilation() {
		return compilation;
	}

	static String lower(String source) {
		return fresh().last(source);
	}
}
