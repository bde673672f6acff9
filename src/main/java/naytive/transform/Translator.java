package naytive.transform;

import naytive.ast.ts.Parameter;
import naytive.ast.ts.TsNode;
import naytive.build.BuildState;
import naytive.build.CompilerConfig;

import java.nio.file.Path;

/**
 * What a translation rule may call back into. Rules never walk children
 * themselves; they hand every child to {@link #translate}.
 */
public interface Translator {
	String translate(TsNode node, SourceContext ctx);

	/**
	 * Renders a parameter as {@code <type> <name>}.
	 */
	String translateTypedParameter(Parameter parameter, SourceContext ctx);

	/**
	 * Maps a source type annotation (possibly null) to a C++ type name.
	 */
	String mapType(String sourceType);

	/**
	 * Translates another module of the same run and returns its code so the
	 * caller can inline it.
	 */
	String translateModule(Path file);

	BuildState state();

	CompilerConfig config();
}
