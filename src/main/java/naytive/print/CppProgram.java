package naytive.print;

import java.util.List;

/**
 * A translated entry module ready to be printed.
 *
 * @param declarations file-scope code in source order (functions, macros, inlined modules)
 * @param mainBody     statements that go into the synthesized {@code main}; empty when the module defines its own
 */
public record CppProgram(
		List<String> includes,
		List<String> rawImports,
		List<String> helpers,
		List<String> declarations,
		List<String> mainBody) {
}
