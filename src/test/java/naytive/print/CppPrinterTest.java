package naytive.print;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CppPrinterTest {
	@Test
	void printsSectionsInOrder() {
		CppProgram program = new CppProgram(
				List.of("#include <iostream>"),
				List.of("#include \"./lib/math.h\""),
				List.of("int helper()\n{\n  return 1;\n}"),
				List.of("#define N 3"),
				List.of("int x = N;", "std::cout << x;"));

		String expected = "#include <iostream>\n" +
				"#include \"./lib/math.h\"\n" +
				"\n" +
				"int helper()\n{\n  return 1;\n}\n" +
				"\n" +
				"#define N 3\n" +
				"\n" +
				"int main() {\n" +
				"int x = N;\n" +
				"\n" +
				"std::cout << x;\n" +
				"\n" +
				"return 0;\n" +
				"}\n";
		assertEquals(expected, new CppPrinter().print(program));
	}

	@Test
	void omitsMainWhenBodyIsEmpty() {
		CppProgram program = new CppProgram(List.of(), List.of(), List.of(),
				List.of("int main() {\nreturn 0;\n}"), List.of());

		assertEquals("int main() {\nreturn 0;\n}\n", new CppPrinter().print(program));
	}
}
