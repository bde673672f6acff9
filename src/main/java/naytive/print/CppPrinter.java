package naytive.print;

import java.util.ArrayList;
import java.util.List;

public final class CppPrinter {
	public String print(CppProgram program) {
		List<String> sections = new ArrayList<>();

		List<String> directives = new ArrayList<>(program.includes());
		directives.addAll(program.rawImports());
		if (!directives.isEmpty()) {
			sections.add(String.join("\n", directives));
		}

		sections.addAll(program.helpers());
		sections.addAll(program.declarations());

		if (!program.mainBody().isEmpty()) {
			StringBuilder main = new StringBuilder("int main() {\n");
			for (String statement : program.mainBody()) {
				main.append(statement).append("\n\n");
			}
			main.append("return 0;\n}");
			sections.add(main.toString());
		}

		return String.join("\n\n", sections) + "\n";
	}
}
