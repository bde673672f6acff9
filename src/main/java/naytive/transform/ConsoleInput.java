package naytive.transform;

import naytive.ast.ts.CallExpression;
import naytive.ast.ts.TsExpression;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recognises console-read calls ({@code std.cin(...)}, {@code alert(...)}) and
 * lowers them into a prompt write followed by a stream read.
 */
final class ConsoleInput {
	private ConsoleInput() {
	}

	static Optional<CallExpression> match(TsExpression expression) {
		if (!(expression instanceof CallExpression call)) {
			return Optional.empty();
		}
		return QualifiedName.of(call.callee())
				.flatMap(Builtin::resolve)
				.filter(builtin -> builtin.role() == Builtin.Role.READ)
				.map(builtin -> call);
	}

	/**
	 * Statements that print the prompt (when the call has one) and read into
	 * {@code target}. The read statement is left unterminated.
	 */
	static String lowerRead(CallExpression call, String target, SourceContext ctx, Translator t) {
		t.state().addInclude(Includes.IOSTREAM);
		StringBuilder out = new StringBuilder();
		if (!call.arguments().isEmpty()) {
			String prompt = call.arguments().stream()
					.map(argument -> t.translate(argument, ctx))
					.collect(Collectors.joining(" << "));
			out.append("std::cout << ").append(prompt).append(";\n");
		}
		return out.append("std::cin >> ").append(target).toString();
	}
}
