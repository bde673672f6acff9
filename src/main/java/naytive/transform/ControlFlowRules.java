package naytive.transform;

import naytive.ast.ts.Block;
import naytive.ast.ts.ExpressionStatement;
import naytive.ast.ts.ForStatement;
import naytive.ast.ts.IfStatement;
import naytive.ast.ts.ReturnStatement;

import java.util.stream.Collectors;

final class ControlFlowRules {
	private ControlFlowRules() {
	}

	static String lowerBlock(Block block, SourceContext ctx, Translator t) {
		return block.statements().stream()
				.map(statement -> t.translate(statement, ctx))
				.collect(Collectors.joining("\n\n"));
	}

	static String lowerIf(IfStatement statement, SourceContext ctx, Translator t) {
		String condition = t.translate(statement.condition(), ctx);
		String thenBranch = t.translate(statement.thenStatement(), ctx);
		StringBuilder out = new StringBuilder()
				.append("if (").append(condition).append(") {\n")
				.append(thenBranch)
				.append("\n}");
		if (statement.elseStatement() != null) {
			out.append(" else {\n")
					.append(t.translate(statement.elseStatement(), ctx))
					.append("\n}");
		}
		return out.toString();
	}

	static String lowerFor(ForStatement statement, SourceContext ctx, Translator t) {
		int offset = statement.span().startOffset();
		if (statement.initializer() == null) {
			throw new MalformedLoopException("initializer", offset);
		}
		if (statement.condition() == null) {
			throw new MalformedLoopException("condition", offset);
		}
		if (statement.incrementor() == null) {
			throw new MalformedLoopException("incrementor", offset);
		}

		String initializer = t.translate(statement.initializer(), ctx);
		String condition = t.translate(statement.condition(), ctx);
		String incrementor = t.translate(statement.incrementor(), ctx);
		String body = t.translate(statement.statement(), ctx);
		return "for (" + initializer + "; " + condition + "; " + incrementor + ") {\n" + body + "\n}";
	}

	static String lowerExpressionStatement(ExpressionStatement statement, SourceContext ctx, Translator t) {
		String expression = t.translate(statement.expression(), ctx);
		return ExpressionRules.isForEach(statement.expression()) ? expression : expression + ";";
	}

	static String lowerReturn(ReturnStatement statement, SourceContext ctx, Translator t) {
		if (statement.expression() == null) {
			return "return;";
		}
		return "return " + t.translate(statement.expression(), ctx) + ";";
	}
}
