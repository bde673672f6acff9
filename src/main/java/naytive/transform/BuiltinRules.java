package naytive.transform;

import naytive.TranspileException;
import naytive.ast.ts.BinaryExpression;
import naytive.ast.ts.CallExpression;
import naytive.ast.ts.StringLiteral;
import naytive.ast.ts.TemplateExpression;
import naytive.ast.ts.TsExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Calls resolved through {@link Builtin}: console output and the memory
 * intrinsics.
 */
final class BuiltinRules {
	private BuiltinRules() {
	}

	static String lower(Builtin builtin, CallExpression call, SourceContext ctx, Translator t) {
		return switch (builtin.role()) {
			case PRINT -> lowerPrint(call, ctx, t);
			case ADDRESS_OF -> "&" + singleArgument(builtin, call, ctx, t);
			case DEREFERENCE -> "*" + singleArgument(builtin, call, ctx, t);
			case READ -> throw new IllegalArgumentException(builtin + " is only valid as a value source");
		};
	}

	/**
	 * Every argument becomes one or more stream operands: string
	 * concatenations and template strings are split at their {@code +} joints
	 * so the whole call is a single chained stream write.
	 */
	private static String lowerPrint(CallExpression call, SourceContext ctx, Translator t) {
		t.state().addInclude(Includes.IOSTREAM);
		List<TsExpression> operands = new ArrayList<>();
		for (TsExpression argument : call.arguments()) {
			collectOperands(argument, operands);
		}
		String values = operands.stream()
				.map(operand -> t.translate(operand, ctx))
				.collect(Collectors.joining(" << "));
		return values.isEmpty() ? "std::cout" : "std::cout << " + values;
	}

	private static void collectOperands(TsExpression expression, List<TsExpression> operands) {
		if (expression instanceof BinaryExpression binary && binary.operator().equals("+")) {
			collectOperands(binary.left(), operands);
			collectOperands(binary.right(), operands);
			return;
		}
		if (expression instanceof TemplateExpression template) {
			addLiteral(template.head(), template, operands);
			for (TemplateExpression.Span span : template.spans()) {
				collectOperands(span.expression(), operands);
				addLiteral(span.literal(), template, operands);
			}
			return;
		}
		operands.add(expression);
	}

	private static void addLiteral(String text, TemplateExpression template, List<TsExpression> operands) {
		if (!text.isEmpty()) {
			operands.add(new StringLiteral(text, template.span()));
		}
	}

	private static String singleArgument(Builtin builtin, CallExpression call, SourceContext ctx, Translator t) {
		if (call.arguments().size() != 1) {
			throw new TranspileException(builtin.qualifiedName() + " expects one argument but got "
					+ call.arguments().size());
		}
		return t.translate(call.arguments().get(0), ctx);
	}
}
