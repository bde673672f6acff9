package naytive.transform;

import naytive.ast.ts.ArrayLiteralExpression;
import naytive.ast.ts.ArrowFunction;
import naytive.ast.ts.BinaryExpression;
import naytive.ast.ts.Block;
import naytive.ast.ts.BooleanLiteral;
import naytive.ast.ts.CallExpression;
import naytive.ast.ts.ElementAccessExpression;
import naytive.ast.ts.Identifier;
import naytive.ast.ts.NoSubstitutionTemplateLiteral;
import naytive.ast.ts.NullLiteral;
import naytive.ast.ts.NumericLiteral;
import naytive.ast.ts.Parameter;
import naytive.ast.ts.ParenthesizedExpression;
import naytive.ast.ts.PostfixUnaryExpression;
import naytive.ast.ts.PrefixUnaryExpression;
import naytive.ast.ts.PropertyAccessExpression;
import naytive.ast.ts.StringLiteral;
import naytive.ast.ts.TemplateExpression;
import naytive.ast.ts.TsExpression;
import naytive.ast.ts.TypeOfExpression;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

final class ExpressionRules {
	static final String FOR_EACH = "forEach";
	static final String DEREFERENCE = "dereference";
	static final String STD_PREFIX = "std.";

	private ExpressionRules() {
	}

	static String lowerBinary(BinaryExpression binary, SourceContext ctx, Translator t) {
		String left = t.translate(binary.left(), ctx);
		Optional<CallExpression> read = ConsoleInput.match(binary.right());
		if (read.isPresent()) {
			return ConsoleInput.lowerRead(read.get(), left, ctx, t);
		}
		String right = t.translate(binary.right(), ctx);
		return left + " " + cppOperator(binary.operator()) + " " + right;
	}

	private static String cppOperator(String operator) {
		return switch (operator) {
			case "===" -> "==";
			case "!==" -> "!=";
			default -> operator;
		};
	}

	static String lowerCall(CallExpression call, SourceContext ctx, Translator t) {
		TsExpression callee = call.callee();

		if (isForEach(call)) {
			return lowerForEach((PropertyAccessExpression) callee, call.arguments().get(0), ctx, t);
		}

		Optional<String> qualifiedName = QualifiedName.of(callee);
		Optional<Builtin> builtin = qualifiedName.flatMap(Builtin::resolve)
				.filter(b -> b.role() != Builtin.Role.READ);
		if (builtin.isPresent()) {
			return BuiltinRules.lower(builtin.get(), call, ctx, t);
		}

		if (callee instanceof PropertyAccessExpression access && access.name().equals(DEREFERENCE)) {
			return "*" + t.translate(access.expression(), ctx);
		}

		String arguments = arguments(call.arguments(), ctx, t);

		if (qualifiedName.isPresent() && qualifiedName.get().startsWith(STD_PREFIX)) {
			String name = qualifiedName.get();
			t.state().addInclude(Includes.IOSTREAM);
			if (name.contains("std.setprecision")) {
				t.state().addInclude(Includes.IOMANIP);
			}
			return name.replaceFirst("std\\.", "std::") + "(" + arguments + ")";
		}

		String lowered = t.translate(callee, ctx);
		if (callee instanceof PropertyAccessExpression && lowered.endsWith(")") && lowered.contains("(")) {
			// the member rule already produced a helper call; extend its argument list
			if (arguments.isEmpty()) {
				return lowered;
			}
			String open = lowered.substring(0, lowered.length() - 1);
			String separator = open.endsWith("(") ? "" : ", ";
			return open + separator + arguments + ")";
		}
		return lowered + "(" + arguments + ")";
	}

	/**
	 * True for {@code recv.forEach(callback)}, which lowers to a loop statement
	 * rather than an expression.
	 */
	static boolean isForEach(TsExpression expression) {
		return expression instanceof CallExpression call
				&& call.callee() instanceof PropertyAccessExpression access
				&& access.name().equals(FOR_EACH)
				&& call.arguments().size() == 1;
	}

	/**
	 * {@code recv.forEach((el, i, all) => body)} as a counted loop over
	 * {@code recv}. The loop counter takes the index parameter's name.
	 */
	private static String lowerForEach(PropertyAccessExpression access, TsExpression callback, SourceContext ctx,
			Translator t) {
		String receiver = t.translate(access.expression(), ctx);

		if (!(callback instanceof ArrowFunction arrow)) {
			String function = t.translate(callback, ctx);
			return loopHeader(receiver, "i") + " {\n" + function + "(" + receiver + "[i]);\n}";
		}

		List<Parameter> parameters = arrow.parameters();
		String index = parameters.size() > 1 ? parameters.get(1).name() : "i";

		StringBuilder bindings = new StringBuilder();
		if (!parameters.isEmpty()) {
			bindings.append(t.translateTypedParameter(parameters.get(0), ctx))
					.append(" = ").append(receiver).append('[').append(index).append("];\n");
		}
		if (parameters.size() > 2) {
			bindings.append(t.translateTypedParameter(parameters.get(2), ctx))
					.append(" = ").append(receiver).append(";\n");
		}

		String body = arrow.body() instanceof Block
				? t.translate(arrow.body(), ctx)
				: t.translate(arrow.body(), ctx) + ";";

		return loopHeader(receiver, index) + " {\n" + bindings + "\n" + body + "\n}";
	}

	private static String loopHeader(String receiver, String index) {
		return "for (int " + index + " = 0; " + index + " < " + receiver + ".size(); " + index + "++)";
	}

	static String lowerPropertyAccess(PropertyAccessExpression access, SourceContext ctx, Translator t) {
		String receiver = t.translate(access.expression(), ctx);
		return switch (access.name()) {
			case "length" -> receiver + ".size()";
			case "toUpperCase" -> stringHelper(Helpers.STR_TO_UPPER, receiver, t);
			case "toLowerCase" -> stringHelper(Helpers.STR_TO_LOWER, receiver, t);
			case "replace" -> stringHelper(Helpers.STR_REPLACE, receiver, t);
			case "split" -> {
				t.state().addInclude(Includes.STRING);
				t.state().addInclude(Includes.VECTOR);
				t.state().addInclude(Includes.SSTREAM);
				yield stringHelper(Helpers.STR_SPLIT, receiver, t);
			}
			case "toString" -> {
				t.state().addInclude(Includes.STRING);
				yield "std::to_string(" + receiver + ")";
			}
			case FOR_EACH -> loopHeader(receiver, "i");
			default -> {
				if (access.expression() instanceof Identifier id && id.text().equals("std")) {
					t.state().addInclude(Includes.IOSTREAM);
					yield "std::" + access.name();
				}
				yield receiver + "." + access.name();
			}
		};
	}

	private static String stringHelper(String helper, String receiver, Translator t) {
		t.state().addInclude(Includes.STRING);
		Helpers.require(t.state(), helper);
		return helper + "(" + receiver + ")";
	}

	static String lowerElementAccess(ElementAccessExpression access, SourceContext ctx, Translator t) {
		return t.translate(access.expression(), ctx) + "[" + t.translate(access.argument(), ctx) + "]";
	}

	/**
	 * {@code `a${x}b`} becomes {@code "a" + x + "b"}.
	 */
	static String lowerTemplate(TemplateExpression template, SourceContext ctx, Translator t) {
		t.state().addInclude(Includes.STRING);
		StringBuilder out = new StringBuilder(CppStrings.quote(template.head()));
		for (TemplateExpression.Span span : template.spans()) {
			out.append(" + ").append(t.translate(span.expression(), ctx))
					.append(" + ").append(CppStrings.quote(span.literal()));
		}
		return out.toString();
	}

	static String lowerNoSubstitutionTemplate(NoSubstitutionTemplateLiteral literal, SourceContext ctx, Translator t) {
		t.state().addInclude(Includes.STRING);
		return CppStrings.quote(literal.text());
	}

	static String lowerString(StringLiteral literal, SourceContext ctx, Translator t) {
		t.state().addInclude(Includes.STRING);
		return CppStrings.quote(literal.text());
	}

	static String lowerNumeric(NumericLiteral literal, SourceContext ctx, Translator t) {
		return literal.text();
	}

	static String lowerBoolean(BooleanLiteral literal, SourceContext ctx, Translator t) {
		return String.valueOf(literal.value());
	}

	static String lowerNull(NullLiteral literal, SourceContext ctx, Translator t) {
		return "nullptr";
	}

	static String lowerIdentifier(Identifier identifier, SourceContext ctx, Translator t) {
		return identifier.text();
	}

	static String lowerArrayLiteral(ArrayLiteralExpression array, SourceContext ctx, Translator t) {
		return "{" + arguments(array.elements(), ctx, t) + "}";
	}

	static String lowerTypeOf(TypeOfExpression typeOf, SourceContext ctx, Translator t) {
		t.state().addInclude(Includes.TYPEINFO);
		return "typeid(" + t.translate(typeOf.expression(), ctx) + ").name()";
	}

	static String lowerPrefixUnary(PrefixUnaryExpression unary, SourceContext ctx, Translator t) {
		return unary.operator() + t.translate(unary.operand(), ctx);
	}

	static String lowerPostfixUnary(PostfixUnaryExpression unary, SourceContext ctx, Translator t) {
		return t.translate(unary.operand(), ctx) + unary.operator();
	}

	static String lowerParenthesized(ParenthesizedExpression parenthesized, SourceContext ctx, Translator t) {
		return "(" + t.translate(parenthesized.expression(), ctx) + ")";
	}

	static String arguments(List<TsExpression> arguments, SourceContext ctx, Translator t) {
		return arguments.stream()
				.map(argument -> t.translate(argument, ctx))
				.collect(Collectors.joining(", "));
	}
}
