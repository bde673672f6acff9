package naytive.transform;

import naytive.TranspileException;
import naytive.ast.ts.ArrayLiteralExpression;
import naytive.ast.ts.ArrowFunction;
import naytive.ast.ts.Block;
import naytive.ast.ts.CallExpression;
import naytive.ast.ts.DeclareStatement;
import naytive.ast.ts.FunctionDeclaration;
import naytive.ast.ts.Parameter;
import naytive.ast.ts.TsExpression;
import naytive.ast.ts.TsNode;
import naytive.ast.ts.VariableDeclaration;
import naytive.ast.ts.VariableDeclarationList;
import naytive.ast.ts.VariableStatement;
import naytive.types.TypeMapper;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Variables, functions, arrow functions and {@code declare} macros.
 */
final class DeclarationRules {
	private static final Logger LOG = Logger.getLogger(DeclarationRules.class.getName());

	private static final String TEXT = "std::string";

	private DeclarationRules() {
	}

	static String lowerVariableStatement(VariableStatement statement, SourceContext ctx, Translator t) {
		String declaration = t.translate(statement.declarationList(), ctx);
		if (declaresFunction(statement)) {
			return declaration;
		}
		return declaration + ";";
	}

	/**
	 * Only the first declarator is translated; {@code let a = 1, b = 2} yields
	 * code for {@code a} alone.
	 */
	static String lowerDeclarationList(VariableDeclarationList list, SourceContext ctx, Translator t) {
		List<VariableDeclaration> declarations = list.declarations();
		if (declarations.size() > 1) {
			LOG.fine(() -> "dropping " + (declarations.size() - 1) + " extra declarator(s) after "
					+ declarations.get(0).name());
		}
		return t.translate(declarations.get(0), ctx);
	}

	static String lowerVariableDeclaration(VariableDeclaration declaration, SourceContext ctx, Translator t) {
		String type = declaration.resolvedType() == null ? TypeMapper.INFERRED : declaration.resolvedType();
		String name = declaration.name();
		TsExpression initializer = declaration.initializer();

		if (initializer == null) {
			return type + " " + name;
		}

		if (initializer instanceof ArrowFunction arrow) {
			String returnType = arrow.returnType() != null ? t.mapType(arrow.returnType()) : type;
			return functionDefinition(returnType, name, arrow.parameters(), arrow.body(), ctx, t);
		}

		Optional<CallExpression> read = ConsoleInput.match(initializer);
		if (read.isPresent()) {
			// console input arrives as text unless the declaration says otherwise
			String readType = declaration.resolvedType() == null ? TEXT : type;
			return readType + " " + name + ";\n" + ConsoleInput.lowerRead(read.get(), name, ctx, t);
		}

		String value = t.translate(initializer, ctx);
		String declared = name;
		if (initializer instanceof ArrayLiteralExpression array
				&& !type.contains("std::array<") && !type.contains("std::vector<")) {
			if (declaration.resolvedType() == null) {
				throw new TranspileException("Cannot infer the element type of " + name + " at offset "
						+ array.span().startOffset() + "; annotate the declaration");
			}
			declared = name + "[]";
		}
		return type + " " + declared + " = " + value;
	}

	/**
	 * {@code declare const NAME = VALUE;} becomes {@code #define NAME VALUE}
	 * with VALUE taken verbatim from the source.
	 */
	static String lowerDeclare(DeclareStatement statement, SourceContext ctx, Translator t) {
		VariableDeclaration declaration = statement.declaration().declarationList().declarations().get(0);
		if (declaration.initializer() == null) {
			return "#define " + declaration.name();
		}
		String value = ctx.textOf(declaration.initializer().span());
		if (value == null) {
			value = t.translate(declaration.initializer(), ctx);
		}
		return "#define " + declaration.name() + " " + value.trim();
	}

	static String lowerFunction(FunctionDeclaration function, SourceContext ctx, Translator t) {
		return functionDefinition(t.mapType(function.returnType()), function.name(), function.parameters(),
				function.body(), ctx, t);
	}

	/**
	 * An arrow function not bound by a declaration becomes a capturing lambda.
	 */
	static String lowerArrowFunction(ArrowFunction arrow, SourceContext ctx, Translator t) {
		return "[&](" + parameters(arrow.parameters(), ctx, t) + ") {\n" + body(arrow.body(), ctx, t) + "\n}";
	}

	private static String functionDefinition(String returnType, String name, List<Parameter> parameters, TsNode body,
			SourceContext ctx, Translator t) {
		return returnType + " " + name + "(" + parameters(parameters, ctx, t) + ") {\n" + body(body, ctx, t) + "\n}";
	}

	static String parameters(List<Parameter> parameters, SourceContext ctx, Translator t) {
		return parameters.stream()
				.map(parameter -> t.translateTypedParameter(parameter, ctx))
				.collect(Collectors.joining(", "));
	}

	/**
	 * A block body is lowered as is; an expression body is returned.
	 */
	static String body(TsNode body, SourceContext ctx, Translator t) {
		if (body instanceof Block) {
			return t.translate(body, ctx);
		}
		return "return " + t.translate(body, ctx) + ";";
	}

	static boolean declaresFunction(VariableStatement statement) {
		return statement.declarationList().declarations().get(0).initializer() instanceof ArrowFunction;
	}
}
