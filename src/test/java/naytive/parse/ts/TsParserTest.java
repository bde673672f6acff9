package naytive.parse.ts;

import naytive.ast.ts.ArrowFunction;
import naytive.ast.ts.BinaryExpression;
import naytive.ast.ts.Block;
import naytive.ast.ts.CallExpression;
import naytive.ast.ts.DeclareStatement;
import naytive.ast.ts.ExpressionStatement;
import naytive.ast.ts.ForStatement;
import naytive.ast.ts.FunctionDeclaration;
import naytive.ast.ts.Identifier;
import naytive.ast.ts.IfStatement;
import naytive.ast.ts.ImportDeclaration;
import naytive.ast.ts.NodeKind;
import naytive.ast.ts.NumericLiteral;
import naytive.ast.ts.PropertyAccessExpression;
import naytive.ast.ts.ReturnStatement;
import naytive.ast.ts.SourceFile;
import naytive.ast.ts.StringLiteral;
import naytive.ast.ts.TemplateExpression;
import naytive.ast.ts.TsExpression;
import naytive.ast.ts.VariableDeclaration;
import naytive.ast.ts.VariableDeclarationList;
import naytive.ast.ts.VariableStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TsParserTest {
	private static VariableDeclaration declaration(String source) {
		VariableStatement statement = assertInstanceOf(VariableStatement.class,
				new TsParser().parse(source).statements().get(0));
		return statement.declarationList().declarations().get(0);
	}

	private static TsExpression expression(String source) {
		ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class,
				new TsParser().parse(source).statements().get(0));
		return statement.expression();
	}

	@Test
	void parsesImports() {
		SourceFile file = new TsParser().parse(
				"import { std, int as i } from \"@naytive/std\";\n" +
						"import util from './util'\n" +
						"import \"./lib/math.h\";\n");

		ImportDeclaration named = assertInstanceOf(ImportDeclaration.class, file.statements().get(0));
		assertEquals("@naytive/std", named.moduleSpecifier());
		assertEquals(List.of("std", "i"), named.namedImports());

		ImportDeclaration defaultImport = assertInstanceOf(ImportDeclaration.class, file.statements().get(1));
		assertEquals("./util", defaultImport.moduleSpecifier());
		assertEquals(List.of("util"), defaultImport.namedImports());

		ImportDeclaration bare = assertInstanceOf(ImportDeclaration.class, file.statements().get(2));
		assertEquals(List.of(), bare.namedImports());
		assertEquals(NodeKind.IMPORT_DECLARATION, bare.kind());
	}

	@Test
	void annotationResolvesType() {
		VariableDeclaration x = declaration("const x: number = 5;");
		assertEquals("x", x.name());
		assertEquals("number", x.typeAnnotation());
		assertEquals("int", x.resolvedType());
		assertEquals("5", assertInstanceOf(NumericLiteral.class, x.initializer()).text());
	}

	@Test
	void genericAnnotationIsReadBackAsText() {
		VariableDeclaration arr = declaration("let arr: array<int, 3>;");
		assertEquals("array<int, 3>", arr.typeAnnotation());
		assertEquals("std::array<int, 3>", arr.resolvedType());
		assertNull(arr.initializer());

		assertEquals("std::vector<std::string>", declaration("let names: string[];").resolvedType());
	}

	@Test
	void literalInitializersResolveType() {
		assertEquals("int", declaration("let n = 1;").resolvedType());
		assertEquals("double", declaration("let n = 1.5;").resolvedType());
		assertEquals("std::string", declaration("let s = `x`;").resolvedType());
		assertEquals("bool", declaration("let b = true;").resolvedType());
		assertEquals("int", declaration("let a = [1, 2];").resolvedType());
		assertNull(declaration("let c = f();").resolvedType());
	}

	@Test
	void keepsEveryDeclarator() {
		VariableStatement statement = assertInstanceOf(VariableStatement.class,
				new TsParser().parse("let a = 1, b = 2").statements().get(0));
		VariableDeclarationList list = statement.declarationList();
		assertEquals("let", list.keyword());
		assertEquals(2, list.declarations().size());
	}

	@Test
	void declareWrapsVariableStatement() {
		DeclareStatement declare = assertInstanceOf(DeclareStatement.class,
				new TsParser().parse("declare const PI = 3.14;").statements().get(0));
		assertEquals("PI", declare.declaration().declarationList().declarations().get(0).name());
	}

	@Test
	void parsesFunctionDeclaration() {
		FunctionDeclaration function = assertInstanceOf(FunctionDeclaration.class,
				new TsParser().parse("export function add(a: number, b): number { return a + b; }").statements().get(0));
		assertEquals("add", function.name());
		assertEquals("number", function.parameters().get(0).typeAnnotation());
		assertNull(function.parameters().get(1).typeAnnotation());
		assertEquals("number", function.returnType());
		ReturnStatement ret = assertInstanceOf(ReturnStatement.class, function.body().statements().get(0));
		assertEquals("+", assertInstanceOf(BinaryExpression.class, ret.expression()).operator());
	}

	@Test
	void parsesArrowFunctions() {
		ArrowFunction single = assertInstanceOf(ArrowFunction.class, declaration("const f = x => x * 2;").initializer());
		assertEquals("x", single.parameters().get(0).name());
		assertInstanceOf(BinaryExpression.class, single.body());

		ArrowFunction typed = assertInstanceOf(ArrowFunction.class,
				declaration("const g = (a: number): number => { return a; };").initializer());
		assertEquals("number", typed.returnType());
		assertInstanceOf(Block.class, typed.body());
	}

	@Test
	void multiplicationBindsTighterThanAddition() {
		BinaryExpression sum = assertInstanceOf(BinaryExpression.class, expression("a + b * c;"));
		assertEquals("+", sum.operator());
		assertEquals("*", assertInstanceOf(BinaryExpression.class, sum.right()).operator());
	}

	@Test
	void assignmentIsRightAssociative() {
		BinaryExpression outer = assertInstanceOf(BinaryExpression.class, expression("a = b = 1;"));
		assertEquals("a", assertInstanceOf(Identifier.class, outer.left()).text());
		assertInstanceOf(BinaryExpression.class, outer.right());
	}

	@Test
	void memberCallChain() {
		CallExpression call = assertInstanceOf(CallExpression.class, expression("console.log(\"hi\");"));
		PropertyAccessExpression callee = assertInstanceOf(PropertyAccessExpression.class, call.callee());
		assertEquals("log", callee.name());
		assertEquals("hi", assertInstanceOf(StringLiteral.class, call.arguments().get(0)).text());
	}

	@Test
	void templateIsSplitIntoCookedSegments() {
		TemplateExpression template = assertInstanceOf(TemplateExpression.class,
				declaration("const t = `a\\t${x + 1}b${y}`;").initializer());
		assertEquals("a\t", template.head());
		assertEquals(2, template.spans().size());
		assertInstanceOf(BinaryExpression.class, template.spans().get(0).expression());
		assertEquals("b", template.spans().get(0).literal());
		assertEquals("", template.spans().get(1).literal());
	}

	@Test
	void placeholderSpansPointIntoEnclosingSource() {
		String source = "const t = `v=${value}`;";
		TemplateExpression template = assertInstanceOf(TemplateExpression.class, declaration(source).initializer());
		Identifier value = assertInstanceOf(Identifier.class, template.spans().get(0).expression());
		assertEquals(source.indexOf("value"), value.span().startOffset());
	}

	@Test
	void forClausesMayBeEmpty() {
		ForStatement loop = assertInstanceOf(ForStatement.class,
				new TsParser().parse("for (;;) { }").statements().get(0));
		assertNull(loop.initializer());
		assertNull(loop.condition());
		assertNull(loop.incrementor());
	}

	@Test
	void elseBranchIsOptional() {
		IfStatement statement = assertInstanceOf(IfStatement.class,
				new TsParser().parse("if (a) b = 1").statements().get(0));
		assertNull(statement.elseStatement());
	}

	@Test
	void cooksEscapes() {
		assertEquals("a\nbé\\", TsParser.cook("a\\nb\\u00e9\\\\"));
	}

	@Test
	void reportsUnexpectedToken() {
		TsParseException ex = assertThrows(TsParseException.class, () -> new TsParser().parse("const = 1;"));
		assertEquals(6, ex.offset());
	}
}
