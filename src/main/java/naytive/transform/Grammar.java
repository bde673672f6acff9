package naytive.transform;

import naytive.ast.ts.ArrayLiteralExpression;
import naytive.ast.ts.ArrowFunction;
import naytive.ast.ts.BinaryExpression;
import naytive.ast.ts.Block;
import naytive.ast.ts.BooleanLiteral;
import naytive.ast.ts.CallExpression;
import naytive.ast.ts.DeclareStatement;
import naytive.ast.ts.ElementAccessExpression;
import naytive.ast.ts.ExpressionStatement;
import naytive.ast.ts.ForStatement;
import naytive.ast.ts.FunctionDeclaration;
import naytive.ast.ts.Identifier;
import naytive.ast.ts.IfStatement;
import naytive.ast.ts.ImportDeclaration;
import naytive.ast.ts.NoSubstitutionTemplateLiteral;
import naytive.ast.ts.NodeKind;
import naytive.ast.ts.NullLiteral;
import naytive.ast.ts.NumericLiteral;
import naytive.ast.ts.ParenthesizedExpression;
import naytive.ast.ts.PostfixUnaryExpression;
import naytive.ast.ts.PrefixUnaryExpression;
import naytive.ast.ts.PropertyAccessExpression;
import naytive.ast.ts.ReturnStatement;
import naytive.ast.ts.StringLiteral;
import naytive.ast.ts.TemplateExpression;
import naytive.ast.ts.TsNode;
import naytive.ast.ts.TypeOfExpression;
import naytive.ast.ts.VariableDeclaration;
import naytive.ast.ts.VariableDeclarationList;
import naytive.ast.ts.VariableStatement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The dispatch table: one translation rule per supported node kind.
 *
 * Kinds without a rule ({@link NodeKind#PARAMETER}, {@link NodeKind#SOURCE_FILE})
 * fail with {@link UnmappedNodeException}; the table has no catch-all.
 * Library calls are matched by name inside the call rule, see {@link Builtin}.
 */
public final class Grammar {
	private final Map<NodeKind, TranslationRule> rules;

	private Grammar(Map<NodeKind, TranslationRule> rules) {
		this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
	}

	public static Grammar standard() {
		Map<NodeKind, TranslationRule> rules = new EnumMap<>(NodeKind.class);

		// declarations
		rules.put(NodeKind.IMPORT_DECLARATION, TranslationRule.of(ImportDeclaration.class, ImportRules::lowerImport));
		rules.put(NodeKind.DECLARE_STATEMENT, TranslationRule.of(DeclareStatement.class, DeclarationRules::lowerDeclare));
		rules.put(NodeKind.VARIABLE_STATEMENT,
				TranslationRule.of(VariableStatement.class, DeclarationRules::lowerVariableStatement));
		rules.put(NodeKind.VARIABLE_DECLARATION_LIST,
				TranslationRule.of(VariableDeclarationList.class, DeclarationRules::lowerDeclarationList));
		rules.put(NodeKind.VARIABLE_DECLARATION,
				TranslationRule.of(VariableDeclaration.class, DeclarationRules::lowerVariableDeclaration));
		rules.put(NodeKind.FUNCTION_DECLARATION,
				TranslationRule.of(FunctionDeclaration.class, DeclarationRules::lowerFunction));
		rules.put(NodeKind.ARROW_FUNCTION, TranslationRule.of(ArrowFunction.class, DeclarationRules::lowerArrowFunction));

		// control flow
		rules.put(NodeKind.BLOCK, TranslationRule.of(Block.class, ControlFlowRules::lowerBlock));
		rules.put(NodeKind.IF_STATEMENT, TranslationRule.of(IfStatement.class, ControlFlowRules::lowerIf));
		rules.put(NodeKind.FOR_STATEMENT, TranslationRule.of(ForStatement.class, ControlFlowRules::lowerFor));
		rules.put(NodeKind.EXPRESSION_STATEMENT,
				TranslationRule.of(ExpressionStatement.class, ControlFlowRules::lowerExpressionStatement));
		rules.put(NodeKind.RETURN_STATEMENT, TranslationRule.of(ReturnStatement.class, ControlFlowRules::lowerReturn));

		// expressions
		rules.put(NodeKind.BINARY_EXPRESSION, TranslationRule.of(BinaryExpression.class, ExpressionRules::lowerBinary));
		rules.put(NodeKind.CALL_EXPRESSION, TranslationRule.of(CallExpression.class, ExpressionRules::lowerCall));
		rules.put(NodeKind.PROPERTY_ACCESS_EXPRESSION,
				TranslationRule.of(PropertyAccessExpression.class, ExpressionRules::lowerPropertyAccess));
		rules.put(NodeKind.ELEMENT_ACCESS_EXPRESSION,
				TranslationRule.of(ElementAccessExpression.class, ExpressionRules::lowerElementAccess));
		rules.put(NodeKind.TEMPLATE_EXPRESSION,
				TranslationRule.of(TemplateExpression.class, ExpressionRules::lowerTemplate));
		rules.put(NodeKind.NO_SUBSTITUTION_TEMPLATE_LITERAL,
				TranslationRule.of(NoSubstitutionTemplateLiteral.class, ExpressionRules::lowerNoSubstitutionTemplate));
		rules.put(NodeKind.STRING_LITERAL, TranslationRule.of(StringLiteral.class, ExpressionRules::lowerString));
		rules.put(NodeKind.NUMERIC_LITERAL, TranslationRule.of(NumericLiteral.class, ExpressionRules::lowerNumeric));
		rules.put(NodeKind.BOOLEAN_LITERAL, TranslationRule.of(BooleanLiteral.class, ExpressionRules::lowerBoolean));
		rules.put(NodeKind.NULL_LITERAL, TranslationRule.of(NullLiteral.class, ExpressionRules::lowerNull));
		rules.put(NodeKind.IDENTIFIER, TranslationRule.of(Identifier.class, ExpressionRules::lowerIdentifier));
		rules.put(NodeKind.ARRAY_LITERAL_EXPRESSION,
				TranslationRule.of(ArrayLiteralExpression.class, ExpressionRules::lowerArrayLiteral));
		rules.put(NodeKind.TYPE_OF_EXPRESSION, TranslationRule.of(TypeOfExpression.class, ExpressionRules::lowerTypeOf));
		rules.put(NodeKind.PREFIX_UNARY_EXPRESSION,
				TranslationRule.of(PrefixUnaryExpression.class, ExpressionRules::lowerPrefixUnary));
		rules.put(NodeKind.POSTFIX_UNARY_EXPRESSION,
				TranslationRule.of(PostfixUnaryExpression.class, ExpressionRules::lowerPostfixUnary));
		rules.put(NodeKind.PARENTHESIZED_EXPRESSION,
				TranslationRule.of(ParenthesizedExpression.class, ExpressionRules::lowerParenthesized));

		return new Grammar(rules);
	}

	public Optional<TranslationRule> lookup(NodeKind kind) {
		return Optional.ofNullable(rules.get(kind));
	}

	public String apply(TsNode node, SourceContext ctx, Translator translator) {
		TranslationRule rule = lookup(node.kind()).orElseThrow(() -> new UnmappedNodeException(node));
		return rule.apply(node, ctx, translator);
	}

	public Set<NodeKind> supportedKinds() {
		return rules.keySet();
	}
}
