package naytive.ast.ts;

public sealed interface TsExpression extends TsNode permits ArrowFunction, BinaryExpression, CallExpression,
		PropertyAccessExpression, ElementAccessExpression, TemplateExpression, NoSubstitutionTemplateLiteral,
		StringLiteral, NumericLiteral, BooleanLiteral, NullLiteral, Identifier, ArrayLiteralExpression,
		TypeOfExpression, PrefixUnaryExpression, PostfixUnaryExpression, ParenthesizedExpression {
}
