package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record PostfixUnaryExpression(TsExpression operand, String operator, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.POSTFIX_UNARY_EXPRESSION;
	}
}
