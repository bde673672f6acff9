package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record PrefixUnaryExpression(String operator, TsExpression operand, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.PREFIX_UNARY_EXPRESSION;
	}
}
