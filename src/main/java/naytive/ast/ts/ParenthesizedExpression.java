package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record ParenthesizedExpression(TsExpression expression, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.PARENTHESIZED_EXPRESSION;
	}
}
