package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record ElementAccessExpression(TsExpression expression, TsExpression argument, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.ELEMENT_ACCESS_EXPRESSION;
	}
}
