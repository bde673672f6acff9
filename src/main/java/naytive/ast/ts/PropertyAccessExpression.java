package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record PropertyAccessExpression(TsExpression expression, String name, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.PROPERTY_ACCESS_EXPRESSION;
	}
}
