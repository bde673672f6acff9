package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record BinaryExpression(TsExpression left, String operator, TsExpression right, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.BINARY_EXPRESSION;
	}
}
