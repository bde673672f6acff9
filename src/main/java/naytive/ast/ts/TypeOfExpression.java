package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record TypeOfExpression(TsExpression expression, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.TYPE_OF_EXPRESSION;
	}
}
