package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record BooleanLiteral(boolean value, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.BOOLEAN_LITERAL;
	}
}
