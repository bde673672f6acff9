package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record NullLiteral(SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.NULL_LITERAL;
	}
}
