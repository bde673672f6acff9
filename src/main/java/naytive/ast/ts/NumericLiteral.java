package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record NumericLiteral(String text, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.NUMERIC_LITERAL;
	}
}
