package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

public record ArrayLiteralExpression(List<TsExpression> elements, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.ARRAY_LITERAL_EXPRESSION;
	}
}
