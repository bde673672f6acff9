package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record ExpressionStatement(TsExpression expression, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.EXPRESSION_STATEMENT;
	}
}
