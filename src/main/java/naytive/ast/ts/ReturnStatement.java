package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record ReturnStatement(TsExpression expression, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.RETURN_STATEMENT;
	}
}
