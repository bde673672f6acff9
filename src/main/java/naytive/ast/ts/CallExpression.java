package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

public record CallExpression(TsExpression callee, List<TsExpression> arguments, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.CALL_EXPRESSION;
	}
}
