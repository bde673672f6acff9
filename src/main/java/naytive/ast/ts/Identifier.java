package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record Identifier(String text, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.IDENTIFIER;
	}
}
