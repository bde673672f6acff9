package naytive.ast.ts;

import naytive.ast.SourceSpan;

/**
 * {@code text} is the cooked value, escapes already resolved.
 */
public record StringLiteral(String text, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.STRING_LITERAL;
	}
}
