package naytive.ast.ts;

import naytive.ast.SourceSpan;

/**
 * {@code elseStatement} is null when the source has no else clause.
 */
public record IfStatement(TsExpression condition, TsStatement thenStatement, TsStatement elseStatement, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.IF_STATEMENT;
	}
}
