package naytive.ast.ts;

import naytive.ast.SourceSpan;

/**
 * {@code for (initializer; condition; incrementor) statement}
 *
 * The initializer is a {@link VariableDeclarationList} or a {@link TsExpression}.
 * Any of the three clauses is null when the source leaves it empty.
 */
public record ForStatement(
		TsNode initializer,
		TsExpression condition,
		TsExpression incrementor,
		TsStatement statement,
		SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.FOR_STATEMENT;
	}
}
