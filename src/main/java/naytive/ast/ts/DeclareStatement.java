package naytive.ast.ts;

import naytive.ast.SourceSpan;

/**
 * {@code declare const NAME = VALUE;}
 */
public record DeclareStatement(VariableStatement declaration, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.DECLARE_STATEMENT;
	}
}
