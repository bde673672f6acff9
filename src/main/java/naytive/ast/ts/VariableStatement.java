package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record VariableStatement(VariableDeclarationList declarationList, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.VARIABLE_STATEMENT;
	}
}
