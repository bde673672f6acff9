package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

public record VariableDeclarationList(String keyword, List<VariableDeclaration> declarations, SourceSpan span) implements TsNode {
	@Override
	public NodeKind kind() {
		return NodeKind.VARIABLE_DECLARATION_LIST;
	}
}
