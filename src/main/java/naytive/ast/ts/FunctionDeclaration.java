package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

public record FunctionDeclaration(String name, List<Parameter> parameters, String returnType, Block body, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.FUNCTION_DECLARATION;
	}
}
