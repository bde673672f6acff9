package naytive.ast.ts;

import naytive.ast.SourceSpan;

public sealed interface TsNode permits SourceFile, TsStatement, TsExpression, VariableDeclarationList,
		VariableDeclaration, Parameter {
	NodeKind kind();

	SourceSpan span();
}
