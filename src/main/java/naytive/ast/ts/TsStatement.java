package naytive.ast.ts;

public sealed interface TsStatement extends TsNode permits ImportDeclaration, DeclareStatement, VariableStatement,
		FunctionDeclaration, Block, IfStatement, ForStatement, ExpressionStatement, ReturnStatement {
}
