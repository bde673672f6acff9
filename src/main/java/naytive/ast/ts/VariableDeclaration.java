package naytive.ast.ts;

import naytive.ast.SourceSpan;

/**
 * One declarator of a {@code const}/{@code let}/{@code var} statement.
 *
 * {@code resolvedType} is the C++ type attached by the parser from the
 * annotation or the initializer; null when nothing could be resolved.
 * {@code initializer} is null for a bare declaration.
 */
public record VariableDeclaration(
		String name,
		String typeAnnotation,
		TsExpression initializer,
		String resolvedType,
		SourceSpan span) implements TsNode {
	@Override
	public NodeKind kind() {
		return NodeKind.VARIABLE_DECLARATION;
	}
}
