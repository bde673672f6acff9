package naytive.ast.ts;

import naytive.ast.SourceSpan;

/**
 * Function parameter. {@code typeAnnotation} is null when the source omits it.
 */
public record Parameter(String name, String typeAnnotation, SourceSpan span) implements TsNode {
	@Override
	public NodeKind kind() {
		return NodeKind.PARAMETER;
	}
}
