package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

/**
 * {@code body} is either a {@link Block} or a {@link TsExpression}.
 */
public record ArrowFunction(List<Parameter> parameters, String returnType, TsNode body, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.ARROW_FUNCTION;
	}
}
