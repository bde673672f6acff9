package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

/**
 * {@code `head${expr}literal${expr}literal`}
 *
 * Literal segments hold cooked text.
 */
public record TemplateExpression(String head, List<Span> spans, SourceSpan span) implements TsExpression {
	public record Span(TsExpression expression, String literal) {
	}

	@Override
	public NodeKind kind() {
		return NodeKind.TEMPLATE_EXPRESSION;
	}
}
