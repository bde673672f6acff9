package naytive.ast.ts;

import naytive.ast.SourceSpan;

public record NoSubstitutionTemplateLiteral(String text, SourceSpan span) implements TsExpression {
	@Override
	public NodeKind kind() {
		return NodeKind.NO_SUBSTITUTION_TEMPLATE_LITERAL;
	}
}
