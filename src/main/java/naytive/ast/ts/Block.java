package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

public record Block(List<TsStatement> statements, SourceSpan span) implements TsStatement {
	@Override
	public NodeKind kind() {
		return NodeKind.BLOCK;
	}
}
