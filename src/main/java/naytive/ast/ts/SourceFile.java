package naytive.ast.ts;

import naytive.ast.SourceSpan;

import java.util.List;

public record SourceFile(List<TsStatement> statements, SourceSpan span) implements TsNode {
	@Override
	public NodeKind kind() {
		return NodeKind.SOURCE_FILE;
	}
}
