package naytive.transform;

import naytive.TranspileException;
import naytive.ast.ts.NodeKind;
import naytive.ast.ts.TsNode;

/**
 * No translation rule is registered for a node kind.
 */
public class UnmappedNodeException extends TranspileException {
	private static final long serialVersionUID = 1L;

	private final NodeKind kind;

	public UnmappedNodeException(TsNode node) {
		super("No translation rule for " + node.kind() + " at offset " + node.span().startOffset());
		this.kind = node.kind();
	}

	public NodeKind kind() {
		return kind;
	}
}
