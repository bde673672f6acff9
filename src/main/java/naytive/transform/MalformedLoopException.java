package naytive.transform;

import naytive.TranspileException;

/**
 * A counted loop is missing its initializer, condition or incrementor.
 */
public class MalformedLoopException extends TranspileException {
	private static final long serialVersionUID = 1L;

	public MalformedLoopException(String missingClause, int offset) {
		super("for statement at offset " + offset + " has no " + missingClause);
	}
}
