package naytive.parse.ts;

import naytive.TranspileException;

/**
 * Thrown when the bundled parser cannot make sense of the source text.
 */
public class TsParseException extends TranspileException {
	private static final long serialVersionUID = 1L;

	private final int offset;

	public TsParseException(String message, int offset) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	public int offset() {
		return offset;
	}
}
