package naytive;

/**
 * Base class of every failure raised while turning a source module into C++.
 *
 * Translation errors propagate unmodified to the caller of the compiler; a
 * failed module aborts the whole run.
 */
public class TranspileException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public TranspileException(String message) {
		super(message);
	}

	public TranspileException(String message, Throwable cause) {
		super(message, cause);
	}
}
