package naytive.ast;

/**
 * Source span for diagnostics and source-text recovery.
 *
 * Offsets are 0-based character indices into the original source text.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public boolean isKnown() {
		return startOffset >= 0 && endOffset >= startOffset;
	}

	public static SourceSpan between(SourceSpan start, SourceSpan end) {
		return new SourceSpan(start.startOffset(), end.endOffset());
	}
}
