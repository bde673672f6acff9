package naytive.transform;

import naytive.TranspileException;

import java.nio.file.Path;

/**
 * A relative import points at a file that does not exist.
 */
public class UnresolvableImportException extends TranspileException {
	private static final long serialVersionUID = 1L;

	private final Path target;

	public UnresolvableImportException(Path target) {
		super("File " + target.getFileName() + " does not exist in " + target.getParent());
		this.target = target;
	}

	public Path target() {
		return target;
	}
}
