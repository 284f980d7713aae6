package umms.methodical.exception;

import java.io.IOException;

/**
 * Unchecked wrapper for I/O failures raised where a checked exception cannot be declared,
 * e.g. inside iterators over a tab-delimited file.
 */
public class RuntimeIOException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public RuntimeIOException(IOException e) {
		super(e.getMessage(), e);
	}

	/**
	 * @param message
	 */
	public RuntimeIOException(String message) {
		super(message);
	}
}
