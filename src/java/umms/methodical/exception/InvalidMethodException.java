package umms.methodical.exception;

import java.util.Arrays;

/**
 * Thrown when a correlation or p-value adjustment method name is not recognised.
 */
public class InvalidMethodException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidMethodException(String kind, String name, Object[] allowed) {
		super("Unknown " + kind + " method \"" + name + "\", expected one of " + Arrays.toString(allowed));
	}
}
