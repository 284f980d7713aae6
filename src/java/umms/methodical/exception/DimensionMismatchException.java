package umms.methodical.exception;

/**
 * Thrown when two tables that are meant to be paired by row (sample) do not have the same number of rows.
 */
public class DimensionMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int rows1;
	private final int rows2;

	public DimensionMismatchException(int rows1, int rows2) {
		super("Number of rows of table1 and table2 must be equal, found " + rows1 + " and " + rows2);
		this.rows1 = rows1;
		this.rows2 = rows2;
	}

	public int getRows1() {
		return rows1;
	}

	public int getRows2() {
		return rows2;
	}
}
