package umms.methodical.correlation;

import java.util.ArrayList;
import java.util.List;

/**
 * Named numeric columns sharing one row dimension (samples). Missing values are NaN.
 * Columns are stored column-major since the correlation engine walks columns.
 */
public final class NumericTable {

	private final List<String> columnNames;
	private final double[][] columns;
	private final int numRows;

	/**
	 * @param columns one array per column, all of the same length. Arrays are copied.
	 */
	public NumericTable(List<String> columnNames, double[][] columns) {
		if (columnNames.size() != columns.length) {
			throw new IllegalArgumentException(columnNames.size() + " column names given for " + columns.length + " columns");
		}
		int rows = columns.length == 0 ? 0 : columns[0].length;
		this.columns = new double[columns.length][];
		for (int j = 0; j < columns.length; j++) {
			if (columns[j].length != rows) {
				throw new IllegalArgumentException("Column " + columnNames.get(j) + " has " + columns[j].length + " rows, expected " + rows);
			}
			this.columns[j] = columns[j].clone();
		}
		this.columnNames = List.copyOf(columnNames);
		this.numRows = rows;
	}

	/**
	 * Builds a table from row-major data, one inner array per row
	 */
	public static NumericTable fromRows(List<String> columnNames, double[][] rows) {
		double[][] cols = new double[columnNames.size()][rows.length];
		for (int i = 0; i < rows.length; i++) {
			if (rows[i].length != columnNames.size()) {
				throw new IllegalArgumentException("Row " + i + " has " + rows[i].length + " values, expected " + columnNames.size());
			}
			for (int j = 0; j < rows[i].length; j++) {
				cols[j][i] = rows[i][j];
			}
		}
		return new NumericTable(columnNames, cols);
	}

	/**
	 * A table with a single column
	 */
	public static NumericTable singleColumn(String name, double[] values) {
		List<String> names = new ArrayList<String>(1);
		names.add(name);
		return new NumericTable(names, new double[][] {values});
	}

	public int getNumRows() {
		return numRows;
	}

	public int getNumColumns() {
		return columns.length;
	}

	public List<String> getColumnNames() {
		return columnNames;
	}

	public String getColumnName(int j) {
		return columnNames.get(j);
	}

	/**
	 * Backing array of column j, callers must not modify it
	 */
	double[] column(int j) {
		return columns[j];
	}

	public double[] getColumn(int j) {
		return columns[j].clone();
	}
}
