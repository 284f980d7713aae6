package umms.methodical.io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import umms.methodical.correlation.NumericTable;
import umms.methodical.exception.ParseException;

/**
 * Reads a sample-by-feature table: a header naming the features, then one line per sample whose first field is
 * the sample name. Rows of two tables to be correlated are paired by order, so both files must list samples
 * in the same order.
 */
public class NumericTableReader {

	public static NumericTable read(File file) throws IOException {
		return read(file, null);
	}

	/**
	 * @param sampleNames if not null, receives the sample names in row order
	 */
	public static NumericTable read(File file, final List<String> sampleNames) throws IOException {
		String[] header = TabbedReader.readHeader(file);
		if (header == null || header.length < 2) {
			throw new ParseException(file + ": header must name the sample column and at least one feature");
		}
		final List<String> features = Arrays.asList(Arrays.copyOfRange(header, 1, header.length));
		List<double[]> rows = TabbedReader.readAll(file, new TabbedReader.Factory<double[]>() {
			public double[] create(String[] fields, int lineNumber) {
				if (fields.length != features.size() + 1) {
					throw new ParseException("Line " + lineNumber + ": expected " + (features.size() + 1) + " fields but found " + fields.length);
				}
				if (sampleNames != null) sampleNames.add(fields[0]);
				double[] values = new double[features.size()];
				for (int i = 0; i < values.length; i++) {
					values[i] = TabbedReader.parseValue(fields[i + 1], lineNumber);
				}
				return values;
			}
		}, 1);
		return NumericTable.fromRows(new ArrayList<String>(features), rows.toArray(new double[rows.size()][]));
	}
}
