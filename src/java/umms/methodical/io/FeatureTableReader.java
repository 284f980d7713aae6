package umms.methodical.io;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import umms.methodical.exception.ParseException;
import umms.methodical.storage.FeatureTable;

/**
 * Reads a feature table (e.g. transcript expression) from a tab-delimited file with a header line
 * <pre>feature_id	sample1	sample2	...</pre>
 * followed by one line per feature.
 */
public class FeatureTableReader {

	static Logger logger = Logger.getLogger(FeatureTableReader.class.getName());

	public static FeatureTable read(File file) throws IOException {
		String[] header = TabbedReader.readHeader(file);
		if (header == null || header.length < 2) {
			throw new ParseException(file + ": header must name the feature column and at least one sample column");
		}
		final List<String> samples = Arrays.asList(Arrays.copyOfRange(header, 1, header.length));
		final Map<String, double[]> rows = new LinkedHashMap<String, double[]>();

		TabbedReader.TabbedIterator<Void> itr = TabbedReader.read(file, new TabbedReader.Factory<Void>() {
			public Void create(String[] fields, int lineNumber) {
				if (fields.length != samples.size() + 1) {
					throw new ParseException("Line " + lineNumber + ": expected " + (samples.size() + 1) + " fields but found " + fields.length);
				}
				double[] values = new double[samples.size()];
				for (int i = 0; i < values.length; i++) {
					values[i] = TabbedReader.parseValue(fields[i + 1], lineNumber);
				}
				if (rows.put(fields[0], values) != null) {
					logger.warn("Feature " + fields[0] + " appears more than once, keeping line " + lineNumber);
				}
				return null;
			}
		}, 1);
		try {
			while (itr.hasNext()) itr.next();
		} finally {
			itr.close();
		}
		logger.info("Read " + rows.size() + " features for " + samples.size() + " samples from " + file.getName());
		return new FeatureTable(samples, rows);
	}
}
