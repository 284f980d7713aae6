package umms.methodical.io;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import umms.methodical.exception.ParseException;
import umms.methodical.storage.InMemoryMethylationStore;

/**
 * Reads a methylation matrix from a tab-delimited file with a header line
 * <pre>seqname	position	sample1	sample2	...</pre>
 * followed by one line per site. Missing values may be written as NA, NaN, '.' or left empty.
 */
public class MethylationMatrixReader {

	static Logger logger = Logger.getLogger(MethylationMatrixReader.class.getName());

	public static InMemoryMethylationStore read(File file) throws IOException {
		String[] header = TabbedReader.readHeader(file);
		if (header == null || header.length < 3) {
			throw new ParseException(file + ": header must name the sequence, position and at least one sample column");
		}
		final List<String> samples = Arrays.asList(Arrays.copyOfRange(header, 2, header.length));
		final InMemoryMethylationStore.Builder builder = new InMemoryMethylationStore.Builder(samples);

		TabbedReader.TabbedIterator<Void> itr = TabbedReader.read(file, new TabbedReader.Factory<Void>() {
			public Void create(String[] fields, int lineNumber) {
				if (fields.length != samples.size() + 2) {
					throw new ParseException("Line " + lineNumber + ": expected " + (samples.size() + 2) + " fields but found " + fields.length);
				}
				double[] values = new double[samples.size()];
				for (int i = 0; i < values.length; i++) {
					values[i] = TabbedReader.parseValue(fields[i + 2], lineNumber);
				}
				builder.addSite(fields[0], TabbedReader.parseInt(fields[1], lineNumber), values);
				return null;
			}
		}, 1);
		try {
			while (itr.hasNext()) itr.next();
		} finally {
			itr.close();
		}
		InMemoryMethylationStore store = builder.build();
		logger.info("Read " + store.getNumSites() + " sites for " + samples.size() + " samples from " + file.getName());
		return store;
	}
}
