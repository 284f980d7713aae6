package umms.methodical.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;

import umms.methodical.exception.ParseException;
import umms.methodical.exception.RuntimeIOException;

/**
 * Reads tab-delimited files line by line. Empty lines and lines starting with '#' are skipped.
 */
public class TabbedReader {

	public static final String[] MISSING_TOKENS = {"", "NA", "NaN", "."};

	/**
	 * @param skipRows number of data rows to skip at the beginning of the file, e.g. 1 for a header
	 */
	public static <T> TabbedIterator<T> read(File file, Factory<? extends T> factory, int skipRows) throws IOException {
		return new TabbedIterator<T>(file, factory, skipRows);
	}

	public static <T> List<T> readAll(File file, Factory<? extends T> factory, int skipRows) throws IOException {
		List<T> rtrn = new ArrayList<T>();
		TabbedIterator<T> itr = read(file, factory, skipRows);
		try {
			while (itr.hasNext()) rtrn.add(itr.next());
		} finally {
			itr.close();
		}
		return rtrn;
	}

	/**
	 * @return the fields of the first non-comment line, or null for an empty file
	 */
	public static String[] readHeader(File file) throws IOException {
		BufferedReader br = new BufferedReader(new FileReader(file));
		try {
			LineIterator itr = new LineIterator(br);
			while (itr.hasNext()) {
				String line = itr.next();
				if (isData(line)) return split(line);
			}
			return null;
		} finally {
			br.close();
		}
	}

	/**
	 * Parses a numeric field, treating NA, NaN, '.' and empty fields as missing (NaN)
	 */
	public static double parseValue(String field, int lineNumber) {
		String trimmed = field.trim();
		for (String missing : MISSING_TOKENS) {
			if (missing.equals(trimmed)) return Double.NaN;
		}
		try {
			return Double.parseDouble(trimmed);
		} catch (NumberFormatException e) {
			throw new ParseException("Line " + lineNumber + ": cannot parse \"" + field + "\" as a number", e);
		}
	}

	public static int parseInt(String field, int lineNumber) {
		try {
			return Integer.parseInt(field.trim());
		} catch (NumberFormatException e) {
			throw new ParseException("Line " + lineNumber + ": cannot parse \"" + field + "\" as an integer", e);
		}
	}

	static boolean isData(String line) {
		return !StringUtils.isBlank(line) && !line.startsWith("#");
	}

	static String[] split(String line) {
		return StringUtils.splitPreserveAllTokens(StringUtils.stripEnd(line, "\r\n"), '\t');
	}

	public static class TabbedIterator<T> implements Iterator<T>, Closeable {
		protected LineIterator itr;
		private T curr;
		private boolean hasCurr;
		private int lineNumber = 0;
		protected Factory<? extends T> factory;
		BufferedReader br;

		public TabbedIterator(File file, Factory<? extends T> factory, int skipRows) throws IOException {
			br = new BufferedReader(new FileReader(file));
			itr = new LineIterator(br);
			this.factory = factory;
			try {
				int skipped = 0;
				while (skipped < skipRows && getNextLine() != null) skipped++;
				advance();
			} catch (RuntimeException e) {
				br.close();
				throw e;
			}
		}

		@Override
		public void close() throws IOException {
			br.close();
		}

		@Override
		public boolean hasNext() {
			return hasCurr;
		}

		@Override
		public T next() {
			if (!hasCurr) throw new NoSuchElementException();
			T result = curr;
			advance();
			return result;
		}

		private void advance() {
			curr = null;
			String nextLine = getNextLine();
			hasCurr = nextLine != null;
			if (hasCurr) {
				// factories that only collect side effects may return null
				curr = factory.create(split(nextLine), lineNumber);
			}
		}

		/**
		 * @return next data line, skipping comments and blank lines
		 */
		protected String getNextLine() {
			try {
				while (itr.hasNext()) {
					String line = itr.next();
					lineNumber++;
					if (isData(line)) return line;
				}
				return null;
			} catch (IllegalStateException e) {
				// LineIterator reports read failures this way
				throw new RuntimeIOException(e.getMessage());
			}
		}

		@Override
		public void remove() {
			throw new UnsupportedOperationException("Remove not supported");
		}
	}

	public interface Factory<T> {
		/**
		 * @param lineNumber 1-based line number in the file, for error messages
		 */
		T create(String[] rawFields, int lineNumber) throws ParseException;
	}
}
