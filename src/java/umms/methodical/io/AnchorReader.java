package umms.methodical.io;

import java.io.File;
import java.io.IOException;
import java.util.List;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.GenomicPosition;
import umms.methodical.annotation.Strand;
import umms.methodical.exception.ParseException;

/**
 * Reads anchors from a BED file (at least six columns). The anchor is the transcription start site:
 * the first base of the interval on the plus strand, the last base on the minus strand, as a 1-based position.
 * The BED name column must match the feature id in the feature table.
 * Optional seventh and eighth columns override the upstream and downstream window extents.
 */
public class AnchorReader {

	public static List<Anchor> read(File file) throws IOException {
		return TabbedReader.readAll(file, new TabbedReader.Factory<Anchor>() {
			public Anchor create(String[] fields, int lineNumber) {
				return parse(fields, lineNumber);
			}
		}, 0);
	}

	static Anchor parse(String[] fields, int lineNumber) {
		if (fields.length < 6) {
			throw new ParseException("Line " + lineNumber + ": BED6 expected but found " + fields.length + " fields");
		}
		if (fields[0].equals("track") || fields[0].equals("browser")) {
			throw new ParseException("Line " + lineNumber + ": track and browser lines must be commented out");
		}
		int start = TabbedReader.parseInt(fields[1], lineNumber);
		int end = TabbedReader.parseInt(fields[2], lineNumber);
		Strand strand = Strand.fromString(fields[5]);
		if (strand == Strand.UNKNOWN) {
			throw new ParseException("Line " + lineNumber + ": anchor " + fields[3] + " needs a strand, found \"" + fields[5] + "\"");
		}
		int tss = strand == Strand.NEGATIVE ? end : start + 1;
		GenomicPosition location = new GenomicPosition(fields[0], tss, strand);
		if (fields.length >= 8) {
			return new Anchor(fields[3], location, TabbedReader.parseInt(fields[6], lineNumber), TabbedReader.parseInt(fields[7], lineNumber));
		}
		return new Anchor(fields[3], location);
	}
}
