package umms.methodical.storage;

import java.util.Arrays;
import java.util.List;

/**
 * Read-only view of methylation values for a run of consecutive sites on one sequence.
 * Rows are sites in coordinate order, columns are samples. Missing values are NaN.
 */
public final class SiteValueMatrix {

	private final String chr;
	private final int[] positions;
	private final List<String> sampleNames;
	private final double[][] values;

	/**
	 * @param values one row per site, one column per sample. The arrays are not copied, callers hand over ownership.
	 */
	public SiteValueMatrix(String chr, int[] positions, List<String> sampleNames, double[][] values) {
		if (positions.length != values.length) {
			throw new IllegalArgumentException("Got " + positions.length + " positions but " + values.length + " rows of values");
		}
		for (int i = 0; i < values.length; i++) {
			if (values[i].length != sampleNames.size()) {
				throw new IllegalArgumentException("Row for position " + positions[i] + " has " + values[i].length + " values, expected " + sampleNames.size());
			}
		}
		this.chr = chr;
		this.positions = positions;
		this.sampleNames = List.copyOf(sampleNames);
		this.values = values;
	}

	public String getChr() {
		return chr;
	}

	public int getNumSites() {
		return positions.length;
	}

	public int getNumSamples() {
		return sampleNames.size();
	}

	public List<String> getSampleNames() {
		return sampleNames;
	}

	public int getPosition(int site) {
		return positions[site];
	}

	public int[] getPositions() {
		return positions.clone();
	}

	public double getValue(int site, int sample) {
		return values[site][sample];
	}

	/**
	 * Values of one site restricted to the given sample columns, in the order given
	 */
	public double[] getSiteValues(int site, int[] sampleColumns) {
		double[] rtrn = new double[sampleColumns.length];
		for (int i = 0; i < sampleColumns.length; i++) {
			rtrn[i] = values[site][sampleColumns[i]];
		}
		return rtrn;
	}

	public String toString() {
		return chr + ":" + (positions.length == 0 ? "empty" : positions[0] + "-" + positions[positions.length - 1])
				+ " " + positions.length + " sites x " + sampleNames.size() + " samples " + Arrays.toString(sampleNames.toArray());
	}
}
