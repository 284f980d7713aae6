package umms.methodical.region;

import java.util.ArrayList;
import java.util.List;

import umms.methodical.correlation.CorrelationTable;
import umms.methodical.correlation.NumericTable;
import umms.methodical.correlation.RapidCorrelationTest;
import umms.methodical.exception.InsufficientSamplesException;
import umms.methodical.math.Statistics;
import umms.methodical.storage.FeatureVector;
import umms.methodical.storage.MethylationStore;
import umms.methodical.storage.SiteValueMatrix;

/**
 * Summarises methylation over called regions and relates it back to a feature.
 */
public class RegionMethylationSummarizer {

	private final MethylationStore store;

	public RegionMethylationSummarizer(MethylationStore store) {
		this.store = store;
	}

	/**
	 * Mean methylation of each region in each sample, ignoring missing values.
	 * @return one row per store sample, one column per region named after the region; NaN where a sample has no value in a region
	 */
	public NumericTable summarize(List<Region> regions) {
		int numSamples = store.getSampleNames().size();
		List<String> names = new ArrayList<String>(regions.size());
		double[][] columns = new double[regions.size()][];
		for (int r = 0; r < regions.size(); r++) {
			Region region = regions.get(r);
			names.add(region.getName());
			SiteValueMatrix matrix = store.getSiteValues(region.getChr(), region.getStart(), region.getEnd());
			double[] means = new double[numSamples];
			for (int sample = 0; sample < numSamples; sample++) {
				double[] values = new double[matrix.getNumSites()];
				for (int site = 0; site < values.length; site++) {
					values[site] = matrix.getValue(site, sample);
				}
				means[sample] = Statistics.mean(values);
			}
			columns[r] = means;
		}
		return new NumericTable(names, columns);
	}

	/**
	 * Correlates the mean methylation of each region with the feature across the samples the store and feature share
	 * @throws InsufficientSamplesException if fewer than three samples are shared
	 */
	public CorrelationTable correlateWithFeature(List<Region> regions, FeatureVector features, RapidCorrelationTest test) throws InsufficientSamplesException {
		List<String> storeSamples = store.getSampleNames();
		List<Integer> shared = new ArrayList<Integer>();
		for (int i = 0; i < storeSamples.size(); i++) {
			if (features.hasSample(storeSamples.get(i))) shared.add(i);
		}
		if (shared.size() < 3) {
			throw new InsufficientSamplesException(features.getFeatureId(), shared.size());
		}

		NumericTable means = summarize(regions);
		double[][] columns = new double[means.getNumColumns()][shared.size()];
		for (int r = 0; r < columns.length; r++) {
			double[] all = means.getColumn(r);
			for (int i = 0; i < shared.size(); i++) columns[r][i] = all[shared.get(i)];
		}
		double[] featureValues = new double[shared.size()];
		for (int i = 0; i < shared.size(); i++) {
			featureValues[i] = features.getValue(storeSamples.get(shared.get(i)));
		}
		return test.correlate(new NumericTable(means.getColumnNames(), columns), NumericTable.singleColumn(features.getFeatureId(), featureValues));
	}
}
