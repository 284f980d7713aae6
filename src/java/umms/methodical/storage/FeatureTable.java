package umms.methodical.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table of per-sample values keyed by feature id. Immutable once built.
 */
public class FeatureTable {

	private final List<String> sampleNames;
	private final Map<String, double[]> rows;

	public FeatureTable(List<String> sampleNames, Map<String, double[]> rows) {
		this.sampleNames = List.copyOf(sampleNames);
		this.rows = new LinkedHashMap<String, double[]>();
		for (Map.Entry<String, double[]> row : rows.entrySet()) {
			if (row.getValue().length != sampleNames.size()) {
				throw new IllegalArgumentException("Feature " + row.getKey() + " has " + row.getValue().length + " values, expected " + sampleNames.size());
			}
			this.rows.put(row.getKey(), row.getValue().clone());
		}
	}

	public List<String> getSampleNames() {
		return sampleNames;
	}

	public List<String> getFeatureIds() {
		return new ArrayList<String>(rows.keySet());
	}

	public boolean hasFeature(String featureId) {
		return rows.containsKey(featureId);
	}

	/**
	 * @return the feature's values keyed by sample, or null if the feature is unknown
	 */
	public FeatureVector getFeatureVector(String featureId) {
		double[] row = rows.get(featureId);
		if (row == null) return null;
		Map<String, Double> values = new LinkedHashMap<String, Double>();
		for (int i = 0; i < sampleNames.size(); i++) {
			values.put(sampleNames.get(i), row[i]);
		}
		return new FeatureVector(featureId, values);
	}

	public int size() {
		return rows.size();
	}
}
