package umms.methodical.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One scalar per sample for a single feature, e.g. the expression of a transcript.
 */
public final class FeatureVector {

	private final String featureId;
	private final Map<String, Double> values;

	public FeatureVector(String featureId, Map<String, Double> values) {
		this.featureId = featureId;
		this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(values));
	}

	public String getFeatureId() {
		return featureId;
	}

	public Set<String> getSampleNames() {
		return values.keySet();
	}

	public boolean hasSample(String sample) {
		return values.containsKey(sample);
	}

	/**
	 * @return the value for sample, NaN if the sample is absent or its value is missing
	 */
	public double getValue(String sample) {
		Double v = values.get(sample);
		return v == null ? Double.NaN : v.doubleValue();
	}

	public int size() {
		return values.size();
	}

	public String toString() {
		return featureId + " (" + values.size() + " samples)";
	}
}
