package umms.methodical.correlation;

import java.util.OptionalDouble;

/**
 * Correlation between one column of table1 and one column of table2.
 * Undefined statistics are reported as empty optionals, never as zero.
 */
public final class CorrelationRecord {

	private final String feature1;
	private final String feature2;
	private final double correlation;
	private final double pValue;
	private final double qValue;
	private final int numObservations;

	public CorrelationRecord(String feature1, String feature2, double correlation, double pValue, double qValue, int numObservations) {
		this.feature1 = feature1;
		this.feature2 = feature2;
		this.correlation = correlation;
		this.pValue = pValue;
		this.qValue = qValue;
		this.numObservations = numObservations;
	}

	public String getFeature1() {
		return feature1;
	}

	public String getFeature2() {
		return feature2;
	}

	public OptionalDouble getCorrelation() {
		return optional(correlation);
	}

	public OptionalDouble getPValue() {
		return optional(pValue);
	}

	public OptionalDouble getQValue() {
		return optional(qValue);
	}

	/**
	 * @return correlation, NaN if undefined
	 */
	public double correlationOrNaN() {
		return correlation;
	}

	/**
	 * @return P value, NaN if undefined
	 */
	public double pValueOrNaN() {
		return pValue;
	}

	public double qValueOrNaN() {
		return qValue;
	}

	/**
	 * @return number of rows where both columns were present
	 */
	public int getNumObservations() {
		return numObservations;
	}

	CorrelationRecord withQValue(double q) {
		return new CorrelationRecord(feature1, feature2, correlation, pValue, q, numObservations);
	}

	static OptionalDouble optional(double value) {
		return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
	}

	public String toString() {
		return feature1 + "\t" + feature2 + "\t" + correlation + "\t" + pValue + (Double.isNaN(qValue) ? "" : "\t" + qValue);
	}
}
