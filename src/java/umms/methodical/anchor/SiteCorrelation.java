package umms.methodical.anchor;

import java.util.OptionalDouble;

/**
 * Correlation of one methylation site with the anchor's feature.
 */
public final class SiteCorrelation {

	private final int position;
	private final double correlation;
	private final double pValue;
	private final double qValue;
	private final int distance;

	public SiteCorrelation(int position, double correlation, double pValue, double qValue, int distance) {
		this.position = position;
		this.correlation = correlation;
		this.pValue = pValue;
		this.qValue = qValue;
		this.distance = distance;
	}

	public int getPosition() {
		return position;
	}

	public OptionalDouble getCorrelation() {
		return Double.isNaN(correlation) ? OptionalDouble.empty() : OptionalDouble.of(correlation);
	}

	public OptionalDouble getPValue() {
		return Double.isNaN(pValue) ? OptionalDouble.empty() : OptionalDouble.of(pValue);
	}

	public OptionalDouble getQValue() {
		return Double.isNaN(qValue) ? OptionalDouble.empty() : OptionalDouble.of(qValue);
	}

	public double correlationOrNaN() {
		return correlation;
	}

	public double pValueOrNaN() {
		return pValue;
	}

	public double qValueOrNaN() {
		return qValue;
	}

	/**
	 * @return signed distance to the anchor, negative upstream
	 */
	public int getDistance() {
		return distance;
	}
}
