package umms.methodical.model.score;

/**
 * Signed significance of a site: -sign(r) * log10(p).
 * Sites where methylation goes down as the feature goes up get negative scores.
 */
public class MethodicalScore {

	private MethodicalScore() {}

	/**
	 * @return the score, NaN if r or p is undefined. A P value that underflowed to 0 is treated as the smallest positive double.
	 */
	public static double score(double correlation, double pValue) {
		if (Double.isNaN(correlation) || Double.isNaN(pValue)) return Double.NaN;
		double p = Math.max(pValue, Double.MIN_VALUE);
		return -Math.signum(correlation) * Math.log10(p);
	}

	/**
	 * Score that a site must reach to be called significant at the given P value
	 */
	public static double threshold(double pValueThreshold) {
		if (!(pValueThreshold > 0 && pValueThreshold <= 1)) {
			throw new IllegalArgumentException("P value threshold must be in (0, 1], got " + pValueThreshold);
		}
		return -Math.log10(pValueThreshold);
	}
}
