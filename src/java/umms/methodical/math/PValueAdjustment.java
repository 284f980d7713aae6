package umms.methodical.math;

import java.util.Arrays;
import java.util.Comparator;

import umms.methodical.exception.InvalidMethodException;

/**
 * Multiple testing corrections, named after the methods of R's p.adjust.
 * Missing P values are left missing and are not counted in the number of tests.
 */
public enum PValueAdjustment {
	HOLM("holm"),
	HOCHBERG("hochberg"),
	HOMMEL("hommel"),
	BONFERRONI("bonferroni"),
	BH("BH"),
	BY("BY"),
	FDR("fdr"),
	NONE("none");

	private final String name;

	private PValueAdjustment(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public String toString() {
		return name;
	}

	/**
	 * @throws InvalidMethodException if the name matches no method; matching is exact, as in p.adjust
	 */
	public static PValueAdjustment fromName(String value) {
		for (PValueAdjustment m : values()) {
			if (m.name.equals(value)) return m;
		}
		throw new InvalidMethodException("p-value adjustment", value, values());
	}

	/**
	 * Adjust a set of P values for multiple testing
	 * @param pvals The P values, NaN for missing
	 * @return Array of adjusted P values in the same order
	 */
	public double[] adjust(double[] pvals) {
		double[] rtrn = new double[pvals.length];
		Arrays.fill(rtrn, Double.NaN);
		double[] present = Statistics.withoutMissing(pvals);
		if (present.length == 0) return rtrn;

		double[] adjusted = adjustComplete(present);
		int j = 0;
		for (int i = 0; i < pvals.length; i++) {
			if (!Statistics.isMissing(pvals[i])) rtrn[i] = adjusted[j++];
		}
		return rtrn;
	}

	private double[] adjustComplete(double[] p) {
		int n = p.length;
		if (n == 1 && this != HOMMEL) return this == NONE ? p.clone() : new double[] {Math.min(1.0, p[0])};
		switch (this) {
		case BONFERRONI: {
			double[] rtrn = new double[n];
			for (int i = 0; i < n; i++) rtrn[i] = Math.min(1.0, n * p[i]);
			return rtrn;
		}
		case HOLM: {
			Integer[] o = order(p, false);
			double[] rtrn = new double[n];
			double running = 0;
			for (int k = 0; k < n; k++) {
				running = Math.max(running, (n - k) * p[o[k]]);
				rtrn[o[k]] = Math.min(1.0, running);
			}
			return rtrn;
		}
		case HOCHBERG:
			return stepUp(p, 1.0, false);
		case BH:
		case FDR:
			return stepUp(p, 1.0, true);
		case BY: {
			double q = 0;
			for (int i = 1; i <= n; i++) q += 1.0 / i;
			return stepUp(p, q, true);
		}
		case HOMMEL:
			return hommel(p);
		case NONE:
		default:
			return p.clone();
		}
	}

	/**
	 * Walks the P values from largest to smallest keeping a running minimum.
	 * With byRank the multiplier is n/i (BH, BY), otherwise it is n-i+1 (Hochberg).
	 */
	private static double[] stepUp(double[] p, double factor, boolean byRank) {
		int n = p.length;
		Integer[] o = order(p, true);
		double[] rtrn = new double[n];
		double running = Double.POSITIVE_INFINITY;
		for (int k = 0; k < n; k++) {
			int i = n - k;
			double multiplier = byRank ? (double) n / i : (n - i + 1);
			running = Math.min(running, factor * multiplier * p[o[k]]);
			rtrn[o[k]] = Math.min(1.0, running);
		}
		return rtrn;
	}

	private static double[] hommel(double[] unsorted) {
		int n = unsorted.length;
		Integer[] o = order(unsorted, false);
		double[] p = new double[n];
		for (int k = 0; k < n; k++) p[k] = unsorted[o[k]];
		if (n == 1) return new double[] {p[0]};

		double start = Double.POSITIVE_INFINITY;
		for (int i = 1; i <= n; i++) start = Math.min(start, n * p[i - 1] / i);
		double[] q = new double[n];
		double[] pa = new double[n];
		Arrays.fill(q, start);
		Arrays.fill(pa, start);

		for (int m = n - 1; m >= 2; m--) {
			// i1 = 1..n-m+1, i2 = n-m+2..n (1-based)
			double q1 = Double.POSITIVE_INFINITY;
			for (int k = 2; k <= m; k++) {
				q1 = Math.min(q1, m * p[n - m + k - 1] / k);
			}
			for (int i = 1; i <= n - m + 1; i++) {
				q[i - 1] = Math.min(m * p[i - 1], q1);
			}
			for (int i = n - m + 2; i <= n; i++) {
				q[i - 1] = q[n - m];
			}
			for (int i = 0; i < n; i++) {
				pa[i] = Math.max(pa[i], q[i]);
			}
		}

		double[] rtrn = new double[n];
		for (int k = 0; k < n; k++) {
			rtrn[o[k]] = Math.max(pa[k], p[k]);
		}
		return rtrn;
	}

	/**
	 * Stable ordering of indices by P value
	 */
	private static Integer[] order(final double[] p, boolean decreasing) {
		Integer[] idx = new Integer[p.length];
		for (int i = 0; i < idx.length; i++) idx[i] = i;
		Comparator<Integer> byValue = new Comparator<Integer>() {
			public int compare(Integer a, Integer b) {
				return Double.compare(p[a], p[b]);
			}
		};
		Arrays.sort(idx, decreasing ? byValue.reversed() : byValue);
		return idx;
	}
}
