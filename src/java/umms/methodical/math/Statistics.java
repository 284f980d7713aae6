package umms.methodical.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;

/**
 * Numeric helpers shared by the correlation engine and the score smoother.
 * Missing values are represented by {@link Double#NaN} throughout.
 */
public class Statistics {

	private Statistics() {}

	public static boolean isMissing(double value) {
		return Double.isNaN(value);
	}

	/**
	 * @return mean of the non-missing values, NaN if there are none
	 */
	public static double mean(double[] values) {
		int counter = countPresent(values);
		if (counter == 0) return Double.NaN;
		if (counter == values.length) return new Mean().evaluate(values);
		return new Mean().evaluate(withoutMissing(values));
	}

	public static int countPresent(double[] values) {
		int counter = 0;
		for (int i = 0; i < values.length; i++) {
			if (!isMissing(values[i])) counter++;
		}
		return counter;
	}

	public static double[] withoutMissing(double[] values) {
		double[] rtrn = new double[countPresent(values)];
		int j = 0;
		for (int i = 0; i < values.length; i++) {
			if (!isMissing(values[i])) rtrn[j++] = values[i];
		}
		return rtrn;
	}

	/**
	 * Number of positions at which both vectors are non-missing
	 */
	public static int completePairs(double[] x, double[] y) {
		int n = 0;
		for (int i = 0; i < x.length; i++) {
			if (!isMissing(x[i]) && !isMissing(y[i])) n++;
		}
		return n;
	}

	/**
	 * Given an array of values convert it to 1-based ranks, ties receive the average of the ranks they span
	 */
	public static double[] rank(double[] vals) {
		double[] rtrn = new double[vals.length];

		//make count map
		Map<Double, Integer> map = new TreeMap<Double, Integer>();
		for (int i = 0; i < vals.length; i++) {
			int counter = 0;
			if (map.containsKey(vals[i])) { counter = map.get(vals[i]); }
			counter++;
			map.put(vals[i], counter);
		}

		//assign ranks to each number
		Map<Double, Double> rankMap = new TreeMap<Double, Double>();
		int rank = 1;
		for (Map.Entry<Double, Integer> entry : map.entrySet()) {
			int count = entry.getValue();
			rankMap.put(entry.getKey(), rank + (count - 1) / 2.0);
			rank += count;
		}

		for (int i = 0; i < rtrn.length; i++) {
			rtrn[i] = rankMap.get(vals[i]);
		}
		return rtrn;
	}

	/**
	 * Pearson correlation over the complete pairs of x and y.
	 * @return NaN when there are fewer than two complete pairs or either vector has zero variance
	 */
	public static double pearsonCorrelation(double[] x, double[] y) {
		double[][] pairs = completeCases(x, y);
		return pearsonComplete(pairs[0], pairs[1]);
	}

	/**
	 * Spearman correlation: Pearson correlation of the ranks of the complete pairs of x and y
	 */
	public static double spearmanCorrelation(double[] x, double[] y) {
		double[][] pairs = completeCases(x, y);
		return pearsonComplete(rank(pairs[0]), rank(pairs[1]));
	}

	private static double pearsonComplete(double[] x, double[] y) {
		int n = x.length;
		if (n < 2) return Double.NaN;
		double meanX = new Mean().evaluate(x);
		double meanY = new Mean().evaluate(y);
		double sxx = 0, syy = 0, sxy = 0;
		for (int i = 0; i < n; i++) {
			double dx = x[i] - meanX;
			double dy = y[i] - meanY;
			sxx += dx * dx;
			syy += dy * dy;
			sxy += dx * dy;
		}
		if (sxx == 0 || syy == 0) return Double.NaN;
		double r = sxy / Math.sqrt(sxx * syy);
		// rounding can push |r| a hair past 1
		return Math.max(-1.0, Math.min(1.0, r));
	}

	/**
	 * @return two arrays holding only the positions where both x and y are present
	 */
	static double[][] completeCases(double[] x, double[] y) {
		if (x.length != y.length) {
			throw new IllegalArgumentException("Vectors must be of the same length, but had lengths " + x.length + " and " + y.length);
		}
		List<Integer> keep = new ArrayList<Integer>(x.length);
		for (int i = 0; i < x.length; i++) {
			if (!isMissing(x[i]) && !isMissing(y[i])) keep.add(i);
		}
		double[] cx = new double[keep.size()];
		double[] cy = new double[keep.size()];
		for (int i = 0; i < cx.length; i++) {
			cx[i] = x[keep.get(i)];
			cy[i] = y[keep.get(i)];
		}
		return new double[][] {cx, cy};
	}

	/**
	 * t statistic for a correlation coefficient: r * sqrt(df) / sqrt(1 - r^2)
	 */
	public static double correlationTStatistic(double r, double df) {
		return r * Math.sqrt(df) / Math.sqrt(1 - r * r);
	}

	/**
	 * Two-sided p value of a correlation coefficient from a Student t distribution with df degrees of freedom.
	 * @return NaN if r is missing, |r| is 1 or df is not positive
	 */
	public static double correlationPvalue(double r, double df) {
		if (isMissing(r) || isMissing(df) || df <= 0 || Math.abs(r) >= 1.0) return Double.NaN;
		double t = correlationTStatistic(r, df);
		// no sampling is done so the distribution does not need a random generator
		TDistribution dist = new TDistribution(null, df);
		double p = 2 * dist.cumulativeProbability(-Math.abs(t));
		return Math.min(1.0, p);
	}
}
