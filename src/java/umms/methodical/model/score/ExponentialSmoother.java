package umms.methodical.model.score;

/**
 * Exponentially weighted moving average over an ordered series of scores.
 * <p>
 * The smoothed value at index i is the weighted mean of the defined values in [i - offset, i + offset],
 * the value at index j having weight factor^|i - j|. The offset counts sites, not bases, so the window adapts
 * to the local density of sites. Undefined values (NaN) take no part in either the sum or the total weight.
 */
public class ExponentialSmoother {

	private final int offsetLength;
	private final double smoothingFactor;
	private final double[] weights;

	/**
	 * @param offsetLength number of sites on each side of the center, at least 0
	 * @param smoothingFactor in (0, 1]; 1 gives a flat window, values near 0 keep the central value
	 */
	public ExponentialSmoother(int offsetLength, double smoothingFactor) {
		if (offsetLength < 0) {
			throw new IllegalArgumentException("Offset length cannot be negative: " + offsetLength);
		}
		if (!(smoothingFactor > 0 && smoothingFactor <= 1)) {
			throw new IllegalArgumentException("Smoothing factor must be in (0, 1], got " + smoothingFactor);
		}
		this.offsetLength = offsetLength;
		this.smoothingFactor = smoothingFactor;
		this.weights = new double[offsetLength + 1];
		for (int d = 0; d <= offsetLength; d++) {
			weights[d] = Math.pow(smoothingFactor, d);
		}
	}

	public static double[] smooth(double[] raw, int offsetLength, double smoothingFactor) {
		return new ExponentialSmoother(offsetLength, smoothingFactor).smooth(raw);
	}

	public double[] smooth(double[] raw) {
		double[] rtrn = new double[raw.length];
		for (int i = 0; i < raw.length; i++) {
			int from = Math.max(0, i - offsetLength);
			int to = Math.min(raw.length - 1, i + offsetLength);
			double sum = 0;
			double totalWeight = 0;
			for (int j = from; j <= to; j++) {
				if (Double.isNaN(raw[j])) continue;
				double w = weights[Math.abs(i - j)];
				sum += w * raw[j];
				totalWeight += w;
			}
			rtrn[i] = totalWeight > 0 ? sum / totalWeight : Double.NaN;
		}
		return rtrn;
	}

	public int getOffsetLength() {
		return offsetLength;
	}

	public double getSmoothingFactor() {
		return smoothingFactor;
	}
}
