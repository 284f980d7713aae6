package umms.methodical.region;

/**
 * Thresholds and merge settings for calling regions
 */
public final class RegionCallerConfig {

	public static final double DEFAULT_P_VALUE_THRESHOLD = 0.005;
	public static final int DEFAULT_OFFSET_LENGTH = 10;
	public static final double DEFAULT_SMOOTHING_FACTOR = 0.75;
	public static final int DEFAULT_MIN_METH_SITES = 5;
	public static final int DEFAULT_MIN_GAPWIDTH = 150;

	private final double pValueThreshold;
	private final boolean smooth;
	private final int offsetLength;
	private final double smoothingFactor;
	private final int minMethSites;
	private final int minGapwidth;

	public RegionCallerConfig(double pValueThreshold, boolean smooth, int offsetLength, double smoothingFactor, int minMethSites, int minGapwidth) {
		if (!(pValueThreshold > 0 && pValueThreshold <= 1)) {
			throw new IllegalArgumentException("P value threshold must be in (0, 1], got " + pValueThreshold);
		}
		if (offsetLength < 0) {
			throw new IllegalArgumentException("Offset length cannot be negative: " + offsetLength);
		}
		if (!(smoothingFactor > 0 && smoothingFactor <= 1)) {
			throw new IllegalArgumentException("Smoothing factor must be in (0, 1], got " + smoothingFactor);
		}
		if (minMethSites < 1) {
			throw new IllegalArgumentException("Minimum number of sites must be at least 1: " + minMethSites);
		}
		if (minGapwidth < 0) {
			throw new IllegalArgumentException("Minimum gap width cannot be negative: " + minGapwidth);
		}
		this.pValueThreshold = pValueThreshold;
		this.smooth = smooth;
		this.offsetLength = offsetLength;
		this.smoothingFactor = smoothingFactor;
		this.minMethSites = minMethSites;
		this.minGapwidth = minGapwidth;
	}

	public static RegionCallerConfig defaults() {
		return new RegionCallerConfig(DEFAULT_P_VALUE_THRESHOLD, true, DEFAULT_OFFSET_LENGTH, DEFAULT_SMOOTHING_FACTOR, DEFAULT_MIN_METH_SITES, DEFAULT_MIN_GAPWIDTH);
	}

	/**
	 * Same settings with smoothing switched on or off
	 */
	public RegionCallerConfig withSmooth(boolean value) {
		return new RegionCallerConfig(pValueThreshold, value, offsetLength, smoothingFactor, minMethSites, minGapwidth);
	}

	public double getPValueThreshold() {
		return pValueThreshold;
	}

	public boolean isSmooth() {
		return smooth;
	}

	public int getOffsetLength() {
		return offsetLength;
	}

	public double getSmoothingFactor() {
		return smoothingFactor;
	}

	public int getMinMethSites() {
		return minMethSites;
	}

	public int getMinGapwidth() {
		return minGapwidth;
	}
}
