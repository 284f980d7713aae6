package umms.methodical.region;

/**
 * Sign of a region's scores. Negative scores come from negative correlations between methylation and the feature.
 */
public enum Direction {
	POSITIVE("Positive"), NEGATIVE("Negative");

	private final String label;

	private Direction(String label) {
		this.label = label;
	}

	public String toString() {
		return label;
	}

	/**
	 * @return the direction in which score is significant given threshold t, or null if neither
	 */
	public static Direction of(double score, double threshold) {
		if (Double.isNaN(score)) return null;
		if (score >= threshold) return POSITIVE;
		if (score <= -threshold) return NEGATIVE;
		return null;
	}

	public static Direction fromString(String value) {
		for (Direction d : values()) {
			if (d.label.equalsIgnoreCase(value)) return d;
		}
		throw new IllegalArgumentException("Unknown direction " + value);
	}
}
