package umms.methodical.math;

import umms.methodical.exception.InvalidMethodException;

/**
 * Correlation coefficients supported by the correlation engine
 */
public enum CorrelationMethod {
	PEARSON("pearson") {
		@Override
		public double correlate(double[] x, double[] y) {
			return Statistics.pearsonCorrelation(x, y);
		}
	},
	SPEARMAN("spearman") {
		@Override
		public double correlate(double[] x, double[] y) {
			return Statistics.spearmanCorrelation(x, y);
		}
	};

	private final String name;

	private CorrelationMethod(String name) {
		this.name = name;
	}

	/**
	 * Correlation of x and y over the positions where both are present
	 */
	public abstract double correlate(double[] x, double[] y);

	public String getName() {
		return name;
	}

	public String toString() {
		return name;
	}

	/**
	 * Accepts the full name or an unambiguous prefix ("p", "spear"), case-insensitive
	 * @throws InvalidMethodException if the name matches no method
	 */
	public static CorrelationMethod fromName(String value) {
		if (value != null && !value.isEmpty()) {
			String lower = value.toLowerCase();
			for (CorrelationMethod m : values()) {
				if (m.name.startsWith(lower)) return m;
			}
		}
		throw new InvalidMethodException("correlation", value, values());
	}
}
