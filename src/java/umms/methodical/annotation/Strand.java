package umms.methodical.annotation;

/**
 * Strand of an anchor. Window direction and signed distances depend on it, so anchors read from input
 * must carry a known strand.
 */
public enum Strand {
	POSITIVE('+'), NEGATIVE('-'), UNKNOWN('*');

	private final char value;

	private Strand(char value) {
		this.value = value;
	}

	public String toString() {
		return "" + value;
	}

	/**
	 * @return UNKNOWN for anything other than "+" or "-", including BED's "."
	 */
	public static Strand fromString(String value) {
		if (value.equals("+")) return POSITIVE;
		if (value.equals("-")) return NEGATIVE;
		else return UNKNOWN;
	}
}
