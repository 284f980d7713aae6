package umms.methodical.annotation;

/**
 * A single base on a reference sequence. Positions are 1-based.
 */
public final class GenomicPosition implements Comparable<GenomicPosition> {

	private final String chr;
	private final int position;
	private final Strand strand;

	public GenomicPosition(String chr, int position) {
		this(chr, position, Strand.UNKNOWN);
	}

	public GenomicPosition(String chr, int position, Strand strand) {
		if (chr == null || chr.isEmpty()) {
			throw new IllegalArgumentException("Sequence name is required");
		}
		this.chr = chr;
		this.position = position;
		this.strand = strand == null ? Strand.UNKNOWN : strand;
	}

	public String getChr() {
		return chr;
	}

	public int getPosition() {
		return position;
	}

	public Strand getStrand() {
		return strand;
	}

	public boolean isNegativeStrand() {
		return strand == Strand.NEGATIVE;
	}

	/**
	 * @return chr:position:strand, the form used for anchor locations in output tables
	 */
	public String toUCSC() {
		return chr + ":" + position + ":" + strand;
	}

	/**
	 * Orders by sequence name, then position, then strand
	 */
	public int compareTo(GenomicPosition other) {
		int cmp = chr.compareTo(other.chr);
		if (cmp != 0) return cmp;
		cmp = Integer.compare(position, other.position);
		if (cmp != 0) return cmp;
		return strand.compareTo(other.strand);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof GenomicPosition)) return false;
		GenomicPosition other = (GenomicPosition) o;
		return position == other.position && chr.equals(other.chr) && strand == other.strand;
	}

	@Override
	public int hashCode() {
		int result = chr.hashCode();
		result = 31 * result + position;
		result = 31 * result + strand.hashCode();
		return result;
	}

	public String toString() {
		return toUCSC();
	}
}
