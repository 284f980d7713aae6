package umms.methodical.annotation;

/**
 * A reference point, typically a transcription start site, around which methylation sites are analysed.
 * The name identifies the feature (transcript) whose expression is paired with the anchor.
 * Window extents are optional; when unset the caller's defaults apply.
 */
public final class Anchor {

	public static final int UNSET = -1;

	private final String name;
	private final GenomicPosition location;
	private final int upstream;
	private final int downstream;

	public Anchor(String name, GenomicPosition location) {
		this(name, location, UNSET, UNSET);
	}

	public Anchor(String name, GenomicPosition location, int upstream, int downstream) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Anchor name is required");
		}
		if (location == null) {
			throw new IllegalArgumentException("Anchor location is required for " + name);
		}
		this.name = name;
		this.location = location;
		this.upstream = upstream;
		this.downstream = downstream;
	}

	public String getName() {
		return name;
	}

	public GenomicPosition getLocation() {
		return location;
	}

	public String getChr() {
		return location.getChr();
	}

	public int getPosition() {
		return location.getPosition();
	}

	public Strand getStrand() {
		return location.getStrand();
	}

	public boolean hasUpstream() {
		return upstream != UNSET;
	}

	public boolean hasDownstream() {
		return downstream != UNSET;
	}

	/**
	 * @param defaultValue returned when the anchor carries no upstream extent of its own
	 */
	public int getUpstream(int defaultValue) {
		return hasUpstream() ? upstream : defaultValue;
	}

	public int getDownstream(int defaultValue) {
		return hasDownstream() ? downstream : defaultValue;
	}

	public String toString() {
		return name + "@" + location.toUCSC();
	}
}
