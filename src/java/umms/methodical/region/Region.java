package umms.methodical.region;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.SingleInterval;

/**
 * A transcript-associated methylation region (TMR): a run of sites around an anchor whose methylation is
 * significantly associated with the anchor's feature, all in the same direction.
 */
public final class Region implements Comparable<Region> {

	private final String name;
	private final String chr;
	private final int start;
	private final int end;
	private final Direction direction;
	private final int siteCount;
	private final int distanceToAnchor;
	private final double meanScore;
	private final Anchor anchor;

	public Region(String name, String chr, int start, int end, Direction direction, int siteCount, int distanceToAnchor, double meanScore, Anchor anchor) {
		if (end < start) {
			throw new IllegalArgumentException("Region end " + end + " is before start " + start);
		}
		if (siteCount < 1) {
			throw new IllegalArgumentException("A region needs at least one site, got " + siteCount);
		}
		this.name = name;
		this.chr = chr;
		this.start = start;
		this.end = end;
		this.direction = direction;
		this.siteCount = siteCount;
		this.distanceToAnchor = distanceToAnchor;
		this.meanScore = meanScore;
		this.anchor = anchor;
	}

	public String getName() {
		return name;
	}

	public String getChr() {
		return chr;
	}

	/**
	 * @return position of the first site, inclusive
	 */
	public int getStart() {
		return start;
	}

	/**
	 * @return position of the last site, inclusive
	 */
	public int getEnd() {
		return end;
	}

	public SingleInterval getInterval() {
		return new SingleInterval(start, end);
	}

	public Direction getDirection() {
		return direction;
	}

	public int getSiteCount() {
		return siteCount;
	}

	/**
	 * @return the smallest site distance for negative regions, the largest for positive ones
	 */
	public int getDistanceToAnchor() {
		return distanceToAnchor;
	}

	/**
	 * @return mean of the defined scores of the region's sites
	 */
	public double getMeanScore() {
		return meanScore;
	}

	public Anchor getAnchor() {
		return anchor;
	}

	public String toUCSC() {
		return chr + ":" + start + "-" + end;
	}

	public int compareTo(Region other) {
		int cmp = chr.compareTo(other.chr);
		if (cmp != 0) return cmp;
		cmp = Integer.compare(start, other.start);
		if (cmp != 0) return cmp;
		return Integer.compare(end, other.end);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Region)) return false;
		Region other = (Region) o;
		return start == other.start && end == other.end && siteCount == other.siteCount && distanceToAnchor == other.distanceToAnchor
				&& direction == other.direction && chr.equals(other.chr) && name.equals(other.name)
				&& Double.compare(meanScore, other.meanScore) == 0 && anchor.getLocation().equals(other.anchor.getLocation());
	}

	@Override
	public int hashCode() {
		int result = chr.hashCode();
		result = 31 * result + start;
		result = 31 * result + end;
		result = 31 * result + direction.hashCode();
		return result;
	}

	public String toString() {
		return name + "\t" + toUCSC() + "\t" + direction + "\t" + siteCount;
	}
}
