package umms.methodical.annotation;

/**
 * This class represents a single closed interval [start, end] on an integer coordinate space.
 */
public final class SingleInterval implements Comparable<SingleInterval> {

	private final int start;
	private final int end;

	public SingleInterval(int start, int end) {
		if (end < start) {
			throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
		}
		this.start = start;
		this.end = end;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/**
	 * @return number of integer coordinates covered
	 */
	public int length() {
		return end - start + 1;
	}

	public boolean overlaps(SingleInterval other) {
		return start <= other.end && other.start <= end;
	}

	public boolean contains(SingleInterval other) {
		return (getStart() <= other.getStart() && getEnd() >= other.getEnd());
	}

	/**
	 * @param other
	 * @return 0 if overlapping, otherwise the difference between the facing boundary coordinates
	 */
	public int getDistanceTo(SingleInterval other) {
		int result = 0;
		if (!overlaps(other)) {
			if (this.getStart() < other.getStart()) {
				result = other.getStart() - this.getEnd();
			} else {
				result = this.getStart() - other.getEnd();
			}
		}
		return result;
	}

	/*
	 * Compares by start and end coordinates.
	 */
	public int compareTo(SingleInterval other) {
		if (getStart() < other.getStart()) {
			return -1;
		} else if (getStart() > other.getStart()) {
			return 1;
		} else {
			return Integer.compare(getEnd(), other.getEnd());
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof SingleInterval)) return false;
		return compareTo((SingleInterval) o) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * start + end;
	}

	public String toString() {
		return "[" + getStart() + "," + getEnd() + "]";
	}
}
