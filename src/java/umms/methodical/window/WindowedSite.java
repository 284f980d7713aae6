package umms.methodical.window;

/**
 * A site selected around an anchor.
 * Distance is negative upstream and positive downstream of the anchor on the anchor's strand.
 */
public final class WindowedSite {

	private final int position;
	private final int index;
	private final int distance;

	public WindowedSite(int position, int index, int distance) {
		this.position = position;
		this.index = index;
		this.distance = distance;
	}

	public int getPosition() {
		return position;
	}

	/**
	 * @return index of the site in the site index it was selected from
	 */
	public int getIndex() {
		return index;
	}

	public int getDistance() {
		return distance;
	}

	public String toString() {
		return position + "(" + distance + ")";
	}
}
