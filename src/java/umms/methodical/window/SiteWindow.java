package umms.methodical.window;

import java.util.List;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.SingleInterval;

/**
 * Sites within a genomic window around an anchor, in increasing coordinate order.
 */
public final class SiteWindow {

	private final Anchor anchor;
	private final SingleInterval bounds;
	private final List<WindowedSite> sites;

	public SiteWindow(Anchor anchor, SingleInterval bounds, List<WindowedSite> sites) {
		this.anchor = anchor;
		this.bounds = bounds;
		this.sites = List.copyOf(sites);
	}

	public Anchor getAnchor() {
		return anchor;
	}

	public String getChr() {
		return anchor.getChr();
	}

	/**
	 * @return genomic coordinates covered by the window, both ends inclusive
	 */
	public SingleInterval getBounds() {
		return bounds;
	}

	public List<WindowedSite> getSites() {
		return sites;
	}

	public boolean isEmpty() {
		return sites.isEmpty();
	}

	public int size() {
		return sites.size();
	}

	/**
	 * @return first and last site positions, null if the window is empty
	 */
	public SingleInterval getSiteSpan() {
		if (sites.isEmpty()) return null;
		return new SingleInterval(sites.get(0).getPosition(), sites.get(sites.size() - 1).getPosition());
	}

	public String toUCSC() {
		return getChr() + ":" + bounds.getStart() + "-" + bounds.getEnd();
	}
}
