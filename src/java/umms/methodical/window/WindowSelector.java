package umms.methodical.window;

import java.util.ArrayList;
import java.util.List;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.SingleInterval;
import umms.methodical.storage.MethylationStore;

/**
 * Selects the sites within a strand-aware window around an anchor.
 * On the plus strand upstream means lower coordinates, on the minus strand higher coordinates.
 */
public class WindowSelector {

	private WindowSelector() {}

	/**
	 * @param siteIndex sorted site positions of the anchor's sequence
	 * @param upstream maximum distance upstream of the anchor
	 * @param downstream maximum distance downstream of the anchor
	 * @return the sites in the window; an empty window is not an error
	 */
	public static SiteWindow select(int[] siteIndex, Anchor anchor, int upstream, int downstream) {
		SingleInterval bounds = bounds(anchor, upstream, downstream);
		int tss = anchor.getPosition();
		boolean minus = anchor.getLocation().isNegativeStrand();

		List<WindowedSite> sites = new ArrayList<WindowedSite>();
		for (int i = lowerBound(siteIndex, bounds.getStart()); i < siteIndex.length && siteIndex[i] <= bounds.getEnd(); i++) {
			int distance = minus ? tss - siteIndex[i] : siteIndex[i] - tss;
			sites.add(new WindowedSite(siteIndex[i], i, distance));
		}
		return new SiteWindow(anchor, bounds, sites);
	}

	/**
	 * Looks up the anchor's sequence in the store and selects from its site index
	 */
	public static SiteWindow select(MethylationStore store, Anchor anchor, int upstream, int downstream) {
		return select(store.getSiteIndex(anchor.getChr()), anchor, upstream, downstream);
	}

	/**
	 * Genomic coordinates of the window, clipped at 1
	 */
	public static SingleInterval bounds(Anchor anchor, int upstream, int downstream) {
		if (upstream < 0 || downstream < 0) {
			throw new IllegalArgumentException("Window extents must not be negative, got upstream " + upstream + " and downstream " + downstream);
		}
		int tss = anchor.getPosition();
		int start, end;
		if (anchor.getLocation().isNegativeStrand()) {
			start = tss - downstream;
			end = tss + upstream;
		} else {
			start = tss - upstream;
			end = tss + downstream;
		}
		return new SingleInterval(Math.max(1, start), end);
	}

	private static int lowerBound(int[] sorted, int key) {
		int lo = 0, hi = sorted.length;
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (sorted[mid] < key) lo = mid + 1;
			else hi = mid;
		}
		return lo;
	}
}
