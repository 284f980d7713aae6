package umms.methodical.anchor;

import java.util.List;

import umms.methodical.annotation.Anchor;
import umms.methodical.math.CorrelationMethod;

/**
 * Site correlations for one anchor, ordered by position, together with the anchor they were computed for.
 */
public final class AnchorCorrelations {

	private final Anchor anchor;
	private final CorrelationMethod method;
	private final boolean hasQValues;
	private final List<SiteCorrelation> sites;

	public AnchorCorrelations(Anchor anchor, CorrelationMethod method, boolean hasQValues, List<SiteCorrelation> sites) {
		this.anchor = anchor;
		this.method = method;
		this.hasQValues = hasQValues;
		this.sites = List.copyOf(sites);
	}

	public Anchor getAnchor() {
		return anchor;
	}

	public String getChr() {
		return anchor.getChr();
	}

	public CorrelationMethod getMethod() {
		return method;
	}

	public boolean hasQValues() {
		return hasQValues;
	}

	public List<SiteCorrelation> getSites() {
		return sites;
	}

	public int size() {
		return sites.size();
	}
}
