package umms.methodical;

import java.util.List;

import umms.methodical.anchor.AnchorCorrelations;
import umms.methodical.annotation.Anchor;
import umms.methodical.model.score.ScoreSeries;
import umms.methodical.region.Region;

/**
 * Everything computed for one anchor: site correlations, their scores and the regions called from them
 */
public final class AnchorTMRs {

	private final AnchorCorrelations correlations;
	private final ScoreSeries scores;
	private final List<Region> regions;

	public AnchorTMRs(AnchorCorrelations correlations, ScoreSeries scores, List<Region> regions) {
		this.correlations = correlations;
		this.scores = scores;
		this.regions = List.copyOf(regions);
	}

	public Anchor getAnchor() {
		return correlations.getAnchor();
	}

	public AnchorCorrelations getCorrelations() {
		return correlations;
	}

	public ScoreSeries getScores() {
		return scores;
	}

	public List<Region> getRegions() {
		return regions;
	}
}
