package umms.methodical.anchor;

import umms.methodical.annotation.Anchor;
import umms.methodical.math.PValueAdjustment;

/**
 * Window extents and test settings applied to each anchor.
 * Anchors that carry their own extents override the defaults held here.
 */
public final class WindowParameters {

	public static final int DEFAULT_EXTENT = 5000;

	private final int upstream;
	private final int downstream;
	private final int nCovariates;
	private final PValueAdjustment adjustment;

	public WindowParameters(int upstream, int downstream) {
		this(upstream, downstream, 0, PValueAdjustment.BH);
	}

	public WindowParameters(int upstream, int downstream, int nCovariates, PValueAdjustment adjustment) {
		if (upstream < 0 || downstream < 0) {
			throw new IllegalArgumentException("Window extents must not be negative, got upstream " + upstream + " and downstream " + downstream);
		}
		if (nCovariates < 0) {
			throw new IllegalArgumentException("Number of covariates cannot be negative: " + nCovariates);
		}
		this.upstream = upstream;
		this.downstream = downstream;
		this.nCovariates = nCovariates;
		this.adjustment = adjustment;
	}

	public static WindowParameters defaults() {
		return new WindowParameters(DEFAULT_EXTENT, DEFAULT_EXTENT);
	}

	public int getUpstream() {
		return upstream;
	}

	public int getDownstream() {
		return downstream;
	}

	public int getUpstream(Anchor anchor) {
		return anchor.getUpstream(upstream);
	}

	public int getDownstream(Anchor anchor) {
		return anchor.getDownstream(downstream);
	}

	public int getNumCovariates() {
		return nCovariates;
	}

	public PValueAdjustment getAdjustment() {
		return adjustment;
	}
}
