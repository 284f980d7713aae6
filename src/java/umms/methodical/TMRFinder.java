package umms.methodical;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import umms.methodical.anchor.AnchorBatch;
import umms.methodical.anchor.AnchorCorrelationCalculator;
import umms.methodical.anchor.AnchorCorrelations;
import umms.methodical.anchor.AnchorOutcome;
import umms.methodical.anchor.AnchorProcessor;
import umms.methodical.anchor.WindowParameters;
import umms.methodical.annotation.Anchor;
import umms.methodical.exception.InsufficientSamplesException;
import umms.methodical.exception.NoSitesInWindowException;
import umms.methodical.math.CorrelationMethod;
import umms.methodical.model.score.ScoreSeries;
import umms.methodical.region.Region;
import umms.methodical.region.RegionCaller;
import umms.methodical.region.RegionCallerConfig;
import umms.methodical.storage.FeatureTable;
import umms.methodical.storage.FeatureVector;
import umms.methodical.storage.MethylationStore;

/**
 * Runs the whole pipeline for an anchor: window selection, correlation, scoring, smoothing and region calling.
 * Holds no per-anchor state, so one instance serves all threads of a batch.
 */
public class TMRFinder implements AnchorProcessor<AnchorTMRs> {

	static Logger logger = Logger.getLogger(TMRFinder.class.getName());

	private final MethylationStore store;
	private final WindowParameters windowParams;
	private final CorrelationMethod method;
	private final RegionCallerConfig regionConfig;

	public TMRFinder(MethylationStore store, WindowParameters windowParams, CorrelationMethod method, RegionCallerConfig regionConfig) {
		this.store = store;
		this.windowParams = windowParams;
		this.method = method;
		this.regionConfig = regionConfig;
	}

	@Override
	public AnchorTMRs processAnchor(Anchor anchor, FeatureVector features) throws NoSitesInWindowException, InsufficientSamplesException {
		AnchorCorrelations correlations = AnchorCorrelationCalculator.compute(store, features, anchor, windowParams, method);
		ScoreSeries scores = ScoreSeries.fromCorrelations(correlations, regionConfig.getOffsetLength(), regionConfig.getSmoothingFactor());
		List<Region> regions = RegionCaller.call(scores, regionConfig);
		logger.debug(anchor + ": " + regions.size() + " TMRs from " + correlations.size() + " sites");
		return new AnchorTMRs(correlations, scores, regions);
	}

	/**
	 * Processes every anchor, pairing it with the feature of the same name
	 * @param threads size of the worker pool
	 * @return one outcome per anchor, in anchor order
	 */
	public List<AnchorOutcome<AnchorTMRs>> findTMRs(List<Anchor> anchors, FeatureTable features, int threads) throws InterruptedException {
		return new AnchorBatch<AnchorTMRs>(this, threads).run(anchors, features);
	}

	/**
	 * @return all regions of the successful outcomes, in anchor order
	 */
	public static List<Region> collectRegions(List<AnchorOutcome<AnchorTMRs>> outcomes) {
		List<Region> rtrn = new ArrayList<Region>();
		for (AnchorTMRs result : AnchorBatch.successfulResults(outcomes)) {
			rtrn.addAll(result.getRegions());
		}
		return rtrn;
	}
}
