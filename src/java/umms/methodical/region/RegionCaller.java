package umms.methodical.region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.SingleInterval;
import umms.methodical.model.score.ScoreSeries;
import umms.methodical.model.score.MethodicalScore;

/**
 * Calls TMRs from the methodical scores around an anchor.
 * <p>
 * Sites scoring at or above -log10(p threshold) are positive-significant, at or below its negation
 * negative-significant. Maximal runs of consecutive sites significant in the same direction become candidates.
 * Candidates of the same direction are merged, transitively, while the gap between the end of one and the start of
 * the next is at most the minimum gap width, whatever lies between them. Merged regions of opposite direction may
 * therefore overlap. Regions spanning fewer than the minimum number of sites are dropped; site count and mean score
 * cover every site between start and end.
 */
public class RegionCaller {

	static Logger logger = Logger.getLogger(RegionCaller.class.getName());

	private final RegionCallerConfig config;

	public RegionCaller(RegionCallerConfig config) {
		this.config = config;
	}

	public List<Region> call(ScoreSeries series) {
		return call(series, config);
	}

	/**
	 * Uses the series' smoothed scores recomputed with the config's offset and factor when smoothing is on,
	 * the raw scores otherwise
	 */
	public static List<Region> call(ScoreSeries series, RegionCallerConfig config) {
		double[] scores;
		if (config.isSmooth()) {
			scores = series.resmooth(config.getOffsetLength(), config.getSmoothingFactor()).getSmoothedScores();
		} else {
			scores = series.getRawScores();
		}
		return callOnScores(series.getAnchor(), series.getPositions(), series.getDistances(), scores, config);
	}

	/**
	 * Calls regions on a score sequence as given, the config's smoothing settings are ignored
	 * @param positions site positions, strictly increasing
	 * @param distances signed distance of each site to the anchor
	 * @param scores score of each site, NaN if undefined
	 */
	public static List<Region> callOnScores(Anchor anchor, int[] positions, int[] distances, double[] scores, RegionCallerConfig config) {
		if (positions.length != scores.length || distances.length != scores.length) {
			throw new IllegalArgumentException("Got " + positions.length + " positions, " + distances.length + " distances and " + scores.length + " scores");
		}
		double threshold = MethodicalScore.threshold(config.getPValueThreshold());

		List<int[]> candidates = new ArrayList<int[]>();
		List<Direction> directions = new ArrayList<Direction>();
		int runStart = -1;
		Direction runDirection = null;
		for (int i = 0; i <= scores.length; i++) {
			Direction d = i < scores.length ? Direction.of(scores[i], threshold) : null;
			if (d != runDirection) {
				if (runDirection != null) {
					candidates.add(new int[] {runStart, i - 1});
					directions.add(runDirection);
				}
				runStart = i;
				runDirection = d;
			}
		}

		// each direction is merged on its own, a run of the other direction in between does not stop a merge
		List<int[]> merged = new ArrayList<int[]>();
		for (Direction direction : Direction.values()) {
			int[] open = null;
			for (int c = 0; c < candidates.size(); c++) {
				if (directions.get(c) != direction) continue;
				int[] candidate = candidates.get(c);
				if (open != null && span(positions, open).getDistanceTo(span(positions, candidate)) <= config.getMinGapwidth()) {
					open[1] = candidate[1];
				} else {
					open = new int[] {candidate[0], candidate[1], direction.ordinal()};
					merged.add(open);
				}
			}
		}
		Collections.sort(merged, new Comparator<int[]>() {
			public int compare(int[] a, int[] b) {
				return a[0] != b[0] ? Integer.compare(a[0], b[0]) : Integer.compare(a[2], b[2]);
			}
		});

		List<Region> regions = new ArrayList<Region>();
		for (int r = 0; r < merged.size(); r++) {
			int from = merged.get(r)[0];
			int to = merged.get(r)[1];
			int siteCount = to - from + 1;
			if (siteCount < config.getMinMethSites()) continue;

			Direction direction = Direction.values()[merged.get(r)[2]];
			int distance = distances[from];
			double sum = 0;
			int defined = 0;
			for (int i = from; i <= to; i++) {
				distance = direction == Direction.NEGATIVE ? Math.min(distance, distances[i]) : Math.max(distance, distances[i]);
				if (!Double.isNaN(scores[i])) {
					sum += scores[i];
					defined++;
				}
			}
			String name = anchor.getName() + "_tmr_" + (regions.size() + 1);
			regions.add(new Region(name, anchor.getChr(), positions[from], positions[to], direction, siteCount, distance,
					defined == 0 ? Double.NaN : sum / defined, anchor));
		}
		logger.debug(anchor + ": " + candidates.size() + " candidate regions, " + regions.size() + " kept");
		return regions;
	}

	private static SingleInterval span(int[] positions, int[] sites) {
		return new SingleInterval(positions[sites[0]], positions[sites[1]]);
	}
}
