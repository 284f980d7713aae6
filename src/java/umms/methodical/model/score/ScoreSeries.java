package umms.methodical.model.score;

import java.util.ArrayList;
import java.util.List;

import umms.methodical.anchor.AnchorCorrelations;
import umms.methodical.anchor.SiteCorrelation;
import umms.methodical.annotation.Anchor;

/**
 * Methodical scores of the sites around one anchor, in coordinate order.
 */
public final class ScoreSeries {

	private final Anchor anchor;
	private final List<SiteScore> scores;

	public ScoreSeries(Anchor anchor, List<SiteScore> scores) {
		for (int i = 1; i < scores.size(); i++) {
			if (scores.get(i).getPosition() <= scores.get(i - 1).getPosition()) {
				throw new IllegalArgumentException("Scores must be in increasing position order, found " + scores.get(i - 1).getPosition() + " before " + scores.get(i).getPosition());
			}
		}
		this.anchor = anchor;
		this.scores = List.copyOf(scores);
	}

	/**
	 * Scores each site and smooths the scores
	 */
	public static ScoreSeries fromCorrelations(AnchorCorrelations correlations, int offsetLength, double smoothingFactor) {
		List<SiteCorrelation> sites = correlations.getSites();
		double[] raw = rawScores(correlations);
		double[] smoothed = ExponentialSmoother.smooth(raw, offsetLength, smoothingFactor);
		List<SiteScore> scores = new ArrayList<SiteScore>(sites.size());
		for (int i = 0; i < sites.size(); i++) {
			scores.add(new SiteScore(sites.get(i).getPosition(), sites.get(i).getDistance(), raw[i], smoothed[i]));
		}
		return new ScoreSeries(correlations.getAnchor(), scores);
	}

	/**
	 * Raw score of every site, NaN where the correlation or P value is undefined
	 */
	public static double[] rawScores(AnchorCorrelations correlations) {
		List<SiteCorrelation> sites = correlations.getSites();
		double[] raw = new double[sites.size()];
		for (int i = 0; i < raw.length; i++) {
			raw[i] = MethodicalScore.score(sites.get(i).correlationOrNaN(), sites.get(i).pValueOrNaN());
		}
		return raw;
	}

	/**
	 * A copy of this series with the smoothed scores recomputed from the raw scores
	 */
	public ScoreSeries resmooth(int offsetLength, double smoothingFactor) {
		double[] smoothed = ExponentialSmoother.smooth(getRawScores(), offsetLength, smoothingFactor);
		List<SiteScore> rescored = new ArrayList<SiteScore>(scores.size());
		for (int i = 0; i < scores.size(); i++) {
			SiteScore s = scores.get(i);
			rescored.add(new SiteScore(s.getPosition(), s.getDistance(), s.rawScoreOrNaN(), smoothed[i]));
		}
		return new ScoreSeries(anchor, rescored);
	}

	public Anchor getAnchor() {
		return anchor;
	}

	public String getChr() {
		return anchor.getChr();
	}

	public List<SiteScore> getScores() {
		return scores;
	}

	public int size() {
		return scores.size();
	}

	public int[] getPositions() {
		int[] rtrn = new int[scores.size()];
		for (int i = 0; i < rtrn.length; i++) rtrn[i] = scores.get(i).getPosition();
		return rtrn;
	}

	public int[] getDistances() {
		int[] rtrn = new int[scores.size()];
		for (int i = 0; i < rtrn.length; i++) rtrn[i] = scores.get(i).getDistance();
		return rtrn;
	}

	public double[] getRawScores() {
		double[] rtrn = new double[scores.size()];
		for (int i = 0; i < rtrn.length; i++) rtrn[i] = scores.get(i).rawScoreOrNaN();
		return rtrn;
	}

	public double[] getSmoothedScores() {
		double[] rtrn = new double[scores.size()];
		for (int i = 0; i < rtrn.length; i++) rtrn[i] = scores.get(i).smoothedScoreOrNaN();
		return rtrn;
	}
}
