package umms.methodical.model.score;

import java.util.OptionalDouble;

/**
 * Raw and smoothed methodical score of one site
 */
public final class SiteScore {

	private final int position;
	private final int distance;
	private final double rawScore;
	private final double smoothedScore;

	public SiteScore(int position, int distance, double rawScore, double smoothedScore) {
		this.position = position;
		this.distance = distance;
		this.rawScore = rawScore;
		this.smoothedScore = smoothedScore;
	}

	public int getPosition() {
		return position;
	}

	public int getDistance() {
		return distance;
	}

	public OptionalDouble getRawScore() {
		return Double.isNaN(rawScore) ? OptionalDouble.empty() : OptionalDouble.of(rawScore);
	}

	public OptionalDouble getSmoothedScore() {
		return Double.isNaN(smoothedScore) ? OptionalDouble.empty() : OptionalDouble.of(smoothedScore);
	}

	public double rawScoreOrNaN() {
		return rawScore;
	}

	public double smoothedScoreOrNaN() {
		return smoothedScore;
	}
}
