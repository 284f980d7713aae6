package umms.methodical;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import umms.methodical.anchor.AnchorOutcome;
import umms.methodical.anchor.WindowParameters;
import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.GenomicPosition;
import umms.methodical.annotation.Strand;
import umms.methodical.math.CorrelationMethod;
import umms.methodical.math.PValueAdjustment;
import umms.methodical.region.Direction;
import umms.methodical.region.Region;
import umms.methodical.region.RegionCallerConfig;

class TMRFinderTest {

	private static final Anchor TX1 = new Anchor("tx1", new GenomicPosition("chr1", 1000, Strand.POSITIVE));
	private static final Anchor TX2 = new Anchor("tx2", new GenomicPosition("chr1", 50000, Strand.NEGATIVE));
	private static final Anchor TX3 = new Anchor("tx3", new GenomicPosition("chr1", 1000, Strand.POSITIVE));

	private static TMRFinder finder(boolean smooth) {
		return new TMRFinder(MethodicalFixtures.store(), new WindowParameters(300, 300, 0, PValueAdjustment.BH), CorrelationMethod.PEARSON,
				RegionCallerConfig.defaults().withSmooth(smooth));
	}

	@Test
	void rawScoresFindTheSignal() throws Exception {
		AnchorTMRs result = finder(false).processAnchor(TX1, MethodicalFixtures.features().getFeatureVector("tx1"));

		assertThat(result.getCorrelations().size()).isEqualTo(20);
		assertThat(result.getScores().size()).isEqualTo(20);
		assertThat(result.getRegions()).hasSize(1);
		Region region = result.getRegions().get(0);
		assertThat(region.getDirection()).isEqualTo(Direction.NEGATIVE);
		assertThat(region.getStart()).isEqualTo(MethodicalFixtures.SIGNAL_START);
		assertThat(region.getEnd()).isEqualTo(MethodicalFixtures.SIGNAL_END);
		assertThat(region.getSiteCount()).isEqualTo(6);
		assertThat(region.getDistanceToAnchor()).isEqualTo(0);
		assertThat(region.getName()).isEqualTo("tx1_tmr_1");
	}

	@Test
	void smoothedScoresCoverTheSignal() throws Exception {
		AnchorTMRs result = finder(true).processAnchor(TX1, MethodicalFixtures.features().getFeatureVector("tx1"));

		assertThat(result.getRegions()).hasSize(1);
		Region region = result.getRegions().get(0);
		assertThat(region.getDirection()).isEqualTo(Direction.NEGATIVE);
		assertThat(region.getStart()).isLessThanOrEqualTo(MethodicalFixtures.SIGNAL_START);
		assertThat(region.getEnd()).isGreaterThanOrEqualTo(MethodicalFixtures.SIGNAL_END);
	}

	@Test
	void batchReportsEveryAnchor() throws Exception {
		TMRFinder finder = finder(false);

		List<AnchorOutcome<AnchorTMRs>> outcomes = finder.findTMRs(List.of(TX1, TX2, TX3), MethodicalFixtures.features(), 2);

		assertThat(outcomes).extracting(AnchorOutcome::getStatus).containsExactly(
				AnchorOutcome.Status.SUCCESS, AnchorOutcome.Status.NO_SITES_IN_WINDOW, AnchorOutcome.Status.MISSING_FEATURE);
		List<Region> regions = TMRFinder.collectRegions(outcomes);
		assertThat(regions).hasSize(1);
		assertThat(regions.get(0).getAnchor()).isEqualTo(TX1);
	}

	@Test
	void threadCountDoesNotChangeRegions() throws Exception {
		List<Anchor> anchors = List.of(TX1, TX2, TX3);

		List<Region> serial = TMRFinder.collectRegions(finder(true).findTMRs(anchors, MethodicalFixtures.features(), 1));
		List<Region> parallel = TMRFinder.collectRegions(finder(true).findTMRs(anchors, MethodicalFixtures.features(), 3));

		assertThat(parallel).isEqualTo(serial);
	}
}
