package umms.methodical.region;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.GenomicPosition;
import umms.methodical.annotation.Strand;
import umms.methodical.correlation.CorrelationTable;
import umms.methodical.correlation.NumericTable;
import umms.methodical.correlation.RapidCorrelationTest;
import umms.methodical.exception.InsufficientSamplesException;
import umms.methodical.storage.FeatureVector;
import umms.methodical.storage.InMemoryMethylationStore;

class RegionMethylationSummarizerTest {

	private static final double NA = Double.NaN;
	private static final Anchor ANCHOR = new Anchor("tx1", new GenomicPosition("chr1", 150, Strand.POSITIVE));

	private static InMemoryMethylationStore store() {
		return new InMemoryMethylationStore.Builder(List.of("a", "b", "c", "d"))
				.addSite("chr1", 100, new double[] {0.8, 0.6, NA, 0.2})
				.addSite("chr1", 200, new double[] {0.6, 0.4, NA, 0.1})
				.addSite("chr1", 300, new double[] {0.9, 0.9, 0.9, 0.9})
				.build();
	}

	private static Region region(String name, int start, int end) {
		return new Region(name, "chr1", start, end, Direction.POSITIVE, 2, 0, 3.0, ANCHOR);
	}

	@Test
	void meanMethylationPerSampleAndRegion() {
		NumericTable table = new RegionMethylationSummarizer(store()).summarize(List.of(region("r1", 100, 200), region("r2", 300, 300)));

		assertThat(table.getColumnNames()).containsExactly("r1", "r2");
		assertThat(table.getNumRows()).isEqualTo(4);
		double[] r1 = table.getColumn(0);
		assertThat(r1[0]).isCloseTo(0.7, within(1e-12));
		assertThat(r1[1]).isCloseTo(0.5, within(1e-12));
		assertThat(r1[2]).isNaN();
		assertThat(r1[3]).isCloseTo(0.15, within(1e-12));
		assertThat(table.getColumn(1)).containsExactly(0.9, 0.9, 0.9, 0.9);
	}

	@Test
	void correlatesRegionMeansWithFeature() throws Exception {
		Map<String, Double> values = new LinkedHashMap<String, Double>();
		values.put("a", 1.0);
		values.put("b", 2.0);
		values.put("c", 3.0);
		values.put("d", 4.0);

		CorrelationTable table = new RegionMethylationSummarizer(store())
				.correlateWithFeature(List.of(region("r1", 100, 200)), new FeatureVector("tx1", values), new RapidCorrelationTest());

		assertThat(table.get(0, 0).getFeature1()).isEqualTo("r1");
		assertThat(table.get(0, 0).getNumObservations()).isEqualTo(3);
		assertThat(table.get(0, 0).correlationOrNaN()).isLessThan(-0.9);
	}

	@Test
	void tooFewSharedSamples() {
		FeatureVector features = new FeatureVector("tx1", Map.of("a", 1.0, "zz", 2.0));

		assertThatThrownBy(() -> new RegionMethylationSummarizer(store()).correlateWithFeature(List.of(region("r1", 100, 200)), features, new RapidCorrelationTest()))
				.isInstanceOf(InsufficientSamplesException.class);
	}
}
