package umms.methodical.io;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.StringWriter;
import java.util.List;

import org.junit.jupiter.api.Test;

import umms.methodical.anchor.AnchorCorrelations;
import umms.methodical.anchor.AnchorOutcome;
import umms.methodical.anchor.SiteCorrelation;
import umms.methodical.annotation.Anchor;
import umms.methodical.annotation.GenomicPosition;
import umms.methodical.annotation.Strand;
import umms.methodical.correlation.CorrelationTable;
import umms.methodical.correlation.NumericTable;
import umms.methodical.correlation.RapidCorrelationTest;
import umms.methodical.exception.NoSitesInWindowException;
import umms.methodical.math.CorrelationMethod;
import umms.methodical.region.Direction;
import umms.methodical.region.Region;

class ResultWriterTest {

	private static final Anchor ANCHOR = new Anchor("tx1", new GenomicPosition("chr1", 1000, Strand.NEGATIVE));

	@Test
	void correlationsWithoutQValues() throws Exception {
		CorrelationTable table = RapidCorrelationTest.correlateTables(
				NumericTable.singleColumn("a", new double[] {1, 2, 3, 4, 5}),
				NumericTable.singleColumn("b", new double[] {5, 4, 3, 2, 1}), "pearson", 0, "none");
		StringWriter out = new StringWriter();

		ResultWriter.writeCorrelations(table, out);

		String[] lines = out.toString().split("\n");
		assertThat(lines[0]).isEqualTo("table1\ttable2\tcor\tp_val");
		assertThat(lines[1]).isEqualTo("a\tb\t-1.0\tNA");
	}

	@Test
	void anchorCorrelationsCarryTheAnchor() throws Exception {
		AnchorCorrelations correlations = new AnchorCorrelations(ANCHOR, CorrelationMethod.PEARSON, true,
				List.of(new SiteCorrelation(1200, 0.5, 0.1, 0.2, -200)));
		StringWriter out = new StringWriter();

		ResultWriter.writeAnchorCorrelations(correlations, out);

		assertThat(out.toString().split("\n")).containsExactly(
				"#anchor=tx1\tchr1:1000:-",
				"seqname\tposition\tcor\tp_val\tq_val\tdistance_to_anchor",
				"chr1\t1200\t0.5\t0.1\t0.2\t-200");
	}

	@Test
	void regions() throws Exception {
		Region region = new Region("tx1_tmr_1", "chr1", 900, 980, Direction.NEGATIVE, 4, 20, -3.5, ANCHOR);
		StringWriter out = new StringWriter();

		ResultWriter.writeRegions(List.of(region), out);

		assertThat(out.toString().split("\n")).containsExactly(
				"seqname\tstart\tend\tdirection\tsite_count\tdistance_to_anchor\tanchor_location\tname\tmean_score",
				"chr1\t900\t980\tNegative\t4\t20\tchr1:1000:-\ttx1_tmr_1\t-3.5");
	}

	@Test
	void skippedAnchorsOnly() throws Exception {
		Anchor other = new Anchor("tx2", new GenomicPosition("chr2", 10, Strand.POSITIVE));
		List<AnchorOutcome<String>> outcomes = List.of(
				AnchorOutcome.success(ANCHOR, "ok"),
				AnchorOutcome.failure(other, new NoSitesInWindowException("tx2", "chr2:1-20")));
		StringWriter out = new StringWriter();

		ResultWriter.writeSkippedAnchors(outcomes, out);

		String[] lines = out.toString().split("\n");
		assertThat(lines).hasSize(2);
		assertThat(lines[1]).startsWith("tx2\tchr2:10:+\tNO_SITES_IN_WINDOW\t");
	}
}
