package umms.methodical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import umms.methodical.exception.InvalidMethodException;

class MethodicalTest {

	@TempDir
	File dir;

	@Test
	void tmrsTask() throws Exception {
		File out = new File(dir, "tmrs.tsv");
		File skipped = new File(dir, "skipped.tsv");
		File scores = new File(dir, "scores.tsv");
		File correlations = new File(dir, "correlations.tsv");

		Methodical.run(new String[] {"-task", "tmrs",
				"-meth", MethodicalFixtures.writeMethylation(dir).getPath(),
				"-expr", MethodicalFixtures.writeExpression(dir).getPath(),
				"-anchors", MethodicalFixtures.writeAnchors(dir).getPath(),
				"-upstream", "300", "-downstream", "300",
				"-smooth", "false", "-threads", "2",
				"-skipped", skipped.getPath(),
				"-scores", scores.getPath(),
				"-correlations", correlations.getPath(),
				"-out", out.getPath()});

		List<String> lines = FileUtils.readLines(out, StandardCharsets.UTF_8);
		assertThat(lines).hasSize(2);
		assertThat(lines.get(1)).startsWith("chr1\t1000\t1100\tNegative\t6\t0\tchr1:1000:+\ttx1_tmr_1\t");

		List<String> skippedLines = FileUtils.readLines(skipped, StandardCharsets.UTF_8);
		assertThat(skippedLines).hasSize(3);
		assertThat(skippedLines.get(1)).startsWith("tx2\tchr1:50000:-\tNO_SITES_IN_WINDOW");
		assertThat(skippedLines.get(2)).startsWith("tx3\tchr1:1000:+\tMISSING_FEATURE");

		List<String> scoreLines = FileUtils.readLines(scores, StandardCharsets.UTF_8);
		assertThat(scoreLines.get(0)).isEqualTo("#anchor=tx1\tchr1:1000:+");
		assertThat(scoreLines.get(1)).isEqualTo("seqname\tposition\tdistance_to_anchor\tmethodical_score\tsmoothed_methodical_score");
		assertThat(scoreLines).filteredOn(line -> line.startsWith("#anchor=")).hasSize(1);
		assertThat(scoreLines.subList(2, scoreLines.size())).isNotEmpty().allSatisfy(line -> assertThat(line).startsWith("chr1\t"));

		List<String> correlationLines = FileUtils.readLines(correlations, StandardCharsets.UTF_8);
		assertThat(correlationLines.get(0)).isEqualTo("#anchor=tx1\tchr1:1000:+");
		assertThat(correlationLines).hasSameSizeAs(scoreLines);
	}

	@Test
	void correlateTask() throws Exception {
		File table1 = new File(dir, "t1.tsv");
		File table2 = new File(dir, "t2.tsv");
		FileUtils.writeStringToFile(table1, "sample\tx\ns1\t1\ns2\t2\ns3\t3\ns4\t4\ns5\t5\n", StandardCharsets.UTF_8);
		FileUtils.writeStringToFile(table2, "sample\ty\tz\ns1\t5\t1\ns2\t4\t3\ns3\t3\t2\ns4\t2\t5\ns5\t1\t4\n", StandardCharsets.UTF_8);
		File out = new File(dir, "cor.tsv");

		Methodical.run(new String[] {"-task", "correlate", "-table1", table1.getPath(), "-table2", table2.getPath(),
				"-table1Name", "gene", "-table2Name", "site", "-adjust", "bonferroni", "-out", out.getPath()});

		List<String> lines = FileUtils.readLines(out, StandardCharsets.UTF_8);
		assertThat(lines.get(0)).isEqualTo("gene\tsite\tcor\tp_val\tq_val");
		assertThat(lines).hasSize(3);
		assertThat(lines.get(1)).isEqualTo("x\ty\t-1.0\tNA\tNA");
		String[] xz = lines.get(2).split("\t");
		assertThat(xz[1]).isEqualTo("z");
		assertThat(Double.parseDouble(xz[2])).isCloseTo(0.8, within(1e-12));
		assertThat(Double.parseDouble(xz[4])).isBetween(Double.parseDouble(xz[3]), 1.0);
	}

	@Test
	void badArguments() {
		assertThatThrownBy(() -> Methodical.run(new String[] {"-task", "nope"})).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Methodical.run(new String[] {"-task", "correlate", "-method", "kendall", "-table1", "a", "-table2", "b"}))
				.isInstanceOf(InvalidMethodException.class);
	}
}
