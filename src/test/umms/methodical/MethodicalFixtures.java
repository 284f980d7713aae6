package umms.methodical;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;

import umms.methodical.storage.FeatureTable;
import umms.methodical.storage.InMemoryMethylationStore;

/**
 * Ten samples, one transcript (tx1, TSS chr1:1000 on the plus strand) whose expression rises 1..10 across samples.
 * Sites every 20bp from 800 to 1180; the six sites from 1000 to 1100 lose methylation as expression rises,
 * the others carry noise uncorrelated with expression.
 */
final class MethodicalFixtures {

	static final int NUM_SAMPLES = 10;
	static final int SIGNAL_START = 1000;
	static final int SIGNAL_END = 1100;

	private static final double[][] NOISE = {
			{0.3, 0.7, 0.7, 0.3, 0.3, 0.7, 0.7, 0.3, 0.3, 0.7},
			{0.6, 0.2, 0.5, 0.9, 0.1, 0.8, 0.4, 0.3, 0.7, 0.5},
			{0.4, 0.6, 0.2, 0.8, 0.5, 0.5, 0.9, 0.1, 0.3, 0.7}};

	private MethodicalFixtures() {}

	static List<String> samples() {
		List<String> rtrn = new ArrayList<String>();
		for (int i = 1; i <= NUM_SAMPLES; i++) rtrn.add("s" + i);
		return rtrn;
	}

	static int[] positions() {
		int[] rtrn = new int[20];
		for (int k = -10; k < 10; k++) rtrn[k + 10] = SIGNAL_START + 20 * k;
		return rtrn;
	}

	static double[] siteValues(int position) {
		int k = (position - SIGNAL_START) / 20;
		double[] values = new double[NUM_SAMPLES];
		for (int i = 1; i <= NUM_SAMPLES; i++) {
			if (position >= SIGNAL_START && position <= SIGNAL_END) {
				values[i - 1] = 1 - i / 10.0 + 0.01 * ((i + k) % 3);
			} else {
				values[i - 1] = NOISE[(k + 10) % 3][i - 1];
			}
		}
		return values;
	}

	static double[] expression() {
		double[] rtrn = new double[NUM_SAMPLES];
		for (int i = 0; i < NUM_SAMPLES; i++) rtrn[i] = i + 1;
		return rtrn;
	}

	static InMemoryMethylationStore store() {
		InMemoryMethylationStore.Builder builder = new InMemoryMethylationStore.Builder(samples());
		for (int position : positions()) builder.addSite("chr1", position, siteValues(position));
		return builder.build();
	}

	static FeatureTable features() {
		Map<String, double[]> rows = new LinkedHashMap<String, double[]>();
		rows.put("tx1", expression());
		rows.put("tx2", expression());
		return new FeatureTable(samples(), rows);
	}

	static File writeMethylation(File dir) throws IOException {
		StringBuilder sb = new StringBuilder("seqname\tposition");
		for (String sample : samples()) sb.append('\t').append(sample);
		sb.append('\n');
		for (int position : positions()) {
			sb.append("chr1\t").append(position);
			for (double v : siteValues(position)) sb.append('\t').append(v);
			sb.append('\n');
		}
		File file = new File(dir, "meth.tsv");
		FileUtils.writeStringToFile(file, sb.toString(), StandardCharsets.UTF_8);
		return file;
	}

	static File writeExpression(File dir) throws IOException {
		StringBuilder sb = new StringBuilder("feature_id");
		for (String sample : samples()) sb.append('\t').append(sample);
		sb.append('\n');
		for (String tx : new String[] {"tx1", "tx2"}) {
			sb.append(tx);
			for (double v : expression()) sb.append('\t').append(v);
			sb.append('\n');
		}
		File file = new File(dir, "expr.tsv");
		FileUtils.writeStringToFile(file, sb.toString(), StandardCharsets.UTF_8);
		return file;
	}

	/**
	 * tx1 over the signal, tx2 on the minus strand far from any site, tx3 without expression
	 */
	static File writeAnchors(File dir) throws IOException {
		String bed = "# transcripts\n"
				+ "chr1\t999\t2000\ttx1\t0\t+\n"
				+ "chr1\t40000\t50000\ttx2\t0\t-\n"
				+ "chr1\t999\t2000\ttx3\t0\t+\n";
		File file = new File(dir, "anchors.bed");
		FileUtils.writeStringToFile(file, bed, StandardCharsets.UTF_8);
		return file;
	}
}
