package umms.methodical;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.List;

import org.apache.log4j.Logger;

import umms.methodical.anchor.AnchorOutcome;
import umms.methodical.anchor.WindowParameters;
import umms.methodical.annotation.Anchor;
import umms.methodical.correlation.CorrelationTable;
import umms.methodical.correlation.NumericTable;
import umms.methodical.correlation.RapidCorrelationTest;
import umms.methodical.io.AnchorReader;
import umms.methodical.io.FeatureTableReader;
import umms.methodical.io.MethylationMatrixReader;
import umms.methodical.io.NumericTableReader;
import umms.methodical.io.ResultWriter;
import umms.methodical.math.CorrelationMethod;
import umms.methodical.math.PValueAdjustment;
import umms.methodical.region.Region;
import umms.methodical.region.RegionCallerConfig;
import umms.methodical.storage.FeatureTable;
import umms.methodical.storage.InMemoryMethylationStore;
import umms.methodical.util.CLUtil;
import umms.methodical.util.CLUtil.ArgumentMap;

/**
 * Command line entry point.
 */
public class Methodical {

	static Logger logger = Logger.getLogger(Methodical.class.getName());

	static final String usage = "Usage: Methodical -task <task name> <task args>" +
			"\n\t**************************************************************" +
			"\n\tTask: correlate -- correlate every column of one table with every column of another" +
			"\n\t\t-table1 <tab-delimited file, samples in rows, first column sample names>" +
			"\n\t\t-table2 <tab-delimited file with the same samples in the same order>" +
			"\n\t\t-method <pearson|spearman> [default=pearson]" +
			"\n\t\t-adjust <holm|hochberg|hommel|bonferroni|BH|BY|fdr|none> [default=BH]" +
			"\n\t\t-covariates <number of covariates> [default=0]" +
			"\n\t\t-table1Name <header of table1 feature column> [default=table1]" +
			"\n\t\t-table2Name <header of table2 feature column> [default=table2]" +
			"\n\t\t-threads <n> [default=1]" +
			"\n\t\t-out <output file> [default=standard out]" +
			"\n\t**************************************************************" +
			"\n\tTask: tmrs -- find TMRs around transcription start sites" +
			"\n\t\t-meth <methylation matrix: seqname, position, one column per sample>" +
			"\n\t\t-expr <feature table: feature id, one column per sample>" +
			"\n\t\t-anchors <BED6 file of transcripts, name matching the feature ids>" +
			"\n\t\t-upstream <bp> [default=" + WindowParameters.DEFAULT_EXTENT + "]" +
			"\n\t\t-downstream <bp> [default=" + WindowParameters.DEFAULT_EXTENT + "]" +
			"\n\t\t-method <pearson|spearman> [default=pearson]" +
			"\n\t\t-adjust <adjustment of site P values> [default=BH]" +
			"\n\t\t-covariates <number of covariates> [default=0]" +
			"\n\t\t-pThreshold <P value threshold> [default=" + RegionCallerConfig.DEFAULT_P_VALUE_THRESHOLD + "]" +
			"\n\t\t-smooth <true|false> [default=true]" +
			"\n\t\t-offset <sites on each side of the smoothing window> [default=" + RegionCallerConfig.DEFAULT_OFFSET_LENGTH + "]" +
			"\n\t\t-factor <smoothing factor in (0,1]> [default=" + RegionCallerConfig.DEFAULT_SMOOTHING_FACTOR + "]" +
			"\n\t\t-minSites <minimum sites per TMR> [default=" + RegionCallerConfig.DEFAULT_MIN_METH_SITES + "]" +
			"\n\t\t-minGap <maximum gap in bp merged between TMRs> [default=" + RegionCallerConfig.DEFAULT_MIN_GAPWIDTH + "]" +
			"\n\t\t-threads <n> [default=1]" +
			"\n\t\t-skipped <file listing anchors without results> (optional)" +
			"\n\t\t-correlations <file of per-site correlations for every anchor with results> (optional)" +
			"\n\t\t-scores <file of per-site raw and smoothed scores for every anchor with results> (optional)" +
			"\n\t\t-out <output file> [default=standard out]";

	public static void main(String[] args) {
		try {
			run(args);
		} catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.exit(1);
		} catch (IOException e) {
			logger.error("Failed reading or writing files", e);
			System.exit(2);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted", e);
			System.exit(3);
		}
	}

	static void run(String[] args) throws IOException, InterruptedException {
		ArgumentMap argMap = CLUtil.getParameters(args, usage);
		String task = argMap.getTask();
		if ("correlate".equalsIgnoreCase(task)) {
			correlate(argMap);
		} else if ("tmrs".equalsIgnoreCase(task)) {
			findTMRs(argMap);
		} else {
			throw new IllegalArgumentException("Unknown task " + task + "\n" + usage);
		}
	}

	static void correlate(ArgumentMap argMap) throws IOException {
		CorrelationMethod method = CorrelationMethod.fromName(argMap.get("method", "pearson"));
		PValueAdjustment adjustment = PValueAdjustment.fromName(argMap.get("adjust", "BH"));
		RapidCorrelationTest test = new RapidCorrelationTest(method, adjustment, argMap.getInteger("covariates", 0), argMap.getInteger("threads", 1),
				argMap.get("table1Name", RapidCorrelationTest.DEFAULT_TABLE1_NAME), argMap.get("table2Name", RapidCorrelationTest.DEFAULT_TABLE2_NAME));

		NumericTable table1 = NumericTableReader.read(new File(argMap.getMandatory("table1")));
		NumericTable table2 = NumericTableReader.read(new File(argMap.getMandatory("table2")));
		logger.info("Correlating " + table1.getNumColumns() + " x " + table2.getNumColumns() + " features over " + table1.getNumRows() + " samples using " + method);
		CorrelationTable result = test.correlate(table1, table2);

		BufferedWriter bw = argMap.getOutputWriter();
		try {
			ResultWriter.writeCorrelations(result, bw);
		} finally {
			if (argMap.isOutputSet()) bw.close();
			else bw.flush();
		}
	}

	static void findTMRs(ArgumentMap argMap) throws IOException, InterruptedException {
		CorrelationMethod method = CorrelationMethod.fromName(argMap.get("method", "pearson"));
		PValueAdjustment adjustment = PValueAdjustment.fromName(argMap.get("adjust", "BH"));
		WindowParameters windowParams = new WindowParameters(argMap.getInteger("upstream", WindowParameters.DEFAULT_EXTENT),
				argMap.getInteger("downstream", WindowParameters.DEFAULT_EXTENT), argMap.getInteger("covariates", 0), adjustment);
		RegionCallerConfig regionConfig = new RegionCallerConfig(argMap.getDouble("pThreshold", RegionCallerConfig.DEFAULT_P_VALUE_THRESHOLD),
				argMap.getBoolean("smooth", true), argMap.getInteger("offset", RegionCallerConfig.DEFAULT_OFFSET_LENGTH),
				argMap.getDouble("factor", RegionCallerConfig.DEFAULT_SMOOTHING_FACTOR), argMap.getInteger("minSites", RegionCallerConfig.DEFAULT_MIN_METH_SITES),
				argMap.getInteger("minGap", RegionCallerConfig.DEFAULT_MIN_GAPWIDTH));
		int threads = argMap.getInteger("threads", 1);

		InMemoryMethylationStore store = MethylationMatrixReader.read(new File(argMap.getMandatory("meth")));
		FeatureTable features = FeatureTableReader.read(new File(argMap.getMandatory("expr")));
		List<Anchor> anchors = AnchorReader.read(new File(argMap.getMandatory("anchors")));
		logger.info("Using window: upstream " + windowParams.getUpstream() + " downstream " + windowParams.getDownstream() + " method " + method
				+ " P value threshold " + regionConfig.getPValueThreshold() + " smoothing " + regionConfig.isSmooth() + " threads " + threads);

		TMRFinder finder = new TMRFinder(store, windowParams, method, regionConfig);
		List<AnchorOutcome<AnchorTMRs>> outcomes = finder.findTMRs(anchors, features, threads);
		List<Region> regions = TMRFinder.collectRegions(outcomes);
		logger.info("Found " + regions.size() + " TMRs around " + anchors.size() + " anchors");

		BufferedWriter bw = argMap.getOutputWriter();
		try {
			ResultWriter.writeRegions(regions, bw);
		} finally {
			if (argMap.isOutputSet()) bw.close();
			else bw.flush();
		}

		if (argMap.isPresent("correlations")) {
			BufferedWriter correlations = new BufferedWriter(new FileWriter(argMap.getMandatory("correlations")));
			try {
				for (AnchorOutcome<AnchorTMRs> outcome : outcomes) {
					if (outcome.isSuccess()) ResultWriter.writeAnchorCorrelations(outcome.getResult().getCorrelations(), correlations);
				}
			} finally {
				correlations.close();
			}
		}

		if (argMap.isPresent("scores")) {
			BufferedWriter scores = new BufferedWriter(new FileWriter(argMap.getMandatory("scores")));
			try {
				for (AnchorOutcome<AnchorTMRs> outcome : outcomes) {
					if (outcome.isSuccess()) ResultWriter.writeScores(outcome.getResult().getScores(), scores);
				}
			} finally {
				scores.close();
			}
		}

		if (argMap.isPresent("skipped")) {
			BufferedWriter skipped = new BufferedWriter(new FileWriter(argMap.getMandatory("skipped")));
			try {
				ResultWriter.writeSkippedAnchors(outcomes, skipped);
			} finally {
				skipped.close();
			}
		}
	}
}
