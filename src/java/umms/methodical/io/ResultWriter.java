package umms.methodical.io;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import umms.methodical.anchor.AnchorCorrelations;
import umms.methodical.anchor.AnchorOutcome;
import umms.methodical.anchor.SiteCorrelation;
import umms.methodical.correlation.CorrelationRecord;
import umms.methodical.correlation.CorrelationTable;
import umms.methodical.model.score.ScoreSeries;
import umms.methodical.model.score.SiteScore;
import umms.methodical.region.Region;

/**
 * Writes results as tab-delimited tables with a header line. Undefined values are written as NA.
 */
public class ResultWriter {

	public static final String MISSING = "NA";

	public static void writeCorrelations(CorrelationTable table, Writer bw) throws IOException {
		bw.write(table.getTable1Name() + "\t" + table.getTable2Name() + "\tcor\tp_val");
		if (table.hasQValues()) bw.write("\tq_val");
		bw.write("\n");
		for (CorrelationRecord r : table) {
			bw.write(r.getFeature1() + "\t" + r.getFeature2() + "\t" + format(r.correlationOrNaN()) + "\t" + format(r.pValueOrNaN()));
			if (table.hasQValues()) bw.write("\t" + format(r.qValueOrNaN()));
			bw.write("\n");
		}
		bw.flush();
	}

	/**
	 * The anchor location goes in a comment line ahead of the header
	 */
	public static void writeAnchorCorrelations(AnchorCorrelations correlations, Writer bw) throws IOException {
		bw.write("#anchor=" + correlations.getAnchor().getName() + "\t" + correlations.getAnchor().getLocation().toUCSC() + "\n");
		bw.write("seqname\tposition\tcor\tp_val");
		if (correlations.hasQValues()) bw.write("\tq_val");
		bw.write("\tdistance_to_anchor\n");
		for (SiteCorrelation s : correlations.getSites()) {
			bw.write(correlations.getChr() + "\t" + s.getPosition() + "\t" + format(s.correlationOrNaN()) + "\t" + format(s.pValueOrNaN()));
			if (correlations.hasQValues()) bw.write("\t" + format(s.qValueOrNaN()));
			bw.write("\t" + s.getDistance() + "\n");
		}
		bw.flush();
	}

	public static void writeScores(ScoreSeries series, Writer bw) throws IOException {
		bw.write("#anchor=" + series.getAnchor().getName() + "\t" + series.getAnchor().getLocation().toUCSC() + "\n");
		bw.write("seqname\tposition\tdistance_to_anchor\tmethodical_score\tsmoothed_methodical_score\n");
		for (SiteScore s : series.getScores()) {
			bw.write(series.getChr() + "\t" + s.getPosition() + "\t" + s.getDistance() + "\t" + format(s.rawScoreOrNaN()) + "\t" + format(s.smoothedScoreOrNaN()) + "\n");
		}
		bw.flush();
	}

	public static void writeRegionHeader(Writer bw) throws IOException {
		bw.write("seqname\tstart\tend\tdirection\tsite_count\tdistance_to_anchor\tanchor_location\tname\tmean_score\n");
	}

	public static void writeRegion(Region region, Writer bw) throws IOException {
		bw.write(region.getChr() + "\t" + region.getStart() + "\t" + region.getEnd() + "\t" + region.getDirection() + "\t" + region.getSiteCount()
				+ "\t" + region.getDistanceToAnchor() + "\t" + region.getAnchor().getLocation().toUCSC() + "\t" + region.getName()
				+ "\t" + format(region.getMeanScore()) + "\n");
	}

	public static void writeRegions(List<Region> regions, Writer bw) throws IOException {
		writeRegionHeader(bw);
		for (Region region : regions) writeRegion(region, bw);
		bw.flush();
	}

	public static void writeRegions(List<Region> regions, File file) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(file));
		try {
			writeRegions(regions, bw);
		} finally {
			bw.close();
		}
	}

	/**
	 * One line per anchor that produced no result, with the reason
	 */
	public static <T> void writeSkippedAnchors(List<AnchorOutcome<T>> outcomes, Writer bw) throws IOException {
		bw.write("anchor\tanchor_location\tstatus\tmessage\n");
		for (AnchorOutcome<T> outcome : outcomes) {
			if (outcome.isSuccess()) continue;
			bw.write(outcome.getAnchor().getName() + "\t" + outcome.getAnchor().getLocation().toUCSC() + "\t" + outcome.getStatus() + "\t" + outcome.getMessage() + "\n");
		}
		bw.flush();
	}

	public static String format(double value) {
		return Double.isNaN(value) ? MISSING : Double.toString(value);
	}
}
