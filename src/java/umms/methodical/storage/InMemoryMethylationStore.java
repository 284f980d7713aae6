package umms.methodical.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.log4j.Logger;

/**
 * Methylation matrix held in memory, one block of rows per sequence.
 * Instances are immutable once built so they may be shared between threads.
 */
public class InMemoryMethylationStore implements MethylationStore {

	static Logger logger = Logger.getLogger(InMemoryMethylationStore.class.getName());

	private final List<String> sampleNames;
	private final Map<String, Block> blocks;

	private InMemoryMethylationStore(List<String> sampleNames, Map<String, Block> blocks) {
		this.sampleNames = List.copyOf(sampleNames);
		this.blocks = Collections.unmodifiableMap(blocks);
	}

	@Override
	public List<String> getSampleNames() {
		return sampleNames;
	}

	@Override
	public List<String> getSequenceNames() {
		return new ArrayList<String>(blocks.keySet());
	}

	@Override
	public int[] getSiteIndex(String chr) {
		Block block = blocks.get(chr);
		return block == null ? new int[0] : block.positions.clone();
	}

	@Override
	public SiteValueMatrix getSiteValues(String chr, int start, int end) {
		Block block = blocks.get(chr);
		if (block == null || end < start) {
			return new SiteValueMatrix(chr, new int[0], sampleNames, new double[0][]);
		}
		int from = lowerBound(block.positions, start);
		int to = lowerBound(block.positions, end + 1);
		int[] positions = Arrays.copyOfRange(block.positions, from, to);
		double[][] values = new double[to - from][];
		for (int i = from; i < to; i++) {
			values[i - from] = block.values[i].clone();
		}
		return new SiteValueMatrix(chr, positions, sampleNames, values);
	}

	/**
	 * @return index of the first element >= key
	 */
	static int lowerBound(int[] sorted, int key) {
		int lo = 0, hi = sorted.length;
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (sorted[mid] < key) lo = mid + 1;
			else hi = mid;
		}
		return lo;
	}

	public int getNumSites() {
		int total = 0;
		for (Block b : blocks.values()) total += b.positions.length;
		return total;
	}

	private static final class Block {
		final int[] positions;
		final double[][] values;

		Block(int[] positions, double[][] values) {
			this.positions = positions;
			this.values = values;
		}
	}

	/**
	 * Collects sites in any order; {@link #build()} sorts them per sequence.
	 */
	public static class Builder {
		private final List<String> sampleNames;
		private final Map<String, TreeMap<Integer, double[]>> sites = new LinkedHashMap<String, TreeMap<Integer, double[]>>();

		public Builder(List<String> sampleNames) {
			if (sampleNames.isEmpty()) {
				throw new IllegalArgumentException("At least one sample is required");
			}
			this.sampleNames = new ArrayList<String>(sampleNames);
		}

		/**
		 * @param values one value per sample, NaN for missing
		 */
		public Builder addSite(String chr, int position, double[] values) {
			if (values.length != sampleNames.size()) {
				throw new IllegalArgumentException("Site " + chr + ":" + position + " has " + values.length + " values, expected " + sampleNames.size());
			}
			TreeMap<Integer, double[]> chrSites = sites.get(chr);
			if (chrSites == null) {
				chrSites = new TreeMap<Integer, double[]>();
				sites.put(chr, chrSites);
			}
			if (chrSites.put(position, values.clone()) != null) {
				logger.warn("Duplicate site " + chr + ":" + position + ", keeping the last values");
			}
			return this;
		}

		public InMemoryMethylationStore build() {
			Map<String, Block> blocks = new LinkedHashMap<String, Block>();
			for (Map.Entry<String, TreeMap<Integer, double[]>> entry : sites.entrySet()) {
				TreeMap<Integer, double[]> chrSites = entry.getValue();
				int[] positions = new int[chrSites.size()];
				double[][] values = new double[chrSites.size()][];
				int i = 0;
				for (Map.Entry<Integer, double[]> site : chrSites.entrySet()) {
					positions[i] = site.getKey();
					values[i] = site.getValue();
					i++;
				}
				blocks.put(entry.getKey(), new Block(positions, values));
			}
			return new InMemoryMethylationStore(sampleNames, blocks);
		}
	}
}
