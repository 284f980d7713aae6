package umms.methodical.storage;

import java.util.List;

/**
 * Read access to a methylation matrix indexed by genomic site and sample.
 * Implementations must allow concurrent reads of overlapping windows.
 */
public interface MethylationStore {

	/**
	 * @return sample names in column order
	 */
	public List<String> getSampleNames();

	/**
	 * @return names of the sequences that have at least one site
	 */
	public List<String> getSequenceNames();

	/**
	 * @return sorted positions of the sites on chr, empty if the sequence is unknown
	 */
	public int[] getSiteIndex(String chr);

	/**
	 * Values for the sites with start <= position <= end on chr
	 */
	public SiteValueMatrix getSiteValues(String chr, int start, int end);
}
