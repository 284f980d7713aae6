package umms.methodical.anchor;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import umms.methodical.annotation.Anchor;
import umms.methodical.correlation.CorrelationTable;
import umms.methodical.correlation.NumericTable;
import umms.methodical.correlation.RapidCorrelationTest;
import umms.methodical.exception.InsufficientSamplesException;
import umms.methodical.exception.NoSitesInWindowException;
import umms.methodical.math.CorrelationMethod;
import umms.methodical.storage.FeatureVector;
import umms.methodical.storage.MethylationStore;
import umms.methodical.storage.SiteValueMatrix;
import umms.methodical.window.SiteWindow;
import umms.methodical.window.WindowSelector;
import umms.methodical.window.WindowedSite;

/**
 * Correlates the methylation of every site in the window around an anchor with the anchor's feature values.
 */
public class AnchorCorrelationCalculator {

	static Logger logger = Logger.getLogger(AnchorCorrelationCalculator.class.getName());

	public static final int MIN_SAMPLES = 3;

	private final MethylationStore store;
	private final WindowParameters windowParams;
	private final CorrelationMethod method;

	public AnchorCorrelationCalculator(MethylationStore store, WindowParameters windowParams, CorrelationMethod method) {
		this.store = store;
		this.windowParams = windowParams;
		this.method = method;
	}

	/**
	 * @throws NoSitesInWindowException if no site falls in the anchor's window
	 * @throws InsufficientSamplesException if fewer than three samples are shared by the store and the feature vector
	 */
	public AnchorCorrelations compute(FeatureVector features, Anchor anchor) throws NoSitesInWindowException, InsufficientSamplesException {
		return compute(store, features, anchor, windowParams, method);
	}

	public static AnchorCorrelations compute(MethylationStore store, FeatureVector features, Anchor anchor, WindowParameters windowParams, CorrelationMethod method)
			throws NoSitesInWindowException, InsufficientSamplesException {
		int[] sampleColumns = sharedSampleColumns(store.getSampleNames(), features);
		if (sampleColumns.length < MIN_SAMPLES) {
			throw new InsufficientSamplesException(anchor.getName(), sampleColumns.length);
		}

		SiteWindow window = WindowSelector.select(store, anchor, windowParams.getUpstream(anchor), windowParams.getDownstream(anchor));
		if (window.isEmpty()) {
			throw new NoSitesInWindowException(anchor.getName(), window.toUCSC());
		}

		SiteValueMatrix matrix = store.getSiteValues(window.getChr(), window.getBounds().getStart(), window.getBounds().getEnd());
		if (matrix.getNumSites() != window.size()) {
			throw new IllegalStateException("Store returned " + matrix.getNumSites() + " sites for " + window.toUCSC() + " but its index holds " + window.size());
		}

		List<String> siteNames = new ArrayList<String>(matrix.getNumSites());
		double[][] columns = new double[matrix.getNumSites()][];
		for (int s = 0; s < matrix.getNumSites(); s++) {
			siteNames.add(window.getChr() + ":" + matrix.getPosition(s));
			columns[s] = matrix.getSiteValues(s, sampleColumns);
		}
		double[] featureValues = new double[sampleColumns.length];
		for (int i = 0; i < sampleColumns.length; i++) {
			featureValues[i] = features.getValue(store.getSampleNames().get(sampleColumns[i]));
		}

		RapidCorrelationTest test = new RapidCorrelationTest(method, windowParams.getAdjustment(), windowParams.getNumCovariates());
		CorrelationTable table = test.correlate(new NumericTable(siteNames, columns), NumericTable.singleColumn(features.getFeatureId(), featureValues));

		List<SiteCorrelation> sites = new ArrayList<SiteCorrelation>(window.size());
		for (int s = 0; s < window.size(); s++) {
			WindowedSite site = window.getSites().get(s);
			double q = table.get(s, 0).qValueOrNaN();
			sites.add(new SiteCorrelation(site.getPosition(), table.get(s, 0).correlationOrNaN(), table.get(s, 0).pValueOrNaN(), q, site.getDistance()));
		}
		logger.debug(anchor + ": correlated " + sites.size() + " sites over " + sampleColumns.length + " samples");
		return new AnchorCorrelations(anchor, method, table.hasQValues(), sites);
	}

	/**
	 * @return the store's columns whose sample also appears in the feature vector, in store order
	 */
	static int[] sharedSampleColumns(List<String> storeSamples, FeatureVector features) {
		List<Integer> shared = new ArrayList<Integer>();
		for (int i = 0; i < storeSamples.size(); i++) {
			if (features.hasSample(storeSamples.get(i))) shared.add(i);
		}
		int[] rtrn = new int[shared.size()];
		for (int i = 0; i < rtrn.length; i++) rtrn[i] = shared.get(i);
		return rtrn;
	}
}
