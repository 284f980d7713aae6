package umms.methodical.anchor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import umms.methodical.annotation.Anchor;
import umms.methodical.storage.FeatureTable;
import umms.methodical.storage.FeatureVector;

/**
 * Runs an {@link AnchorProcessor} over many anchors on a fixed size thread pool.
 * Outcomes are returned in the order the anchors were given, whatever order they finish in,
 * and a failing anchor is reported in its outcome rather than stopping the batch.
 */
public class AnchorBatch<T> {

	static Logger logger = Logger.getLogger(AnchorBatch.class.getName());

	private final AnchorProcessor<T> processor;
	private final int numberThreads;

	public AnchorBatch(AnchorProcessor<T> processor, int numberThreads) {
		if (numberThreads < 1) {
			throw new IllegalArgumentException("Number of threads must be at least 1: " + numberThreads);
		}
		this.processor = processor;
		this.numberThreads = numberThreads;
	}

	/**
	 * Pairs each anchor with the feature of the same name in the table
	 */
	public List<AnchorOutcome<T>> run(List<Anchor> anchors, FeatureTable features) throws InterruptedException {
		List<FeatureVector> vectors = new ArrayList<FeatureVector>(anchors.size());
		for (Anchor anchor : anchors) {
			vectors.add(features.getFeatureVector(anchor.getName()));
		}
		return run(anchors, vectors);
	}

	/**
	 * @param vectors feature values for each anchor, same length as anchors; a null entry marks a missing feature
	 */
	public List<AnchorOutcome<T>> run(List<Anchor> anchors, List<FeatureVector> vectors) throws InterruptedException {
		if (anchors.size() != vectors.size()) {
			throw new IllegalArgumentException(anchors.size() + " anchors given with " + vectors.size() + " feature vectors");
		}
		ExecutorService executor = Executors.newFixedThreadPool(numberThreads);
		List<Future<T>> futures = new ArrayList<Future<T>>(anchors.size());
		try {
			for (int i = 0; i < anchors.size(); i++) {
				final Anchor anchor = anchors.get(i);
				final FeatureVector features = vectors.get(i);
				if (features == null) {
					futures.add(null);
					continue;
				}
				futures.add(executor.submit(new Callable<T>() {
					public T call() throws Exception {
						return processor.processAnchor(anchor, features);
					}
				}));
			}

			List<AnchorOutcome<T>> outcomes = new ArrayList<AnchorOutcome<T>>(anchors.size());
			int succeeded = 0;
			for (int i = 0; i < anchors.size(); i++) {
				AnchorOutcome<T> outcome = collect(anchors.get(i), futures.get(i));
				if (outcome.isSuccess()) {
					succeeded++;
				} else if (outcome.isSkipped()) {
					logger.debug("Skipping " + outcome);
				} else {
					logger.warn("Failed processing anchor " + outcome);
				}
				outcomes.add(outcome);
			}
			logger.info("Processed " + anchors.size() + " anchors, " + succeeded + " succeeded");
			return outcomes;
		} finally {
			executor.shutdownNow();
		}
	}

	private AnchorOutcome<T> collect(Anchor anchor, Future<T> future) throws InterruptedException {
		if (future == null) {
			return AnchorOutcome.missingFeature(anchor);
		}
		try {
			return AnchorOutcome.success(anchor, future.get());
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() == null ? e : e.getCause();
			if (!AnchorOutcome.isAnchorFailure(cause)) {
				logger.error("Unexpected error processing " + anchor, cause);
			}
			return AnchorOutcome.failure(anchor, cause);
		}
	}

	/**
	 * @return the results of the successful outcomes, in anchor order
	 */
	public static <T> List<T> successfulResults(List<AnchorOutcome<T>> outcomes) {
		List<T> rtrn = new ArrayList<T>();
		for (AnchorOutcome<T> outcome : outcomes) {
			if (outcome.isSuccess()) rtrn.add(outcome.getResult());
		}
		return rtrn;
	}
}
