package umms.methodical.anchor;

import umms.methodical.annotation.Anchor;
import umms.methodical.exception.AnchorProcessingException;
import umms.methodical.exception.InsufficientSamplesException;
import umms.methodical.exception.NoSitesInWindowException;

/**
 * What happened to one anchor of a batch: a result, or the reason there is none.
 */
public final class AnchorOutcome<T> {

	public enum Status {
		SUCCESS, NO_SITES_IN_WINDOW, INSUFFICIENT_SAMPLES, MISSING_FEATURE, FAILED
	}

	private final Anchor anchor;
	private final Status status;
	private final T result;
	private final String message;

	private AnchorOutcome(Anchor anchor, Status status, T result, String message) {
		this.anchor = anchor;
		this.status = status;
		this.result = result;
		this.message = message;
	}

	public static <T> AnchorOutcome<T> success(Anchor anchor, T result) {
		return new AnchorOutcome<T>(anchor, Status.SUCCESS, result, null);
	}

	public static <T> AnchorOutcome<T> missingFeature(Anchor anchor) {
		return new AnchorOutcome<T>(anchor, Status.MISSING_FEATURE, null, "No feature values for " + anchor.getName());
	}

	public static <T> AnchorOutcome<T> failure(Anchor anchor, Throwable t) {
		Status status = Status.FAILED;
		if (t instanceof NoSitesInWindowException) status = Status.NO_SITES_IN_WINDOW;
		else if (t instanceof InsufficientSamplesException) status = Status.INSUFFICIENT_SAMPLES;
		String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
		return new AnchorOutcome<T>(anchor, status, null, message);
	}

	public Anchor getAnchor() {
		return anchor;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isSuccess() {
		return status == Status.SUCCESS;
	}

	/**
	 * @return the result, null unless the anchor was processed successfully
	 */
	public T getResult() {
		return result;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return true for failures that only mean there was nothing to compute for this anchor
	 */
	public boolean isSkipped() {
		return status == Status.NO_SITES_IN_WINDOW || status == Status.INSUFFICIENT_SAMPLES || status == Status.MISSING_FEATURE;
	}

	public String toString() {
		return anchor.getName() + "\t" + status + (message == null ? "" : "\t" + message);
	}

	static boolean isAnchorFailure(Throwable t) {
		return t instanceof AnchorProcessingException;
	}
}
