package umms.methodical.exception;

/**
 * Fewer than three samples are shared between the methylation matrix and the feature vector of an anchor.
 */
public class InsufficientSamplesException extends AnchorProcessingException {

	private static final long serialVersionUID = 1L;

	private final int sharedSamples;

	public InsufficientSamplesException(String anchorName, int sharedSamples) {
		super(anchorName, "Only " + sharedSamples + " samples shared between methylation data and feature " + anchorName + ", at least 3 are required");
		this.sharedSamples = sharedSamples;
	}

	public int getSharedSamples() {
		return sharedSamples;
	}
}
