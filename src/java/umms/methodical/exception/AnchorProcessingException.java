package umms.methodical.exception;

/**
 * Base class for failures that only affect a single anchor. Callers processing a batch of anchors
 * record these and move on to the next anchor.
 */
public abstract class AnchorProcessingException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String anchorName;

	protected AnchorProcessingException(String anchorName, String message) {
		super(message);
		this.anchorName = anchorName;
	}

	public String getAnchorName() {
		return anchorName;
	}
}
