package umms.methodical.exception;

/**
 * There are no methylation sites in the window around an anchor.
 */
public class NoSitesInWindowException extends AnchorProcessingException {

	private static final long serialVersionUID = 1L;

	public NoSitesInWindowException(String anchorName, String window) {
		super(anchorName, "No methylation sites found in " + window + " around " + anchorName);
	}
}
