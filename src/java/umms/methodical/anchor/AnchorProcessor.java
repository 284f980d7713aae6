package umms.methodical.anchor;

import umms.methodical.annotation.Anchor;
import umms.methodical.exception.AnchorProcessingException;
import umms.methodical.storage.FeatureVector;

/**
 * Work done for a single anchor. Implementations must not share mutable state between anchors,
 * the batch may call them from several threads at once.
 */
public interface AnchorProcessor<T> {

	public T processAnchor(Anchor anchor, FeatureVector features) throws AnchorProcessingException;
}
