package co.fanki.citationtree.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the domain model.
 *
 * <p>Value objects are immutable, compared by their attributes and
 * validated on construction. Records are the preferred implementation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
