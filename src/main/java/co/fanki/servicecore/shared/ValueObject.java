package co.fanki.servicecore.shared;

import java.io.Serializable;

/**
 * Marker interface for immutable values compared by their attributes.
 *
 * <p>Implementations validate themselves on construction and never change
 * afterwards.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
