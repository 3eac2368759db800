package org.iceforge.olap.error;

/**
 * A requested field lives on a table the dataset cannot reach through exactly one registered join path.
 */
public class AmbiguousJoinException extends OlapException {

    public AmbiguousJoinException(String message) {
        super(message);
    }
}
