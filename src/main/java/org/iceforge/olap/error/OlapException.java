package org.iceforge.olap.error;

/**
 * Base type of every failure the engine reports. Arithmetic degeneracy (empty groups, division by zero,
 * all-NULL columns) is never reported this way; it surfaces as NULL cells instead.
 */
public class OlapException extends RuntimeException {

    public OlapException(String message) {
        super(message);
    }

    public OlapException(String message, Throwable cause) {
        super(message, cause);
    }
}
