package org.iceforge.olap.error;

public class InvalidArgumentException extends OlapException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
