package org.iceforge.olap.error;

public class MalformedInputException extends OlapException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
