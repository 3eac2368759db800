package org.iceforge.olap.error;

public class UnknownFieldException extends OlapException {

    public UnknownFieldException(String message) {
        super(message);
    }
}
