package com.xmile.codec.xml;

public final class SerializeException extends Exception {
    public SerializeException(String message) {
        super(message);
    }

    public SerializeException(String message, Throwable cause) {
        super(message, cause);
    }
}
