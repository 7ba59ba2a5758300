package com.cratemind.core.llm;

/**
 * Thrown when a call to a text-generation backend fails: network error, rejected
 * credentials, rate limiting, or a reply envelope with no text in it.
 */
public class BackendTransportException extends RuntimeException {

    public BackendTransportException(String message) {
        super(message);
    }

    public BackendTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
