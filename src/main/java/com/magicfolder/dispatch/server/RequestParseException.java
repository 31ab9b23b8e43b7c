package com.magicfolder.dispatch.server;

/**
 * Thrown when an incoming message is not a usable classification request.
 * The message becomes the {@code error} field of the reply.
 */
public class RequestParseException extends RuntimeException {
    public RequestParseException(String message) {
        super(message);
    }

    public RequestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
