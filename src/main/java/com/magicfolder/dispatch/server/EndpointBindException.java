package com.magicfolder.dispatch.server;

/**
 * The server could not bind its endpoint. Fatal at startup.
 */
public class EndpointBindException extends RuntimeException {
    public EndpointBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
