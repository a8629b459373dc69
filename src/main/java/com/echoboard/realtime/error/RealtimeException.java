package com.echoboard.realtime.error;

/**
 * Base of every failure a realtime handler reports back to the originating connection.
 * {@link #kind()} is the wire value of the {@code error} event's {@code kind} field.
 */
public abstract class RealtimeException extends RuntimeException {

    protected RealtimeException(String message) {
        super(message);
    }

    protected RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();
}
