package com.echoboard.realtime.error;

public class StorageException extends RealtimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "storage";
    }
}
