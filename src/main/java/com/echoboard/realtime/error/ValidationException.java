package com.echoboard.realtime.error;

public class ValidationException extends RealtimeException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "validation";
    }
}
