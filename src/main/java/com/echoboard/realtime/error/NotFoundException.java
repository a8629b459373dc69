package com.echoboard.realtime.error;

public class NotFoundException extends RealtimeException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "not_found";
    }
}
