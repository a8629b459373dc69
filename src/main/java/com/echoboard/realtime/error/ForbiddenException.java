package com.echoboard.realtime.error;

// Raised for missing identity or insufficient role. The message never says which rule failed.
public class ForbiddenException extends RealtimeException {

    private ForbiddenException(String message) {
        super(message);
    }

    public static ForbiddenException noPermission() {
        return new ForbiddenException("no permission");
    }

    public static ForbiddenException authRequired() {
        return new ForbiddenException("auth required");
    }

    @Override
    public String kind() {
        return "forbidden";
    }
}
