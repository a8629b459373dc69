package com.echoboard.realtime.store.client;

public record MessagePatch(
    String text,        // set together with edited_at
    Boolean deleted     // true soft-deletes the message
) {
    public static MessagePatch edit(String text) {
        return new MessagePatch(text, null);
    }

    public static MessagePatch delete() {
        return new MessagePatch(null, true);
    }
}
