package com.echoboard.realtime.model;

// A file previously uploaded to the board; "stored" is the server-side file name.
public record Attachment(
    String name,
    String stored,
    String mime
) {}
