package com.echoboard.realtime.model;

public record NewCard(
    String author,
    String text,
    String tag,
    String attachmentPath
) {}
