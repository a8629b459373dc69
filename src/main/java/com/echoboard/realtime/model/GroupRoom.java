package com.echoboard.realtime.model;

public record GroupRoom(
    long id,
    String slug,
    String title
) {}
